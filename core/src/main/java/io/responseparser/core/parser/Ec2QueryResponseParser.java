package io.responseparser.core.parser;

import io.responseparser.core.model.HttpResponse;
import io.responseparser.core.model.ParsedResponse;
import io.responseparser.core.model.Shape;
import io.responseparser.core.spi.TimestampParser;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Parser for the {@code ec2} protocol. Bodies decode exactly as in {@code query}, but the request
 * id is a top-level {@code <requestId>} and errors use a different envelope:
 *
 * <pre>
 * &lt;Response&gt;
 *   &lt;Errors&gt;&lt;Error&gt;&lt;Code&gt;...&lt;/Code&gt;&lt;Message&gt;...&lt;/Message&gt;&lt;/Error&gt;&lt;/Errors&gt;
 *   &lt;RequestID&gt;...&lt;/RequestID&gt;
 * &lt;/Response&gt;
 * </pre>
 *
 * <p>
 * Only one {@code <Error>} per response is supported; when several are present the first is
 * returned and the rest are dropped with a warning.
 */
public final class Ec2QueryResponseParser extends QueryResponseParser {

    private static final Logger LOG = LoggerFactory.getLogger(Ec2QueryResponseParser.class);

    private static final String REQUEST_ID_LOWER = "requestId";
    private static final String REQUEST_ID_UPPER = "RequestID";
    private static final String ERRORS = "Errors";

    public Ec2QueryResponseParser() {
        super();
    }

    public Ec2QueryResponseParser(TimestampParser timestampParser) {
        super(timestampParser);
    }

    @Override
    public String protocol() {
        return ProtocolRegistry.EC2;
    }

    @Override
    protected Map<String, Object> successMetadata(Element root) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        List<Element> requestId = XmlDocuments.indexChildren(root).get(REQUEST_ID_LOWER);
        if (requestId != null) {
            metadata.put(ParsedResponse.REQUEST_ID, XmlDocuments.text(requestId.get(0)));
        }
        return metadata;
    }

    @Override
    public ParsedResponse decodeError(HttpResponse response, Shape shape) {
        Element root = XmlDocuments.parse(response.body());
        if (root == null) {
            LOG.debug("Empty ec2 error body, status {}: synthesizing error from status", response.statusCode());
            return ParsedResponse.error(
                    ProtocolSupport.statusError(response.statusCode()),
                    ProtocolSupport.headerMetadata(response.headers()));
        }
        Map<String, Object> collapsed = XmlDocuments.collapseChildren(root);

        String requestId = ProtocolSupport.asCollapsedText(collapsed.get(REQUEST_ID_UPPER));
        if (requestId == null) {
            requestId = ProtocolSupport.asCollapsedText(collapsed.get(ParsedResponse.REQUEST_ID));
        }

        Object errorNode = collapsed.get(ParsedResponse.ERROR);
        Map<String, Object> errors = ProtocolSupport.asCollapsedMap(collapsed.get(ERRORS));
        if (errors != null) {
            errorNode = errors.get(ParsedResponse.ERROR);
        }
        if (errorNode instanceof List<?> multiple && !multiple.isEmpty()) {
            LOG.warn(
                    "ec2 error response carries {} <Error> elements, keeping only the first (request {})",
                    multiple.size(),
                    requestId);
            errorNode = multiple.get(0);
        }
        Map<String, Object> error = ProtocolSupport.asCollapsedMap(errorNode);
        if (error == null) {
            LOG.debug("ec2 error body has no <Error> element, status {}", response.statusCode());
            error = ProtocolSupport.statusError(response.statusCode());
        }
        Map<String, Object> metadata = requestId != null
                ? ProtocolSupport.requestIdMetadata(requestId)
                : ProtocolSupport.headerMetadata(response.headers());
        return ParsedResponse.error(error, metadata);
    }
}
