package io.responseparser.core.parser;

import io.responseparser.core.error.ShapeDecodeException;
import io.responseparser.core.model.HttpResponse;
import io.responseparser.core.model.ParsedResponse;
import io.responseparser.core.model.Shape;
import io.responseparser.core.spi.ResponseParser;
import io.responseparser.core.spi.TimestampParser;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Parser for the {@code query} protocol: XML bodies, output optionally wrapped in a result element,
 * metadata in a {@code <ResponseMetadata>} block.
 *
 * <pre>
 * &lt;DescribeThingsResponse&gt;
 *   &lt;DescribeThingsResult&gt;...&lt;/DescribeThingsResult&gt;
 *   &lt;ResponseMetadata&gt;&lt;RequestId&gt;id&lt;/RequestId&gt;&lt;/ResponseMetadata&gt;
 * &lt;/DescribeThingsResponse&gt;
 * </pre>
 *
 * <p>
 * Errors arrive as {@code <ErrorResponse><Error>...</Error><RequestId>...</RequestId></ErrorResponse>}
 * and are collapsed to nested maps without consulting the shape.
 */
public class QueryResponseParser implements ResponseParser {

    private static final Logger LOG = LoggerFactory.getLogger(QueryResponseParser.class);

    protected final XmlShapeDecoder decoder;

    public QueryResponseParser() {
        this(TimestampParsers.defaultParser());
    }

    public QueryResponseParser(TimestampParser timestampParser) {
        this.decoder = new XmlShapeDecoder(timestampParser);
    }

    @Override
    public String protocol() {
        return ProtocolRegistry.QUERY;
    }

    @Override
    public ParsedResponse decodeSuccess(HttpResponse response, Shape shape) {
        Element root = XmlDocuments.parse(response.body());
        Map<String, Object> decoded = new LinkedHashMap<>();
        if (shape != null && root != null) {
            Element start = root;
            String resultWrapper = shape.serialization().resultWrapper();
            if (resultWrapper != null) {
                start = findResultWrapper(resultWrapper, root);
            }
            decoded = ProtocolSupport.asMembers(decoder.decode(shape, start));
        }
        return ParsedResponse.success(decoded, successMetadata(root));
    }

    private static Element findResultWrapper(String elementName, Element root) {
        List<Element> wrapped = XmlDocuments.indexChildren(root).get(elementName);
        if (wrapped == null) {
            throw new ShapeDecodeException("Result wrapper element <" + elementName + "> not found under <"
                    + XmlDocuments.localName(root) + ">");
        }
        return wrapped.get(0);
    }

    /**
     * Reads success metadata from the root: the {@code <ResponseMetadata>} block's leaf texts, else a
     * top-level {@code <RequestId>}.
     */
    protected Map<String, Object> successMetadata(Element root) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        Map<String, List<Element>> index = XmlDocuments.indexChildren(root);
        List<Element> block = index.get(ParsedResponse.RESPONSE_METADATA);
        if (block != null) {
            XmlDocuments.indexChildren(block.get(0))
                    .forEach((tag, elements) -> metadata.put(tag, XmlDocuments.text(elements.get(0))));
        } else if (index.containsKey(ParsedResponse.REQUEST_ID)) {
            metadata.put(ParsedResponse.REQUEST_ID, XmlDocuments.text(index.get(ParsedResponse.REQUEST_ID).get(0)));
        }
        return metadata;
    }

    @Override
    public ParsedResponse decodeError(HttpResponse response, Shape shape) {
        Element root = XmlDocuments.parse(response.body());
        if (root == null) {
            LOG.debug("Empty query error body, status {}: synthesizing error from status", response.statusCode());
            return ParsedResponse.error(
                    ProtocolSupport.statusError(response.statusCode()),
                    ProtocolSupport.headerMetadata(response.headers()));
        }
        Map<String, Object> collapsed = XmlDocuments.collapseChildren(root);
        Map<String, Object> error = ProtocolSupport.asCollapsedMap(collapsed.get(ParsedResponse.ERROR));
        if (error == null) {
            LOG.debug("Query error body has no <Error> element, status {}", response.statusCode());
            error = ProtocolSupport.statusError(response.statusCode());
        }
        String requestId = ProtocolSupport.asCollapsedText(collapsed.get(ParsedResponse.REQUEST_ID));
        Map<String, Object> metadata = requestId != null
                ? ProtocolSupport.requestIdMetadata(requestId)
                : ProtocolSupport.headerMetadata(response.headers());
        return ParsedResponse.error(error, metadata);
    }
}
