package io.responseparser.core.parser;

import io.responseparser.core.model.HttpResponse;
import io.responseparser.core.model.ParsedResponse;
import io.responseparser.core.model.Shape;
import io.responseparser.core.spi.ResponseParser;
import io.responseparser.core.spi.TimestampParser;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Parser for the {@code rest-xml} protocol: headers and status code bind to located members and the
 * body is XML.
 *
 * <p>
 * Two error body styles are accepted. A bare {@code <Error>} root (S3) carries the error fields
 * directly, with request ids duplicated from the headers:
 *
 * <pre>
 * &lt;Error&gt;&lt;Code&gt;NoSuchKey&lt;/Code&gt;&lt;Message&gt;...&lt;/Message&gt;&lt;RequestId&gt;...&lt;/RequestId&gt;&lt;HostId&gt;...&lt;/HostId&gt;&lt;/Error&gt;
 * </pre>
 *
 * Any other root is the wrapped style, as in {@code query}:
 *
 * <pre>
 * &lt;ErrorResponse&gt;&lt;Error&gt;...&lt;/Error&gt;&lt;RequestId&gt;...&lt;/RequestId&gt;&lt;/ErrorResponse&gt;
 * </pre>
 *
 * An empty error body is described from the status line alone.
 */
public final class RestXmlResponseParser implements ResponseParser {

    private static final Logger LOG = LoggerFactory.getLogger(RestXmlResponseParser.class);

    private final RestResponseDecoder restDecoder;

    public RestXmlResponseParser() {
        this(TimestampParsers.defaultParser());
    }

    public RestXmlResponseParser(TimestampParser timestampParser) {
        this.restDecoder =
                new RestResponseDecoder(new XmlBodyFormat(new XmlShapeDecoder(timestampParser)), timestampParser);
    }

    @Override
    public String protocol() {
        return ProtocolRegistry.REST_XML;
    }

    @Override
    public ParsedResponse decodeSuccess(HttpResponse response, Shape shape) {
        return ParsedResponse.success(
                restDecoder.decode(response, shape), ProtocolSupport.headerMetadata(response.headers()));
    }

    @Override
    public ParsedResponse decodeError(HttpResponse response, Shape shape) {
        Element root = XmlDocuments.parse(response.body());
        if (root == null) {
            LOG.debug("Empty rest-xml error body, status {}: synthesizing error from status", response.statusCode());
            return statusError(response);
        }
        Map<String, Object> collapsed = XmlDocuments.collapseChildren(root);
        if (ParsedResponse.ERROR.equals(XmlDocuments.localName(root))) {
            return singleError(response, collapsed);
        }
        return wrappedError(response, collapsed);
    }

    private static ParsedResponse statusError(HttpResponse response) {
        Map<String, Object> metadata = ProtocolSupport.headerMetadata(response.headers());
        metadata.putIfAbsent(ParsedResponse.REQUEST_ID, "");
        metadata.putIfAbsent(ParsedResponse.HOST_ID, "");
        return ParsedResponse.error(ProtocolSupport.statusError(response.statusCode()), metadata);
    }

    /** {@code <Error>} root: ids come from the headers and are dropped from the body. */
    private static ParsedResponse singleError(HttpResponse response, Map<String, Object> error) {
        Map<String, Object> metadata = ProtocolSupport.headerMetadata(response.headers());
        Object bodyRequestId = error.remove(ParsedResponse.REQUEST_ID);
        Object bodyHostId = error.remove(ParsedResponse.HOST_ID);
        if (!metadata.containsKey(ParsedResponse.REQUEST_ID)) {
            String requestId = ProtocolSupport.asCollapsedText(bodyRequestId);
            metadata.put(ParsedResponse.REQUEST_ID, requestId != null ? requestId : "");
            String hostId = ProtocolSupport.asCollapsedText(bodyHostId);
            metadata.put(ParsedResponse.HOST_ID, hostId != null ? hostId : "");
        }
        return ParsedResponse.error(error, metadata);
    }

    private static ParsedResponse wrappedError(HttpResponse response, Map<String, Object> collapsed) {
        Map<String, Object> error = ProtocolSupport.asCollapsedMap(collapsed.get(ParsedResponse.ERROR));
        if (error == null) {
            LOG.debug("rest-xml error body has no <Error> element, status {}", response.statusCode());
            error = ProtocolSupport.statusError(response.statusCode());
        }
        String requestId = ProtocolSupport.asCollapsedText(collapsed.get(ParsedResponse.REQUEST_ID));
        Map<String, Object> metadata = requestId != null
                ? ProtocolSupport.requestIdMetadata(requestId)
                : ProtocolSupport.headerMetadata(response.headers());
        return ParsedResponse.error(error, metadata);
    }
}
