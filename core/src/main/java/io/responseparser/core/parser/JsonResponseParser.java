package io.responseparser.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import io.responseparser.core.model.HttpResponse;
import io.responseparser.core.model.ParsedResponse;
import io.responseparser.core.model.Shape;
import io.responseparser.core.spi.ResponseParser;
import io.responseparser.core.spi.TimestampParser;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for the {@code json} protocol: the whole body is a JSON document for the output shape and
 * the request id travels in the {@code x-amzn-requestid} header.
 *
 * <p>
 * Error bodies look like {@code {"__type": "com.example#ThrottlingException", "message": "..."}};
 * the message key may also be spelled {@code Message}.
 */
public final class JsonResponseParser implements ResponseParser {

    private static final Logger LOG = LoggerFactory.getLogger(JsonResponseParser.class);

    private final JsonShapeDecoder decoder;

    public JsonResponseParser() {
        this(TimestampParsers.defaultParser());
    }

    public JsonResponseParser(TimestampParser timestampParser) {
        this.decoder = new JsonShapeDecoder(timestampParser);
    }

    @Override
    public String protocol() {
        return ProtocolRegistry.JSON;
    }

    @Override
    public ParsedResponse decodeSuccess(HttpResponse response, Shape shape) {
        JsonNode body = JsonBodyFormat.readTree(response.body());
        Map<String, Object> decoded =
                shape != null ? ProtocolSupport.asMembers(decoder.decode(shape, body)) : new LinkedHashMap<>();
        return ParsedResponse.success(decoded, requestIdMetadata(response));
    }

    @Override
    public ParsedResponse decodeError(HttpResponse response, Shape shape) {
        JsonNode body = JsonBodyFormat.readTree(response.body());
        Map<String, Object> error = new LinkedHashMap<>();

        String code = ProtocolSupport.stripNamespace(text(body, "__type"));
        if (code == null) {
            code = ProtocolSupport.truncateErrorType(response.headers().first(ProtocolSupport.AMZN_ERROR_TYPE));
        }
        if (code == null) {
            LOG.debug("json error response without __type or error type header, status {}", response.statusCode());
        }
        error.put(ParsedResponse.CODE, code);

        String message = text(body, "message");
        error.put(ParsedResponse.MESSAGE, message != null ? message : text(body, "Message"));
        return ParsedResponse.error(error, requestIdMetadata(response));
    }

    private static Map<String, Object> requestIdMetadata(HttpResponse response) {
        return ProtocolSupport.requestIdMetadata(response.headers().first(ProtocolSupport.AMZN_REQUEST_ID));
    }

    /** Text of a top-level key, or {@code null} when absent, null or the body is not an object. */
    static String text(JsonNode body, String key) {
        JsonNode value = body.isObject() ? body.get(key) : null;
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
