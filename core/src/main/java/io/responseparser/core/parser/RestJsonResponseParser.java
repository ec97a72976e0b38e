package io.responseparser.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import io.responseparser.core.model.HttpResponse;
import io.responseparser.core.model.ParsedResponse;
import io.responseparser.core.model.Shape;
import io.responseparser.core.spi.ResponseParser;
import io.responseparser.core.spi.TimestampParser;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parser for the {@code rest-json} protocol: headers and status code bind to located members, the
 * body is JSON, and the error code travels in the {@code x-amzn-errortype} header.
 */
public final class RestJsonResponseParser implements ResponseParser {

    private final RestResponseDecoder restDecoder;

    public RestJsonResponseParser() {
        this(TimestampParsers.defaultParser());
    }

    public RestJsonResponseParser(TimestampParser timestampParser) {
        this.restDecoder =
                new RestResponseDecoder(new JsonBodyFormat(new JsonShapeDecoder(timestampParser)), timestampParser);
    }

    @Override
    public String protocol() {
        return ProtocolRegistry.REST_JSON;
    }

    @Override
    public ParsedResponse decodeSuccess(HttpResponse response, Shape shape) {
        return ParsedResponse.success(
                restDecoder.decode(response, shape), ProtocolSupport.headerMetadata(response.headers()));
    }

    /**
     * The code comes from {@code x-amzn-errortype} (which may carry a {@code :}-separated suffix), or
     * from the body's {@code code}/{@code __type} key when the header is missing.
     */
    @Override
    public ParsedResponse decodeError(HttpResponse response, Shape shape) {
        JsonNode body = JsonBodyFormat.readTree(response.body());
        Map<String, Object> error = new LinkedHashMap<>();

        String code = ProtocolSupport.truncateErrorType(response.headers().first(ProtocolSupport.AMZN_ERROR_TYPE));
        if (code == null) {
            String bodyCode = JsonResponseParser.text(body, "code");
            code = ProtocolSupport.stripNamespace(bodyCode != null ? bodyCode : JsonResponseParser.text(body, "__type"));
        }
        error.put(ParsedResponse.CODE, code);

        String message = JsonResponseParser.text(body, "message");
        if (message == null) {
            message = JsonResponseParser.text(body, "Message");
        }
        error.put(ParsedResponse.MESSAGE, message != null ? message : "");
        return ParsedResponse.error(error, ProtocolSupport.headerMetadata(response.headers()));
    }
}
