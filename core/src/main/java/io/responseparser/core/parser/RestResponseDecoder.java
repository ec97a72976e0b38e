package io.responseparser.core.parser;

import io.responseparser.core.error.ShapeDecodeException;
import io.responseparser.core.model.HttpResponse;
import io.responseparser.core.model.Shape;
import io.responseparser.core.spi.BodyFormat;
import io.responseparser.core.spi.TimestampParser;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Success-path decoding shared by the REST dialects. Located members come from
 * {@link RestAttributeExtractor}; the body goes through the pluggable {@link BodyFormat}.
 *
 * <p>
 * When the output shape names a payload member, only that member receives the body: a
 * {@code string} payload gets the body as UTF-8 text and a {@code blob} payload gets the raw bytes,
 * without structural decoding. Otherwise the whole body is decoded against the whole shape and its
 * members are merged alongside the located ones.
 */
public final class RestResponseDecoder {

    private final BodyFormat bodyFormat;
    private final RestAttributeExtractor attributeExtractor;

    public RestResponseDecoder(BodyFormat bodyFormat, TimestampParser timestampParser) {
        this.bodyFormat = Objects.requireNonNull(bodyFormat, "bodyFormat must not be null");
        this.attributeExtractor = new RestAttributeExtractor(timestampParser);
    }

    /**
     * Decodes the output members of a REST response.
     *
     * @param shape the output shape, or {@code null} for operations without output
     */
    public Map<String, Object> decode(HttpResponse response, Shape shape) {
        Map<String, Object> parsed = new LinkedHashMap<>();
        if (shape == null) {
            return parsed;
        }
        parsed.putAll(attributeExtractor.extract(response, shape));

        String payloadName = shape.serialization().payload();
        if (payloadName == null) {
            parsed.putAll(ProtocolSupport.asMembers(bodyFormat.decode(shape, response.body())));
            return parsed;
        }

        Shape payloadShape = shape.members().get(payloadName);
        if (payloadShape == null) {
            throw new ShapeDecodeException("Payload member '" + payloadName + "' is not declared by the output shape");
        }
        switch (payloadShape.kind()) {
            case STRING -> parsed.put(payloadName, response.bodyAsString());
            case BLOB -> parsed.put(payloadName, Arrays.copyOf(response.body(), response.body().length));
            default -> {
                Object payload = bodyFormat.decode(payloadShape, response.body());
                if (payload != null) {
                    parsed.put(payloadName, payload);
                }
            }
        }
        return parsed;
    }
}
