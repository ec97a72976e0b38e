package io.responseparser.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.responseparser.core.error.MalformedBodyException;
import io.responseparser.core.model.Shape;
import io.responseparser.core.spi.BodyFormat;
import java.io.IOException;
import java.util.Objects;

/** JSON body strategy for the REST decoder. An empty body is read as {@code {}}. */
public final class JsonBodyFormat implements BodyFormat {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JsonShapeDecoder decoder;

    public JsonBodyFormat(JsonShapeDecoder decoder) {
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
    }

    @Override
    public Object decode(Shape shape, byte[] body) {
        return decoder.decode(shape, readTree(body));
    }

    /**
     * Tokenizes a JSON body.
     *
     * @return the root node; an empty object node for an empty body
     * @throws MalformedBodyException if the body is not valid JSON
     */
    public static JsonNode readTree(byte[] body) {
        if (body == null || body.length == 0) {
            return MAPPER.createObjectNode();
        }
        try {
            JsonNode root = MAPPER.readTree(body);
            return root == null || root.isMissingNode() ? MAPPER.createObjectNode() : root;
        } catch (IOException e) {
            throw new MalformedBodyException("json", e);
        }
    }
}
