package io.responseparser.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.responseparser.core.error.ShapeDecodeException;
import io.responseparser.core.model.Shape;
import io.responseparser.core.model.ShapeKind;
import io.responseparser.core.spi.TimestampParser;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes Jackson {@link JsonNode} trees against shapes.
 *
 * <p>
 * Only structures, maps, lists, blobs and timestamps need work; every other scalar kind keeps the
 * value Jackson produced ({@code String}, {@code Integer}/{@code Long}/{@code BigInteger},
 * {@code Double}, {@code Boolean}).
 *
 * <p>
 * Thread-safe: holds only the injected timestamp parser and a shared, immutable-after-construction
 * {@link ObjectMapper}.
 */
public final class JsonShapeDecoder extends ShapeDecoder<JsonNode> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public JsonShapeDecoder(TimestampParser timestampParser) {
        super(timestampParser);
        register(this::handleStructure, ShapeKind.STRUCTURE);
        register(this::handleMap, ShapeKind.MAP);
        register(this::handleBlob, ShapeKind.BLOB);
        register(this::handleTimestamp, ShapeKind.TIMESTAMP);
    }

    private Object handleStructure(Shape shape, JsonNode value) {
        requireObject(shape, value);
        Map<String, Object> parsed = new LinkedHashMap<>();
        shape.members().forEach((memberName, memberShape) -> {
            if (memberShape.serialization().hasLocation()) {
                return;
            }
            JsonNode raw = value.get(memberShape.serialization().nameOr(memberName));
            if (raw != null && !raw.isNull()) {
                parsed.put(memberName, decode(memberShape, raw));
            }
        });
        return parsed;
    }

    private Object handleMap(Shape shape, JsonNode value) {
        requireObject(shape, value);
        Map<Object, Object> parsed = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Object key = decode(shape.key(), TextNode.valueOf(field.getKey()));
            Object entryValue = field.getValue().isNull() ? null : decode(shape.value(), field.getValue());
            parsed.put(key, entryValue);
        }
        return parsed;
    }

    @Override
    protected Iterable<JsonNode> listItems(Shape shape, JsonNode node) {
        if (!node.isArray()) {
            throw new ShapeDecodeException("Expected a JSON array for list shape, found " + node.getNodeType());
        }
        return node;
    }

    private Object handleBlob(Shape shape, JsonNode value) {
        if (!value.isTextual()) {
            throw new ShapeDecodeException("Expected a base64 string for blob shape, found " + value.getNodeType());
        }
        return ScalarValues.toBytes(value.textValue());
    }

    private Object handleTimestamp(Shape shape, JsonNode value) {
        Object raw = value.isNumber() ? value.numberValue() : value.asText();
        return ScalarValues.toTimestamp(raw, timestampParser);
    }

    /** Scalars pass through as the Jackson-native Java value. */
    @Override
    protected Object defaultHandle(Shape shape, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return MAPPER.convertValue(value, Object.class);
    }

    private static void requireObject(Shape shape, JsonNode value) {
        if (!value.isObject()) {
            throw new ShapeDecodeException("Expected a JSON object for " + shape.kind().typeName() + " shape, found "
                    + value.getNodeType());
        }
    }
}
