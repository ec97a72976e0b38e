package io.responseparser.core.parser;

import io.responseparser.core.error.ShapeDecodeException;
import io.responseparser.core.model.HttpHeaders;
import io.responseparser.core.model.HttpResponse;
import io.responseparser.core.model.Location;
import io.responseparser.core.model.Shape;
import io.responseparser.core.model.ShapeKind;
import io.responseparser.core.spi.TimestampParser;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the structure members bound to a non-body {@link Location}: the status code, single
 * headers and prefixed header maps. Values are converted with the scalar routine of the member's
 * kind, independent of the body format.
 */
public final class RestAttributeExtractor {

    private final TimestampParser timestampParser;

    public RestAttributeExtractor(TimestampParser timestampParser) {
        this.timestampParser = Objects.requireNonNull(timestampParser, "timestampParser must not be null");
    }

    /**
     * Extracts every located member of {@code shape}.
     *
     * @return member name → value, in declaration order; absent headers are omitted
     */
    public Map<String, Object> extract(HttpResponse response, Shape shape) {
        Map<String, Object> parsed = new LinkedHashMap<>();
        HttpHeaders headers = response.headers();
        shape.members().forEach((memberName, memberShape) -> {
            Location location = memberShape.serialization().location();
            if (location == null) {
                return;
            }
            switch (location) {
                case STATUS_CODE -> {
                    String status = String.valueOf(response.statusCode());
                    parsed.put(memberName, ScalarValues.fromText(memberShape, status, timestampParser));
                }
                case HEADER -> {
                    String headerName = memberShape.serialization().nameOr(memberName);
                    String value = headers.first(headerName);
                    if (value != null) {
                        parsed.put(memberName, headerValue(memberShape, value));
                    }
                }
                case HEADERS -> parsed.put(memberName, headerMap(memberShape, headers));
            }
        });
        return parsed;
    }

    private Object headerValue(Shape shape, String value) {
        if (shape.kind() == ShapeKind.LIST) {
            List<Object> items = new ArrayList<>();
            for (String item : value.split(",")) {
                items.add(ScalarValues.fromText(shape.member(), item.trim(), timestampParser));
            }
            return items;
        }
        if (shape.kind().isContainer()) {
            throw new ShapeDecodeException("A " + shape.kind().typeName() + " shape cannot be bound to a header");
        }
        return ScalarValues.fromText(shape, value, timestampParser);
    }

    /**
     * Collects every header whose name starts with the member's prefix (case-insensitive). Keys keep
     * the server's spelling with the prefix removed.
     */
    private Map<String, Object> headerMap(Shape shape, HttpHeaders headers) {
        String prefix = shape.serialization().nameOr("").toLowerCase(Locale.ROOT);
        Shape valueShape = shape.kind() == ShapeKind.MAP ? shape.value() : null;
        Map<String, Object> parsed = new LinkedHashMap<>();
        for (String headerName : headers.names()) {
            if (headerName.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                String value = headers.first(headerName);
                parsed.put(
                        headerName.substring(prefix.length()),
                        valueShape != null ? ScalarValues.fromText(valueShape, value, timestampParser) : value);
            }
        }
        return parsed;
    }
}
