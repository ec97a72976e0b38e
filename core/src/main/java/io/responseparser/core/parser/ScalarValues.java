package io.responseparser.core.parser;

import io.responseparser.core.error.ShapeDecodeException;
import io.responseparser.core.model.Shape;
import io.responseparser.core.spi.TimestampParser;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-to-value conversions for scalar shapes. Used for XML element text and for REST header and
 * status-code values.
 */
final class ScalarValues {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern SPECIAL_FLOAT =
            Pattern.compile("([+-]?)(nan|inf|infinity)", Pattern.CASE_INSENSITIVE);

    private ScalarValues() {}

    /** Only the literal {@code "true"} is true. */
    static Boolean toBoolean(String text) {
        return "true".equals(text);
    }

    static Long toLong(String text) {
        try {
            return Long.valueOf(text.trim());
        } catch (NumberFormatException e) {
            throw new ShapeDecodeException("Invalid integer value: '" + text + "'", e);
        }
    }

    /**
     * Decimal or exponent notation, or {@code nan}/{@code inf}/{@code infinity} in any case. Java-only
     * literals such as {@code 1.5f} or hexadecimal floats are rejected.
     */
    static Double toDouble(String text) {
        String trimmed = text.trim();
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.valueOf(trimmed);
        }
        Matcher special = SPECIAL_FLOAT.matcher(trimmed);
        if (!special.matches()) {
            throw new ShapeDecodeException("Invalid floating point value: '" + text + "'");
        }
        if (special.group(2).equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        return "-".equals(special.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }

    /** Decodes base64 text into raw bytes; line breaks inside the text are ignored. */
    static byte[] toBytes(String text) {
        try {
            return Base64.getMimeDecoder().decode(text.trim());
        } catch (IllegalArgumentException e) {
            throw new ShapeDecodeException("Invalid base64 value", e);
        }
    }

    static Instant toTimestamp(Object raw, TimestampParser timestampParser) {
        try {
            return timestampParser.parse(raw instanceof String text ? text.trim() : raw);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new ShapeDecodeException("Invalid timestamp value: '" + raw + "'", e);
        }
    }

    /**
     * Converts {@code text} according to the scalar kind of {@code shape}.
     *
     * @throws ShapeDecodeException if the shape is a container or the text does not convert
     */
    static Object fromText(Shape shape, String text, TimestampParser timestampParser) {
        return switch (shape.kind()) {
            case BOOLEAN -> toBoolean(text);
            case INTEGER, LONG -> toLong(text);
            case FLOAT, DOUBLE -> toDouble(text);
            case BLOB -> toBytes(text);
            case TIMESTAMP -> toTimestamp(text, timestampParser);
            case STRING, CHARACTER -> text;
            case STRUCTURE, LIST, MAP -> throw new ShapeDecodeException(
                    "A " + shape.kind().typeName() + " shape cannot be read from a text value");
        };
    }
}
