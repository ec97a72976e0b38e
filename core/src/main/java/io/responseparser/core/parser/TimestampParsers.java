package io.responseparser.core.parser;

import io.responseparser.core.spi.TimestampParser;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * The default {@link TimestampParser}. Accepts:
 *
 * <ul>
 * <li>epoch seconds, as a {@link Number} or numeric text, with optional fraction
 * <li>ISO-8601 with offset or {@code Z}, e.g. {@code 2014-01-01T12:00:00.000Z}
 * <li>ISO-8601 local date-time, read as UTC
 * <li>RFC 1123, e.g. {@code Wed, 01 Jan 2014 12:00:00 GMT}
 * </ul>
 */
public final class TimestampParsers {

    private static final Pattern EPOCH = Pattern.compile("-?\\d+(\\.\\d+)?");

    private static final Pattern ISO_OFFSET = Pattern.compile(".*T.*(Z|z|[+-]\\d{2}(:?\\d{2})?)$");

    private static final TimestampParser DEFAULT = TimestampParsers::parse;

    private TimestampParsers() {}

    public static TimestampParser defaultParser() {
        return DEFAULT;
    }

    private static Instant parse(Object raw) {
        if (raw instanceof Number number) {
            return fromEpochSeconds(new BigDecimal(number.toString()));
        }
        if (!(raw instanceof String text) || text.isBlank()) {
            throw new IllegalArgumentException("Unsupported timestamp value: " + raw);
        }
        String trimmed = text.trim();
        if (EPOCH.matcher(trimmed).matches()) {
            return fromEpochSeconds(new BigDecimal(trimmed));
        }
        try {
            if (trimmed.indexOf(',') >= 0) {
                return ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            }
            if (ISO_OFFSET.matcher(trimmed).matches()) {
                return OffsetDateTime.parse(trimmed, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
            }
            return LocalDateTime.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unrecognized timestamp format: '" + trimmed + "'", e);
        }
    }

    private static Instant fromEpochSeconds(BigDecimal seconds) {
        BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
        long nanos = seconds.subtract(whole).movePointRight(9).setScale(0, RoundingMode.HALF_UP).longValue();
        try {
            return Instant.ofEpochSecond(whole.longValueExact(), nanos);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Epoch seconds out of range: " + seconds, e);
        }
    }
}
