package io.responseparser.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.responseparser.core.spi.TimestampParser;
import java.time.Instant;
import org.junit.jupiter.api.Test;

/** Tests for the default {@link TimestampParser}. */
class TimestampParsersTest {

    private static final Instant NOON = Instant.parse("2014-01-01T12:00:00Z");

    private final TimestampParser parser = TimestampParsers.defaultParser();

    @Test
    void isoWithZulu() {
        assertThat(parser.parse("2014-01-01T12:00:00.000Z")).isEqualTo(NOON);
    }

    @Test
    void isoWithOffset() {
        assertThat(parser.parse("2014-01-01T14:00:00+02:00")).isEqualTo(NOON);
    }

    @Test
    void isoWithoutOffsetIsUtc() {
        assertThat(parser.parse("2014-01-01T12:00:00")).isEqualTo(NOON);
    }

    @Test
    void rfc1123() {
        assertThat(parser.parse("Wed, 01 Jan 2014 12:00:00 GMT")).isEqualTo(NOON);
    }

    @Test
    void epochSecondsAsNumberAndText() {
        assertThat(parser.parse(1388577600)).isEqualTo(NOON);
        assertThat(parser.parse(1388577600L)).isEqualTo(NOON);
        assertThat(parser.parse("1388577600")).isEqualTo(NOON);
        assertThat(parser.parse(1388577600.25d)).isEqualTo(NOON.plusMillis(250));
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> parser.parse("yesterday")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parse(Boolean.TRUE)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void outOfRangeEpochIsRejected() {
        assertThatThrownBy(() -> parser.parse("99999999999999999999999"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
    }
}
