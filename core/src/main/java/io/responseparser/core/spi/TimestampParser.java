package io.responseparser.core.spi;

import java.time.Instant;

/**
 * Converts a wire timestamp into an {@link Instant}. Injected into every parser at construction.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe.
 */
@FunctionalInterface
public interface TimestampParser {

    /**
     * Parses a raw timestamp.
     *
     * @param raw the wire value: a {@link String} (XML text, header value, JSON string) or a
     *     {@link Number} (JSON epoch seconds)
     * @return the instant, never null
     * @throws IllegalArgumentException if the value is not a recognized timestamp
     */
    Instant parse(Object raw);
}
