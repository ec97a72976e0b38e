package io.responseparser.core.spi;

import io.responseparser.core.model.Shape;

/**
 * Body-format strategy plugged into the REST decoder. Turns raw body bytes into decoded values for
 * a shape; headers and status code are handled elsewhere.
 */
public interface BodyFormat {

    /**
     * Decodes the whole body against {@code shape}. An empty body decodes as an empty document, so a
     * structure shape yields an empty map.
     *
     * @throws io.responseparser.core.error.ResponseDecodeException on malformed input
     */
    Object decode(Shape shape, byte[] body);
}
