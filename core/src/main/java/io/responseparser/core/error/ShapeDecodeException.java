package io.responseparser.core.error;

/**
 * Thrown when a decoded body violates the structure its shape demands: an unknown tag inside a map
 * entry, a repeated element bound to a non-flattened shape, a JSON value of the wrong type, or
 * scalar text that cannot be converted.
 */
public final class ShapeDecodeException extends ResponseDecodeException {

    private static final long serialVersionUID = 1L;

    public ShapeDecodeException(String message) {
        super(message);
    }

    public ShapeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
