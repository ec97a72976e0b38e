package io.responseparser.core.spi;

import io.responseparser.core.model.HttpResponse;
import io.responseparser.core.model.ParsedResponse;
import io.responseparser.core.model.Shape;

/**
 * Protocol-specific response parser. One implementation exists per wire dialect and is obtained
 * through {@code ProtocolRegistry}.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe: a single instance is shared by concurrent
 * parse calls.
 */
public interface ResponseParser {

    /** Responses with a status code at or above this value take the error path. */
    int ERROR_STATUS_THRESHOLD = 301;

    /** Returns the protocol identifier, e.g. {@code "rest-xml"}. */
    String protocol();

    /**
     * Decodes a success response against the output shape.
     *
     * @param response the buffered response
     * @param shape    the output shape, or {@code null} for operations without output
     * @return the decoded members plus {@code ResponseMetadata}
     * @throws io.responseparser.core.error.ResponseDecodeException if the body is malformed or
     *     violates the shape
     */
    ParsedResponse decodeSuccess(HttpResponse response, Shape shape);

    /**
     * Decodes an error response into {@code Error} and {@code ResponseMetadata}.
     *
     * @param response the buffered response
     * @param shape    the output shape of the operation (unused by most dialects), may be null
     * @return the error result
     * @throws io.responseparser.core.error.ResponseDecodeException if the body is malformed
     */
    ParsedResponse decodeError(HttpResponse response, Shape shape);

    /** Selects the success or error path from the status code. */
    default ParsedResponse parse(HttpResponse response, Shape shape) {
        return isErrorStatus(response.statusCode()) ? decodeError(response, shape) : decodeSuccess(response, shape);
    }

    /** True if {@code statusCode} selects the error path. */
    static boolean isErrorStatus(int statusCode) {
        return statusCode >= ERROR_STATUS_THRESHOLD;
    }
}
