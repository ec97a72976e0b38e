package io.responseparser.core.parser;

import io.responseparser.core.error.ShapeDecodeException;
import io.responseparser.core.model.HttpHeaders;
import io.responseparser.core.model.HttpStatusReasons;
import io.responseparser.core.model.ParsedResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers shared by the protocol variants: header-derived response metadata, status-derived errors
 * and error-code normalization.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
final class ProtocolSupport {

    static final String AMZN_REQUEST_ID = "x-amzn-requestid";
    static final String AMZ_REQUEST_ID = "x-amz-request-id";
    static final String AMZ_ID_2 = "x-amz-id-2";
    static final String AMZN_ERROR_TYPE = "x-amzn-errortype";

    private ProtocolSupport() {}

    /**
     * Metadata from response headers: {@code x-amzn-requestid} if present, else
     * {@code x-amz-request-id} plus {@code x-amz-id-2} as {@code HostId} (empty when missing).
     */
    static Map<String, Object> headerMetadata(HttpHeaders headers) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        String amznRequestId = headers.first(AMZN_REQUEST_ID);
        if (amznRequestId != null) {
            metadata.put(ParsedResponse.REQUEST_ID, amznRequestId);
        } else if (headers.contains(AMZ_REQUEST_ID)) {
            metadata.put(ParsedResponse.REQUEST_ID, headers.first(AMZ_REQUEST_ID));
            metadata.put(ParsedResponse.HOST_ID, headers.firstOrDefault(AMZ_ID_2, ""));
        }
        return metadata;
    }

    static Map<String, Object> requestIdMetadata(String requestId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ParsedResponse.REQUEST_ID, requestId != null ? requestId : "");
        return metadata;
    }

    /** An error synthesized from the status line alone. */
    static Map<String, Object> statusError(int statusCode) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put(ParsedResponse.CODE, String.valueOf(statusCode));
        error.put(ParsedResponse.MESSAGE, HttpStatusReasons.reasonPhrase(statusCode));
        return error;
    }

    /**
     * Narrows a decoded output value to its member map.
     *
     * @throws ShapeDecodeException if the output shape did not decode to a structure
     */
    static Map<String, Object> asMembers(Object decoded) {
        if (decoded == null) {
            return new LinkedHashMap<>();
        }
        if (!(decoded instanceof Map<?, ?> members)) {
            throw new ShapeDecodeException("Output shape must decode to a structure, got "
                    + decoded.getClass().getSimpleName());
        }
        return copyOf(members);
    }

    /**
     * A collapsed XML value as a map, or {@code null} if it is text or absent. For repeated tags the
     * first occurrence wins.
     */
    static Map<String, Object> asCollapsedMap(Object collapsed) {
        if (collapsed instanceof List<?> values) {
            return values.isEmpty() ? null : asCollapsedMap(values.get(0));
        }
        return collapsed instanceof Map<?, ?> map ? copyOf(map) : null;
    }

    private static Map<String, Object> copyOf(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }

    /** A collapsed XML value as text; the first occurrence wins for repeated tags. */
    static String asCollapsedText(Object collapsed) {
        if (collapsed instanceof List<?> values) {
            return values.isEmpty() ? null : asCollapsedText(values.get(0));
        }
        return collapsed instanceof String text ? text : null;
    }

    /** {@code "com.example#ThrottlingException"} → {@code "ThrottlingException"}. */
    static String stripNamespace(String code) {
        if (code == null) {
            return null;
        }
        int hash = code.lastIndexOf('#');
        return hash >= 0 ? code.substring(hash + 1) : code;
    }

    /** {@code "ValidationException:http://..."} → {@code "ValidationException"}. */
    static String truncateErrorType(String errorType) {
        if (errorType == null) {
            return null;
        }
        int colon = errorType.indexOf(':');
        return colon >= 0 ? errorType.substring(0, colon) : errorType;
    }
}
