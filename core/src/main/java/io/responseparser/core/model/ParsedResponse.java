package io.responseparser.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of parsing one HTTP response. Exactly one of two states:
 *
 * <ul>
 * <li>success: the map holds the decoded output members plus {@value #RESPONSE_METADATA}.
 * <li>error: the map holds exactly {@value #ERROR} and {@value #RESPONSE_METADATA}.
 * </ul>
 *
 * <p>
 * An error response from the remote API is a normal result, not an exception. Callers branch on
 * {@link #isError()}.
 */
public final class ParsedResponse {

    public static final String RESPONSE_METADATA = "ResponseMetadata";
    public static final String ERROR = "Error";
    public static final String REQUEST_ID = "RequestId";
    public static final String HOST_ID = "HostId";
    public static final String CODE = "Code";
    public static final String MESSAGE = "Message";

    private final Map<String, Object> values;
    private final Map<String, Object> metadata;
    private final Map<String, Object> error;

    private ParsedResponse(Map<String, Object> values, Map<String, Object> metadata, Map<String, Object> error) {
        this.values = Collections.unmodifiableMap(values);
        this.metadata = metadata;
        this.error = error;
    }

    /**
     * Creates a success result. {@code metadata} is appended after the decoded members.
     *
     * @param decoded  decoded output members, in shape declaration order
     * @param metadata response metadata; must contain {@value #REQUEST_ID}
     */
    public static ParsedResponse success(Map<String, Object> decoded, Map<String, Object> metadata) {
        Objects.requireNonNull(decoded, "decoded must not be null");
        Map<String, Object> values = new LinkedHashMap<>(decoded);
        Map<String, Object> responseMetadata = requireMetadata(metadata);
        values.put(RESPONSE_METADATA, responseMetadata);
        return new ParsedResponse(values, responseMetadata, null);
    }

    /**
     * Creates an error result. {@value #CODE} and {@value #MESSAGE} default to the empty string
     * when the error map lacks them.
     */
    public static ParsedResponse error(Map<String, Object> error, Map<String, Object> metadata) {
        Objects.requireNonNull(error, "error must not be null");
        Map<String, Object> errorValues = new LinkedHashMap<>(error);
        if (errorValues.get(CODE) == null) {
            errorValues.put(CODE, "");
        }
        if (errorValues.get(MESSAGE) == null) {
            errorValues.put(MESSAGE, "");
        }
        Map<String, Object> errorMap = Collections.unmodifiableMap(errorValues);
        Map<String, Object> responseMetadata = requireMetadata(metadata);
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(ERROR, errorMap);
        values.put(RESPONSE_METADATA, responseMetadata);
        return new ParsedResponse(values, responseMetadata, errorMap);
    }

    private static Map<String, Object> requireMetadata(Map<String, Object> metadata) {
        Objects.requireNonNull(metadata, "metadata must not be null");
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        if (copy.get(REQUEST_ID) == null) {
            copy.put(REQUEST_ID, "");
        }
        return Collections.unmodifiableMap(copy);
    }

    /** The whole result as an unmodifiable, insertion-ordered map. */
    public Map<String, Object> asMap() {
        return values;
    }

    /** A top-level value, or {@code null}. */
    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> responseMetadata() {
        return metadata;
    }

    public String requestId() {
        return String.valueOf(metadata.get(REQUEST_ID));
    }

    public boolean isError() {
        return error != null;
    }

    /** The error map, or {@code null} for a success result. */
    public Map<String, Object> error() {
        return error;
    }

    /** The error code, or {@code null} for a success result. */
    public String errorCode() {
        return isError() ? String.valueOf(error.get(CODE)) : null;
    }

    /** The error message, or {@code null} for a success result. */
    public String errorMessage() {
        return isError() ? String.valueOf(error.get(MESSAGE)) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParsedResponse that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return isError()
                ? "ParsedResponse[ERROR, code=" + errorCode() + ", requestId=" + requestId() + "]"
                : "ParsedResponse[SUCCESS, keys=" + values.keySet() + "]";
    }
}
