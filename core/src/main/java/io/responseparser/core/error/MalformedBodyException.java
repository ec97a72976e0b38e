package io.responseparser.core.error;

/**
 * Thrown when the raw body is not syntactically valid XML or JSON. The tokenizer's own exception
 * is kept as the cause.
 */
public final class MalformedBodyException extends ResponseDecodeException {

    private static final long serialVersionUID = 1L;

    private final String format;

    public MalformedBodyException(String format, Throwable cause) {
        super("Malformed " + format + " body: " + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.format = format;
    }

    /** The body format that failed to tokenize, {@code "xml"} or {@code "json"}. */
    public String format() {
        return format;
    }
}
