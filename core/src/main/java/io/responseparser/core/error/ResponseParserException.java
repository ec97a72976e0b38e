package io.responseparser.core.error;

/**
 * Abstract base for all response-parser exceptions. Never thrown directly; use
 * {@link ShapeDefinitionException} for load-time problems or a {@link ResponseDecodeException}
 * subclass for failures while decoding a response.
 *
 * <p>
 * A well-formed API error response is never reported through this hierarchy; it is returned as an
 * error {@code ParsedResponse}.
 */
public abstract class ResponseParserException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        DECODE
    }

    private final Phase phase;

    protected ResponseParserException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ResponseParserException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
