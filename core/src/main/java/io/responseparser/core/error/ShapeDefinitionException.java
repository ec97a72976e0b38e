package io.responseparser.core.error;

/**
 * Thrown when a shape model document is unreadable or describes an invalid shape graph (unknown
 * type, dangling reference, recursion).
 */
public final class ShapeDefinitionException extends ResponseParserException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public ShapeDefinitionException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    public ShapeDefinitionException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
