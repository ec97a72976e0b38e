package io.responseparser.core.error;

/**
 * Abstract parent for per-response decode failures. A decode failure aborts the whole parse call;
 * no partial result is returned.
 */
public abstract class ResponseDecodeException extends ResponseParserException {

    private static final long serialVersionUID = 1L;

    protected ResponseDecodeException(String message) {
        super(message, Phase.DECODE);
    }

    protected ResponseDecodeException(String message, Throwable cause) {
        super(message, cause, Phase.DECODE);
    }
}
