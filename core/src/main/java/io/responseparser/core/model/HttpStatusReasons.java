package io.responseparser.core.model;

import io.netty.handler.codec.http.HttpResponseStatus;

/** Standard reason phrases for HTTP status codes, used when an error response has no body. */
public final class HttpStatusReasons {

    private HttpStatusReasons() {}

    /**
     * The registered reason phrase for {@code statusCode}, e.g. {@code "Not Found"} for 404.
     *
     * @return the phrase, or the empty string for an unregistered code
     */
    public static String reasonPhrase(int statusCode) {
        if (statusCode < 0) {
            return "";
        }
        String phrase = HttpResponseStatus.valueOf(statusCode).reasonPhrase();
        // unregistered codes get a synthesized "<class> (<code>)" phrase
        return phrase.endsWith("(" + statusCode + ")") ? "" : phrase;
    }
}
