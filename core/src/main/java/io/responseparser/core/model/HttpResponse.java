package io.responseparser.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Fully buffered HTTP response handed to a parser.
 *
 * <p>
 * The record overrides {@code equals}/{@code hashCode} to compare body bytes by content (records
 * use reference equality for arrays by default).
 *
 * @param statusCode HTTP status code
 * @param headers    case-insensitive headers, never null
 * @param body       raw body bytes, never null (null is normalized to an empty array)
 */
public record HttpResponse(int statusCode, HttpHeaders headers, byte[] body) {

    /** Canonical constructor; normalizes null headers and body. */
    public HttpResponse {
        if (headers == null) {
            headers = HttpHeaders.empty();
        }
        if (body == null) {
            body = new byte[0];
        }
    }

    /** Creates a response with a UTF-8 encoded text body. */
    public static HttpResponse of(int statusCode, HttpHeaders headers, String body) {
        return new HttpResponse(
                statusCode, headers, body != null ? body.getBytes(StandardCharsets.UTF_8) : new byte[0]);
    }

    /** Returns the body decoded as UTF-8 text. */
    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpResponse that)) return false;
        return statusCode == that.statusCode && headers.equals(that.headers) && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * statusCode + headers.hashCode()) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "HttpResponse[" + statusCode + ", " + headers + ", " + body.length + " bytes]";
    }
}
