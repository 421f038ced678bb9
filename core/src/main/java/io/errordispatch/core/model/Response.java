package io.errordispatch.core.model;

import java.util.Objects;

/**
 * HTTP response produced by an error handler.
 *
 * @param status HTTP status code
 * @param headers response headers, never null
 * @param body response body, never null
 */
public record Response(int status, HttpHeaders headers, MessageBody body) {

    private static final String CONTENT_TYPE = "content-type";

    public Response {
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("status must be within 100..599, was " + status);
        }
        headers = headers != null ? headers : HttpHeaders.empty();
        body = body != null ? body : MessageBody.empty();
    }

    /**
     * Creates a response whose {@code Content-Type} header follows the body's media type.
     *
     * @param status HTTP status
     * @param body response body; {@link MediaType#NONE} leaves the header unset
     */
    public static Response of(int status, MessageBody body) {
        Objects.requireNonNull(body, "body must not be null");
        HttpHeaders headers = body.mediaType() != MediaType.NONE
                ? HttpHeaders.empty().with(CONTENT_TYPE, body.mediaType().value())
                : HttpHeaders.empty();
        return new Response(status, headers, body);
    }

    /** Response with no body. */
    public static Response status(int status) {
        return new Response(status, HttpHeaders.empty(), MessageBody.empty());
    }

    /** Returns a copy with the given header set. */
    public Response withHeader(String name, String value) {
        return new Response(status, headers.with(name, value), body);
    }

    /** The {@code Content-Type} header value, or {@code null}. */
    public String contentType() {
        return headers.first(CONTENT_TYPE);
    }
}
