package io.errordispatch.core.model;

import java.util.Objects;

/**
 * The request that was being processed when an error was raised. Gateway adapters build it
 * from their native request type; handlers only read it.
 *
 * @param method HTTP method, upper case (e.g. {@code GET})
 * @param path request path (e.g. {@code /api/orders})
 * @param queryString raw query string without leading {@code ?}, nullable
 * @param headers request headers, never null
 * @param body request body, never null
 */
public record Request(String method, String path, String queryString, HttpHeaders headers, MessageBody body) {

    public Request {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        headers = headers != null ? headers : HttpHeaders.empty();
        body = body != null ? body : MessageBody.empty();
    }

    /** Request without query string, headers or body. */
    public static Request of(String method, String path) {
        return new Request(method, path, null, HttpHeaders.empty(), MessageBody.empty());
    }
}
