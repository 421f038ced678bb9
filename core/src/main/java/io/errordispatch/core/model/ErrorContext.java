package io.errordispatch.core.model;

import java.util.Objects;

/**
 * Slice of the host pipeline's context seen by {@link
 * io.errordispatch.core.engine.ExceptionInterceptor}. Carries the request and either a pending
 * error or a response, never both.
 *
 * @param request the request being processed, never null
 * @param response the terminal response, nullable
 * @param error the pending error, nullable
 */
public record ErrorContext(Request request, Response response, Throwable error) {

    public ErrorContext {
        Objects.requireNonNull(request, "request must not be null");
        if (response != null && error != null) {
            throw new IllegalArgumentException("context must not carry both a response and an error");
        }
    }

    /** Context for a request that failed with {@code error}. */
    public static ErrorContext failed(Request request, Throwable error) {
        return new ErrorContext(request, null, Objects.requireNonNull(error, "error must not be null"));
    }

    /** Returns a copy carrying {@code response} and no error. */
    public ErrorContext withResponse(Response response) {
        return new ErrorContext(request, Objects.requireNonNull(response, "response must not be null"), null);
    }

    /** Returns a copy carrying {@code error} and no response. */
    public ErrorContext withError(Throwable error) {
        return new ErrorContext(request, null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean hasResponse() {
        return response != null;
    }
}
