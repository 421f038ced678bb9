package io.errordispatch.core.spi;

import io.errordispatch.core.model.DispatchResult;
import io.errordispatch.core.model.Request;

/**
 * Converts an error raised while processing a request into a response, or into a new error
 * for the host pipeline to dispatch again.
 *
 * <p>Implementations must be thread-safe and must not block indefinitely. Throwing a {@link
 * RuntimeException} is equivalent to returning {@link DispatchResult#error(Throwable)}.
 */
@FunctionalInterface
public interface ErrorHandler {

    /**
     * @param error the error being dispatched
     * @param request the request that failed
     * @return a response or a replacement error, never null
     */
    DispatchResult handle(Throwable error, Request request);
}
