package io.errordispatch.core.spi;

import io.errordispatch.core.model.DispatchResult;
import io.errordispatch.core.model.Request;

/**
 * Cross-cutting hook around every handler invocation (logging, metrics, suppression).
 *
 * <p>Receives the handler the dispatcher already resolved for the error and decides whether to
 * call it, and how many times. Registered under the reserved {@code wrap} entry of a {@link
 * io.errordispatch.core.registry.HandlerRegistry}.
 */
@FunctionalInterface
public interface WrapFunction {

    DispatchResult wrap(ErrorHandler handler, Throwable error, Request request);
}
