package io.errordispatch.standalone.server;

import io.errordispatch.core.engine.ExceptionInterceptor;
import io.errordispatch.core.error.ErrorDispatchException;
import io.errordispatch.core.handler.DefaultHandlers;
import io.errordispatch.core.model.ErrorContext;
import io.errordispatch.core.model.Request;
import io.errordispatch.core.model.Response;
import io.errordispatch.standalone.adapter.StandaloneAdapter;
import io.javalin.http.Context;
import io.javalin.http.ExceptionHandler;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Javalin exception handler that runs the host side of error dispatch.
 *
 * <p>The failed request is wrapped once and handed to the {@link ExceptionInterceptor}. When a
 * handler produces a new error instead of a response, that error is dispatched again, at most
 * {@code maxRedispatch} times. If no response has been produced by then, the last error is
 * logged at ERROR and answered with the generic 500 of {@link DefaultHandlers#defaultHandler()}.
 */
public final class JavalinErrorBridge implements ExceptionHandler<Exception> {

    private static final Logger LOG = LoggerFactory.getLogger(JavalinErrorBridge.class);

    private final ExceptionInterceptor interceptor;
    private final StandaloneAdapter adapter;
    private final int maxRedispatch;

    public JavalinErrorBridge(ExceptionInterceptor interceptor, StandaloneAdapter adapter, int maxRedispatch) {
        this.interceptor = Objects.requireNonNull(interceptor, "interceptor must not be null");
        this.adapter = Objects.requireNonNull(adapter, "adapter must not be null");
        if (maxRedispatch < 1) {
            throw new IllegalArgumentException("maxRedispatch must be positive, was " + maxRedispatch);
        }
        this.maxRedispatch = maxRedispatch;
    }

    @Override
    public void handle(Exception exception, Context ctx) {
        Request request = adapter.wrapRequest(ctx);
        adapter.applyResponse(resolve(ErrorContext.failed(request, exception)), ctx);
    }

    /** Dispatches until a response is produced or the re-dispatch budget is spent. */
    Response resolve(ErrorContext failed) {
        ErrorContext current = failed;
        try {
            for (int dispatches = 0; dispatches <= maxRedispatch; dispatches++) {
                current = interceptor.onError(current);
                if (current.hasResponse()) {
                    return current.response();
                }
                if (dispatches < maxRedispatch) {
                    LOG.debug(
                            "Re-dispatching {} for {} {} ({} of {})",
                            current.error().getClass().getName(),
                            failed.request().method(),
                            failed.request().path(),
                            dispatches + 1,
                            maxRedispatch);
                }
            }
            LOG.error(
                    "No response for {} {} after {} re-dispatches",
                    failed.request().method(),
                    failed.request().path(),
                    maxRedispatch,
                    current.error());
        } catch (ErrorDispatchException e) {
            LOG.error(
                    "Error dispatch failed for {} {}: {}",
                    failed.request().method(),
                    failed.request().path(),
                    e.getMessage(),
                    e);
            current = current.withError(e);
        }
        return DefaultHandlers.defaultHandler().handle(current.error(), failed.request()).response();
    }

    int maxRedispatch() {
        return maxRedispatch;
    }
}
