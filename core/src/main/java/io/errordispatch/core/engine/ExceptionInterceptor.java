package io.errordispatch.core.engine;

import io.errordispatch.core.handler.DefaultHandlers;
import io.errordispatch.core.hierarchy.TagHierarchy;
import io.errordispatch.core.model.DispatchResult;
import io.errordispatch.core.model.ErrorContext;
import io.errordispatch.core.registry.HandlerRegistry;
import java.util.Objects;

/**
 * Error stage of a host request pipeline. The host calls {@link #onError(ErrorContext)} when
 * processing fails and continues with the returned context:
 *
 * <ul>
 * <li>a context with a response: the error was handled, send the response;
 * <li>a context with an error: a handler produced a new error, run the error path again.
 * </ul>
 *
 * <p>Example:
 *
 * <pre>{@code
 * TagHierarchy tags = new TagHierarchy()
 *         .derive(Tag.parse("app/not-found"), Tag.parse("app/client-error"));
 * ExceptionInterceptor interceptor = ExceptionInterceptor.create(
 *         DefaultHandlers.registry().toBuilder()
 *                 .on(Tag.parse("app/client-error"), DefaultHandlers.status(400, "Bad Request"))
 *                 .on(SQLException.class, (e, req) -> DispatchResult.response(Response.status(503)))
 *                 .wrap(DefaultHandlers.logToConsole())
 *                 .build(),
 *         tags);
 * }</pre>
 */
public final class ExceptionInterceptor {

    public static final String NAME = "exception";

    private final ErrorDispatcher dispatcher;

    public ExceptionInterceptor(ErrorDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    /** Interceptor over the default handler set and an empty tag hierarchy. */
    public static ExceptionInterceptor create() {
        return create(DefaultHandlers.registry(), new TagHierarchy());
    }

    public static ExceptionInterceptor create(HandlerRegistry registry, TagHierarchy tagHierarchy) {
        return new ExceptionInterceptor(new ErrorDispatcher(registry, tagHierarchy));
    }

    public String name() {
        return NAME;
    }

    /**
     * Dispatches the context's error.
     *
     * @param context context carrying the pending error; returned unchanged if it has none
     * @return a context carrying either the response or a replacement error, never both
     */
    public ErrorContext onError(ErrorContext context) {
        Objects.requireNonNull(context, "context must not be null");
        if (!context.hasError()) {
            return context;
        }
        DispatchResult result = dispatcher.dispatch(context.error(), context.request());
        return result.isResponse() ? context.withResponse(result.response()) : context.withError(result.error());
    }

    public ErrorDispatcher dispatcher() {
        return dispatcher;
    }
}
