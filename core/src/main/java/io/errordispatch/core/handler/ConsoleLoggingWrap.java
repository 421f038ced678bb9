package io.errordispatch.core.handler;

import io.errordispatch.core.model.DispatchResult;
import io.errordispatch.core.model.Request;
import io.errordispatch.core.spi.ErrorHandler;
import io.errordispatch.core.spi.WrapFunction;
import java.io.PrintWriter;
import java.io.Writer;
import java.time.Clock;
import java.util.Objects;

/**
 * Wrap function that prints every dispatched error before delegating to the resolved handler.
 * Writes one line
 *
 * <pre>{@code 2026-10-19T08:15:30.123Z GET "/orders/42" => order 42 does not exist}</pre>
 *
 * followed by the error's stack trace.
 */
public final class ConsoleLoggingWrap implements WrapFunction {

    private final PrintWriter out;
    private final Clock clock;

    public ConsoleLoggingWrap(Writer sink, Clock clock) {
        Objects.requireNonNull(sink, "sink must not be null");
        this.out = sink instanceof PrintWriter printWriter ? printWriter : new PrintWriter(sink);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public DispatchResult wrap(ErrorHandler handler, Throwable error, Request request) {
        synchronized (out) {
            out.write(clock.instant() + " " + request.method() + " \"" + request.path() + "\" => "
                    + Objects.toString(error.getMessage(), "") + "\n");
            error.printStackTrace(out);
            out.flush();
        }
        return handler.handle(error, request);
    }
}
