package io.errordispatch.core.model;

import java.util.Objects;

/**
 * Outcome of invoking an error handler. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#RESPONSE}: the handler answered; {@link #response()} holds the terminal
 * response.
 * <li>{@link Type#ERROR}: the handler produced a new error; {@link #error()} holds it and the
 * host pipeline is expected to run its error path again with it.
 * </ul>
 */
public final class DispatchResult {

    /** The kind of outcome. */
    public enum Type {
        RESPONSE,
        ERROR
    }

    private final Type type;
    private final Response response;
    private final Throwable error;

    private DispatchResult(Type type, Response response, Throwable error) {
        this.type = type;
        this.response = response;
        this.error = error;
    }

    /** Creates a terminal result. */
    public static DispatchResult response(Response response) {
        Objects.requireNonNull(response, "response must not be null for RESPONSE");
        return new DispatchResult(Type.RESPONSE, response, null);
    }

    /** Creates a result asking the host pipeline to re-dispatch {@code error}. */
    public static DispatchResult error(Throwable error) {
        Objects.requireNonNull(error, "error must not be null for ERROR");
        return new DispatchResult(Type.ERROR, null, error);
    }

    public Type type() {
        return type;
    }

    /** Only valid when {@code type() == RESPONSE}. */
    public Response response() {
        return response;
    }

    /** Only valid when {@code type() == ERROR}. */
    public Throwable error() {
        return error;
    }

    public boolean isResponse() {
        return type == Type.RESPONSE;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        return switch (type) {
            case RESPONSE -> "DispatchResult[RESPONSE, status=" + response.status() + "]";
            case ERROR -> "DispatchResult[ERROR, " + error.getClass().getName() + "]";
        };
    }
}
