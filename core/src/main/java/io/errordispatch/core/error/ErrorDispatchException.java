package io.errordispatch.core.error;

/**
 * Abstract base for failures of the dispatch machinery itself, as opposed to the application
 * errors it dispatches. These are never absorbed by the engine: they propagate to whoever
 * configured or invoked it.
 */
public abstract class ErrorDispatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the failure was detected. */
    public enum Phase {
        CONFIGURATION,
        DISPATCH
    }

    private final Phase phase;

    protected ErrorDispatchException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ErrorDispatchException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** The phase in which the failure was detected. */
    public Phase phase() {
        return phase;
    }
}
