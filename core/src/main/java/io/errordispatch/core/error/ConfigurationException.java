package io.errordispatch.core.error;

/**
 * Thrown when the handler configuration cannot resolve every error, i.e. no default handler is
 * registered. Raised when a registry is built and, should a registry without a default ever
 * reach the engine, at dispatch time instead of dropping the error.
 */
public final class ConfigurationException extends ErrorDispatchException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message, Phase.CONFIGURATION);
    }

    public ConfigurationException(String message, Phase phase) {
        super(message, phase);
    }
}
