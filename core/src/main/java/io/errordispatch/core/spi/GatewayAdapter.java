package io.errordispatch.core.spi;

import io.errordispatch.core.model.Request;
import io.errordispatch.core.model.Response;

/**
 * Bridges a host server's native request/response object and the dispatcher's model.
 *
 * <p>Each host (Javalin, a servlet container, ...) provides one implementation. The type
 * parameter {@code <R>} is the host-native exchange object.
 *
 * <p>Implementations MUST be thread-safe; a single instance is shared across request threads.
 *
 * @param <R> the host-native request/response type
 */
public interface GatewayAdapter<R> {

    /**
     * Snapshots the native request into a {@link Request}. Header names are normalized to
     * lowercase; a missing body becomes {@code MessageBody.empty()}.
     *
     * @param nativeExchange the host-native object
     * @return the request as seen by error handlers
     */
    Request wrapRequest(R nativeExchange);

    /**
     * Writes the status, headers and body of {@code response} to the native object. Called once,
     * after dispatch produced a terminal response.
     *
     * @param response the response to send
     * @param nativeExchange the host-native object to update
     */
    void applyResponse(Response response, R nativeExchange);
}
