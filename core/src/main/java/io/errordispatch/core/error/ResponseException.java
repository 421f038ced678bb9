package io.errordispatch.core.error;

import io.errordispatch.core.model.Response;
import io.errordispatch.core.model.Tags;
import java.util.Map;
import java.util.Objects;

/**
 * Short-circuits request processing with a ready-made response. The default handler set
 * answers it with the embedded response unchanged.
 */
public class ResponseException extends TaggedException {

    private static final long serialVersionUID = 1L;

    /** Data key under which the response is stored. */
    public static final String RESPONSE_KEY = "response";

    public ResponseException(Response response) {
        this("HTTP " + response.status(), response);
    }

    public ResponseException(String message, Response response) {
        super(message, Tags.RESPONSE, Map.of(RESPONSE_KEY, Objects.requireNonNull(response, "response")));
    }

    /** The embedded response. */
    public Response response() {
        return (Response) data().get(RESPONSE_KEY);
    }
}
