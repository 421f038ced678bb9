package io.errordispatch.core.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.errordispatch.core.error.ErrorValues;
import io.errordispatch.core.model.DispatchResult;
import io.errordispatch.core.model.MediaType;
import io.errordispatch.core.model.MessageBody;
import io.errordispatch.core.model.Request;
import io.errordispatch.core.model.Response;
import io.errordispatch.core.model.Tag;
import io.errordispatch.core.spi.ErrorHandler;
import java.util.Objects;

/**
 * Handler answering with an RFC 9457 Problem Details body of a fixed status:
 *
 * <pre>{@code
 * {
 * "type": "urn:error-dispatch:app/not-found",
 * "title": "Not Found",
 * "status": 404,
 * "detail": "order 42 does not exist",
 * "instance": "/orders/42"
 * }
 * }</pre>
 *
 * <p>{@code type} is derived from the error's tag, or {@code about:blank} for untagged errors.
 */
public final class ProblemDetails implements ErrorHandler {

    static final String URN_PREFIX = "urn:error-dispatch:";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int status;
    private final String title;

    public ProblemDetails(int status, String title) {
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("status must be within 100..599, was " + status);
        }
        this.status = status;
        this.title = Objects.requireNonNull(title, "title must not be null");
    }

    @Override
    public DispatchResult handle(Throwable error, Request request) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", ErrorValues.tagOf(error).map(Tag::toString).map(t -> URN_PREFIX + t).orElse("about:blank"));
        node.put("title", title);
        node.put("status", status);
        node.put("detail", error.getMessage());
        node.put("instance", request.path());
        return DispatchResult.response(
                Response.of(status, MessageBody.of(DefaultHandlers.toBytes(node), MediaType.PROBLEM_JSON)));
    }

    public int status() {
        return status;
    }

    public String title() {
        return title;
    }
}
