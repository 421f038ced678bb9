package io.errordispatch.core.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.errordispatch.core.error.DecodeException;
import io.errordispatch.core.error.ErrorValues;
import io.errordispatch.core.error.ResponseException;
import io.errordispatch.core.model.DispatchResult;
import io.errordispatch.core.model.MessageBody;
import io.errordispatch.core.model.Response;
import io.errordispatch.core.model.Tags;
import io.errordispatch.core.registry.HandlerRegistry;
import io.errordispatch.core.spi.ErrorEncoder;
import io.errordispatch.core.spi.ErrorHandler;
import io.errordispatch.core.spi.WrapFunction;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * The base handler set. {@link #registry()} maps:
 *
 * <table>
 * <caption>Default handlers</caption>
 * <tr><th>Key</th><th>Answer</th></tr>
 * <tr><td>default</td><td>500, {@code {"type":"exception","class":...}}</td></tr>
 * <tr><td>{@link Tags#RESPONSE}</td><td>the response embedded in the error</td></tr>
 * <tr><td>{@link Tags#DECODE_FAILURE}</td><td>400, {@code Malformed "json" request.}</td></tr>
 * <tr><td>{@link Tags#REQUEST_VALIDATION}</td><td>400, encoded validation errors</td></tr>
 * <tr><td>{@link Tags#RESPONSE_VALIDATION}</td><td>500, encoded validation errors</td></tr>
 * </table>
 *
 * <p>Merge application handlers over it with {@code DefaultHandlers.registry().toBuilder()}.
 */
public final class DefaultHandlers {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ErrorEncoder ENCODER = new JacksonErrorEncoder(MAPPER);

    private DefaultHandlers() {
        // utility class
    }

    /** Base registry with the default handlers and no wrap function. */
    public static HandlerRegistry registry() {
        return registry(ENCODER);
    }

    /** Base registry whose validation handlers encode with {@code encoder}. */
    public static HandlerRegistry registry(ErrorEncoder encoder) {
        return HandlerRegistry.builder()
                .defaultHandler(defaultHandler())
                .on(Tags.RESPONSE, responseHandler())
                .on(Tags.DECODE_FAILURE, decodeFailureHandler())
                .on(Tags.REQUEST_VALIDATION, validationHandler(400, encoder))
                .on(Tags.RESPONSE_VALIDATION, validationHandler(500, encoder))
                .build();
    }

    /** Generic 500 naming the error's class. Never throws. */
    public static ErrorHandler defaultHandler() {
        return (error, request) -> {
            ObjectNode body = MAPPER.createObjectNode();
            body.put("type", "exception");
            body.put("class", error.getClass().getName());
            return DispatchResult.response(Response.of(500, MessageBody.json(toBytes(body))));
        };
    }

    /** Returns the response carried by a {@link ResponseException}. */
    public static ErrorHandler responseHandler() {
        return (error, request) -> {
            Object embedded = ErrorValues.dataOf(error).get(ResponseException.RESPONSE_KEY);
            if (embedded instanceof Response response) {
                return DispatchResult.response(response);
            }
            return DispatchResult.error(new IllegalStateException(
                    "Error tagged " + Tags.RESPONSE + " carries no response: " + error.getMessage(), error));
        };
    }

    /** 400 plain-text answer naming the format the request body failed to decode as. */
    public static ErrorHandler decodeFailureHandler() {
        return (error, request) -> {
            Object format = ErrorValues.dataOf(error).get(DecodeException.FORMAT_KEY);
            String text = format != null ? "Malformed \"" + format + "\" request." : "Malformed request.";
            return DispatchResult.response(Response.of(400, MessageBody.text(text)));
        };
    }

    /**
     * Answers validation errors with {@code status} and the encoded error data. If the encoder
     * fails, the failure is handed back for re-dispatch so a simpler handler can answer.
     */
    public static ErrorHandler validationHandler(int status, ErrorEncoder encoder) {
        Objects.requireNonNull(encoder, "encoder must not be null");
        return (error, request) -> {
            JsonNode body = encoder.encode(ErrorValues.dataOf(error));
            return DispatchResult.response(Response.of(status, MessageBody.json(toBytes(body))));
        };
    }

    /** RFC 9457 problem-details answer with a fixed status and title. */
    public static ErrorHandler status(int status, String title) {
        return new ProblemDetails(status, title);
    }

    /** Console logging wrap writing to standard output. */
    public static WrapFunction logToConsole() {
        return logToConsole(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
    }

    /** Console logging wrap writing to {@code sink}. */
    public static WrapFunction logToConsole(Writer sink) {
        return new ConsoleLoggingWrap(sink, Clock.systemUTC());
    }

    /** Wrap logging each dispatched error at WARN, with its stack trace, through {@code logger}. */
    public static WrapFunction logToSlf4j(Logger logger) {
        Objects.requireNonNull(logger, "logger must not be null");
        return (handler, error, request) -> {
            logger.warn("{} \"{}\" => {}", request.method(), request.path(), error.getMessage(), error);
            return handler.handle(error, request);
        };
    }

    static byte[] toBytes(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize error body", e);
        }
    }
}
