package io.errordispatch.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.errordispatch.core.error.TaggedException;
import io.errordispatch.core.handler.DefaultHandlers;
import io.errordispatch.core.hierarchy.TagHierarchy;
import io.errordispatch.core.model.DispatchResult;
import io.errordispatch.core.model.ErrorContext;
import io.errordispatch.core.model.MessageBody;
import io.errordispatch.core.model.Request;
import io.errordispatch.core.model.Response;
import io.errordispatch.core.model.Tag;
import org.junit.jupiter.api.Test;

class ExceptionInterceptorTest {

    private static final Request REQUEST = Request.of("GET", "/orders/42");
    private static final Tag NOT_FOUND = Tag.parse("app/not-found");
    private static final Tag CLIENT_ERROR = Tag.parse("app/client-error");

    @Test
    void isNamedException() {
        assertThat(ExceptionInterceptor.create().name()).isEqualTo("exception");
    }

    @Test
    void handledErrorIsReplacedByResponse() {
        var tags = new TagHierarchy().derive(NOT_FOUND, CLIENT_ERROR);
        var interceptor = ExceptionInterceptor.create(
                DefaultHandlers.registry().toBuilder()
                        .on(CLIENT_ERROR, DefaultHandlers.status(400, "Bad Request"))
                        .build(),
                tags);

        ErrorContext out = interceptor.onError(ErrorContext.failed(REQUEST, new TaggedException("gone", NOT_FOUND)));

        assertThat(out.hasError()).isFalse();
        assertThat(out.response().status()).isEqualTo(400);
        assertThat(out.request()).isSameAs(REQUEST);
    }

    @Test
    void handlerErrorIsPutBackOnTheContext() {
        var replacement = new IllegalStateException("second failure");
        var interceptor = ExceptionInterceptor.create(
                DefaultHandlers.registry().toBuilder()
                        .on(IllegalArgumentException.class, (e, req) -> DispatchResult.error(replacement))
                        .build(),
                new TagHierarchy());

        ErrorContext out = interceptor.onError(ErrorContext.failed(REQUEST, new IllegalArgumentException("bad")));

        assertThat(out.hasResponse()).isFalse();
        assertThat(out.error()).isSameAs(replacement);

        ErrorContext again = interceptor.onError(out);
        assertThat(again.response().status()).isEqualTo(500);
    }

    @Test
    void contextWithoutErrorPassesThrough() {
        var ctx = new ErrorContext(REQUEST, Response.of(200, MessageBody.text("ok")), null);

        assertThat(ExceptionInterceptor.create().onError(ctx)).isSameAs(ctx);
    }

    @Test
    void contextNeverCarriesBothResponseAndError() {
        assertThatThrownBy(() -> new ErrorContext(REQUEST, Response.status(500), new RuntimeException()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
