package io.errordispatch.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.errordispatch.core.error.TaggedException;
import io.errordispatch.core.handler.DefaultHandlers;
import io.errordispatch.core.hierarchy.TagHierarchy;
import io.errordispatch.core.model.Request;
import io.errordispatch.core.model.Tag;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/** Verifies the dispatcher's log output and the MDC seen by wrap functions. */
class DispatchLoggingTest {

    private static final Request REQUEST = Request.of("DELETE", "/carts/7");

    private final Logger dispatcherLogger = (Logger) LoggerFactory.getLogger(ErrorDispatcher.class);
    private final Logger auditLogger = (Logger) LoggerFactory.getLogger("io.errordispatch.audit");
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>() {
        @Override
        protected void append(ILoggingEvent event) {
            // MDC is read lazily; capture it while the dispatcher still holds it
            event.prepareForDeferredProcessing();
            super.append(event);
        }
    };

    @BeforeEach
    void attach() {
        appender.start();
        dispatcherLogger.addAppender(appender);
        auditLogger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        dispatcherLogger.detachAppender(appender);
        auditLogger.detachAppender(appender);
        appender.stop();
    }

    @Test
    void dispatchLogsRuleAndKey() {
        var dispatcher = new ErrorDispatcher(DefaultHandlers.registry(), new TagHierarchy());

        dispatcher.dispatch(new IllegalStateException("x"), REQUEST);

        assertThat(appender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
                    assertThat(event.getFormattedMessage())
                            .contains("java.lang.IllegalStateException")
                            .contains("rule=DEFAULT");
                });
    }

    @Test
    void slf4jWrapLogsWithTagAndRuleInMdc() {
        var registry = DefaultHandlers.registry().toBuilder()
                .on(Tag.parse("app/conflict"), DefaultHandlers.status(409, "Conflict"))
                .wrap(DefaultHandlers.logToSlf4j(auditLogger))
                .build();
        var dispatcher = new ErrorDispatcher(registry, new TagHierarchy());

        var result = dispatcher.dispatch(new TaggedException("version clash", Tag.parse("app/conflict")), REQUEST);

        assertThat(result.response().status()).isEqualTo(409);
        ILoggingEvent warn = appender.list.stream()
                .filter(e -> e.getLevel() == Level.WARN)
                .findFirst()
                .orElseThrow();
        assertThat(warn.getFormattedMessage()).isEqualTo("DELETE \"/carts/7\" => version clash");
        assertThat(warn.getThrowableProxy().getClassName()).isEqualTo(TaggedException.class.getName());
        assertThat(warn.getMDCPropertyMap())
                .containsEntry(ErrorDispatcher.MDC_TAG, "app/conflict")
                .containsEntry(ErrorDispatcher.MDC_RULE, "TAG");
    }

    @Test
    void mdcIsClearedAfterDispatch() {
        var dispatcher = new ErrorDispatcher(DefaultHandlers.registry(), new TagHierarchy());

        dispatcher.dispatch(new TaggedException("x", Tag.parse("app/any")), REQUEST);

        assertThat(MDC.get(ErrorDispatcher.MDC_TAG)).isNull();
        assertThat(MDC.get(ErrorDispatcher.MDC_RULE)).isNull();
    }
}
