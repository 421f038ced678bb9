package io.errordispatch.standalone.server;

import io.errordispatch.core.engine.ExceptionInterceptor;
import io.errordispatch.core.handler.DefaultHandlers;
import io.errordispatch.core.hierarchy.TagHierarchy;
import io.errordispatch.core.model.DispatchResult;
import io.errordispatch.core.model.MessageBody;
import io.errordispatch.core.model.Response;
import io.errordispatch.core.model.Tag;
import io.errordispatch.core.registry.HandlerRegistry;
import io.errordispatch.standalone.adapter.StandaloneAdapter;
import io.errordispatch.standalone.config.ConfigLoader;
import io.errordispatch.standalone.config.DispatchConfig;
import io.errordispatch.standalone.config.StatusMapping;
import io.javalin.Javalin;
import io.javalin.http.HttpResponseException;
import java.nio.file.Path;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and runs a Javalin server whose route failures go through error dispatch.
 *
 * <p>Startup:
 * <ol>
 * <li>Build the tag hierarchy from {@code hierarchy} and freeze it</li>
 * <li>Build the handler registry: the default set, Javalin's own HTTP errors, the configured
 * status mappings, then application handlers</li>
 * <li>Create the Javalin server, register the health endpoint and application routes</li>
 * <li>Install {@link JavalinErrorBridge} for every {@link Exception}</li>
 * </ol>
 *
 * <p>Separate from {@link io.errordispatch.standalone.StandaloneMain} so tests can start it
 * without going through {@code main()}.
 */
public final class ErrorDispatchApp {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorDispatchApp.class);

    private final Javalin app;
    private final ExceptionInterceptor interceptor;
    private final DispatchConfig config;

    private ErrorDispatchApp(Javalin app, ExceptionInterceptor interceptor, DispatchConfig config) {
        this.app = app;
        this.interceptor = interceptor;
        this.config = config;
    }

    /**
     * Loads configuration from the command line ({@code --config <path>}), configures logging and
     * starts a server with no application routes.
     */
    public static ErrorDispatchApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        DispatchConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return start(config, handlers -> {}, routes -> {});
    }

    public static ErrorDispatchApp start(DispatchConfig config, Consumer<Javalin> routes) {
        return start(config, handlers -> {}, routes);
    }

    /**
     * Starts a server.
     *
     * @param config server and dispatch configuration
     * @param handlers adds or overrides handlers; applied after the configured status mappings
     * @param routes registers application routes
     * @return the running application
     */
    public static ErrorDispatchApp start(
            DispatchConfig config, Consumer<HandlerRegistry.Builder> handlers, Consumer<Javalin> routes) {
        long startTime = System.nanoTime();

        TagHierarchy tags = config.tagHierarchy();
        tags.freeze();

        HandlerRegistry.Builder registry = DefaultHandlers.registry().toBuilder()
                .on(HttpResponseException.class, (error, request) -> {
                    HttpResponseException http = (HttpResponseException) error;
                    return DispatchResult.response(Response.of(http.getStatus(), MessageBody.text(http.getMessage())));
                });
        for (StatusMapping mapping : config.statusMappings()) {
            registry.on(Tag.parse(mapping.tag()), DefaultHandlers.status(mapping.status(), mapping.title()));
        }
        handlers.accept(registry);
        if (config.consoleLog()) {
            registry.wrap(DefaultHandlers.logToConsole());
        }
        HandlerRegistry built = registry.build();
        ExceptionInterceptor interceptor = ExceptionInterceptor.create(built, tags);

        Javalin app = Javalin.create();
        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }
        routes.accept(app);
        app.exception(
                Exception.class,
                new JavalinErrorBridge(interceptor, new StandaloneAdapter(), config.maxRedispatch()));

        app.start(config.serverHost(), config.serverPort());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "error-dispatch started: port={}, handlers={}, tags={}, maxRedispatch={}, consoleLog={}, startupMs={}",
                app.port(),
                built.size(),
                tags.size(),
                config.maxRedispatch(),
                config.consoleLog(),
                elapsedMs);

        return new ErrorDispatchApp(app, interceptor, config);
    }

    /** Returns the port the server is listening on. */
    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public ExceptionInterceptor interceptor() {
        return interceptor;
    }

    public DispatchConfig config() {
        return config;
    }

    public void stop() {
        app.stop();
        LOG.info("error-dispatch stopped");
    }
}
