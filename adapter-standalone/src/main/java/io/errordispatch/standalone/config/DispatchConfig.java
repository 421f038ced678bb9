package io.errordispatch.standalone.config;

import io.errordispatch.core.hierarchy.TagHierarchy;
import io.errordispatch.core.model.Tag;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration of the standalone error-dispatch server. Use {@link #builder()}; every
 * field has a default.
 *
 * @param serverHost bind address
 * @param serverPort listen port, {@code 0} for an ephemeral port
 * @param maxRedispatch how many times a handler-produced error is dispatched again before the
 *     server gives up with a 500
 * @param consoleLog install the console logging wrap
 * @param healthEnabled register the liveness endpoint
 * @param healthPath liveness endpoint path
 * @param loggingFormat {@code json} or {@code text}
 * @param loggingLevel root log level
 * @param hierarchy tag derivations, child tag text to its parents, in declaration order
 * @param statusMappings tags answered with a fixed problem-details status
 */
public record DispatchConfig(
        String serverHost,
        int serverPort,
        int maxRedispatch,
        boolean consoleLog,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel,
        Map<String, List<String>> hierarchy,
        List<StatusMapping> statusMappings) {

    public DispatchConfig {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (hierarchy != null) {
            hierarchy.forEach((child, parents) -> copy.put(child, List.copyOf(parents)));
        }
        hierarchy = Collections.unmodifiableMap(copy);
        statusMappings = statusMappings != null ? List.copyOf(statusMappings) : List.of();
    }

    /**
     * Builds a fresh, unfrozen tag hierarchy from {@link #hierarchy()}.
     *
     * @throws io.errordispatch.core.error.TagCycleException if the derivations are cyclic
     * @throws IllegalArgumentException if a tag text is invalid
     */
    public TagHierarchy tagHierarchy() {
        TagHierarchy tags = new TagHierarchy();
        hierarchy.forEach((child, parents) -> {
            Tag childTag = Tag.parse(child);
            for (String parent : parents) {
                tags.derive(childTag, Tag.parse(parent));
            }
        });
        return tags;
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link DispatchConfig}. */
    public static final class Builder {
        private String serverHost = "0.0.0.0";
        private int serverPort = 8080;
        private int maxRedispatch = 3;
        private boolean consoleLog;
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private final Map<String, List<String>> hierarchy = new LinkedHashMap<>();
        private final List<StatusMapping> statusMappings = new ArrayList<>();

        Builder() {}

        public Builder serverHost(String serverHost) {
            this.serverHost = serverHost;
            return this;
        }

        public Builder serverPort(int serverPort) {
            this.serverPort = serverPort;
            return this;
        }

        public Builder maxRedispatch(int maxRedispatch) {
            this.maxRedispatch = maxRedispatch;
            return this;
        }

        public Builder consoleLog(boolean consoleLog) {
            this.consoleLog = consoleLog;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /** Declares {@code child} as derived from each of {@code parents}. */
        public Builder derive(String child, List<String> parents) {
            hierarchy.computeIfAbsent(child, k -> new ArrayList<>()).addAll(parents);
            return this;
        }

        public Builder statusMapping(String tag, int status, String title) {
            statusMappings.add(new StatusMapping(tag, status, title));
            return this;
        }

        public DispatchConfig build() {
            return new DispatchConfig(
                    serverHost,
                    serverPort,
                    maxRedispatch,
                    consoleLog,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel,
                    hierarchy,
                    statusMappings);
        }
    }
}
