package io.errordispatch.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.errordispatch.core.error.TagCycleException;
import io.errordispatch.core.model.Tag;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link DispatchConfig} from a YAML file with an environment variable overlay.
 *
 * <p>Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code error-dispatch.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>Missing keys receive the defaults of {@link DispatchConfig.Builder}. Every scalar key can be
 * overridden by an environment variable, which takes precedence over the YAML value. A variable
 * counts as set only if it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "error-dispatch.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration, applying overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the validated configuration
     * @throws ConfigLoadException if the file is missing, unreadable or invalid
     */
    public static DispatchConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration, applying overrides from {@code envLookup}. The lookup returns
     * {@code null} for undefined variables.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup environment variable lookup function
     * @return the validated configuration
     * @throws ConfigLoadException if the file is missing, unreadable or invalid
     */
    public static DispatchConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            DispatchConfig config = mapToConfig(root != null ? root : YAML_MAPPER.createObjectNode(), envLookup);
            validate(config);
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static DispatchConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        DispatchConfig.Builder builder = DispatchConfig.builder();

        JsonNode server = root.path("server");
        if (server.has("host")) builder.serverHost(server.get("host").asText());
        if (server.has("port")) builder.serverPort(server.get("port").asInt());

        JsonNode dispatch = root.path("dispatch");
        if (dispatch.has("max-redispatch"))
            builder.maxRedispatch(dispatch.get("max-redispatch").asInt());
        if (dispatch.has("console-log"))
            builder.consoleLog(dispatch.get("console-log").asBoolean());

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // child: parent  or  child: [parent, ...]
        JsonNode hierarchy = root.path("hierarchy");
        if (!hierarchy.isMissingNode() && !hierarchy.isNull()) {
            if (!hierarchy.isObject()) {
                throw new ConfigLoadException("'hierarchy' must be a map of child tag to parent tags");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = hierarchy.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.derive(field.getKey(), textList(field.getValue()));
            }
        }

        JsonNode mappings = root.path("status-mappings");
        if (!mappings.isMissingNode() && !mappings.isNull()) {
            if (!mappings.isArray()) {
                throw new ConfigLoadException("'status-mappings' must be a list");
            }
            for (JsonNode mapping : mappings) {
                String tag = textOrNull(mapping, "tag");
                if (tag == null || tag.isBlank()) {
                    throw new ConfigLoadException("status-mappings entry is missing required field 'tag'");
                }
                if (!mapping.has("status")) {
                    throw new ConfigLoadException("status-mappings entry for '" + tag + "' is missing 'status'");
                }
                builder.statusMapping(tag, mapping.get("status").asInt(), textOrNull(mapping, "title"));
            }
        }

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(DispatchConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "SERVER_HOST", builder::serverHost);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "SERVER_PORT", builder::serverPort);
        envInt(envLookup, "DISPATCH_MAX_REDISPATCH", builder::maxRedispatch);

        envBool(envLookup, "DISPATCH_CONSOLE_LOG", builder::consoleLog);
        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);
    }

    private static void validate(DispatchConfig config) {
        if (config.serverPort() < 0 || config.serverPort() > 65535) {
            throw new ConfigLoadException("server.port must be within 0..65535, was " + config.serverPort());
        }
        if (config.maxRedispatch() < 1) {
            throw new ConfigLoadException("dispatch.max-redispatch must be positive, was " + config.maxRedispatch());
        }
        if (!"json".equalsIgnoreCase(config.loggingFormat()) && !"text".equalsIgnoreCase(config.loggingFormat())) {
            throw new ConfigLoadException("logging.format must be 'json' or 'text', was '" + config.loggingFormat() + "'");
        }
        for (StatusMapping mapping : config.statusMappings()) {
            if (mapping.status() < 100 || mapping.status() > 599) {
                throw new ConfigLoadException("status-mappings entry for '" + mapping.tag()
                        + "' has status " + mapping.status() + " outside 100..599");
            }
            requireValidTag(mapping.tag());
        }
        try {
            config.tagHierarchy();
        } catch (TagCycleException e) {
            throw new ConfigLoadException("Invalid hierarchy: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid tag in hierarchy: " + e.getMessage(), e);
        }
    }

    private static void requireValidTag(String text) {
        try {
            Tag.parse(text);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(e.getMessage(), e);
        }
    }

    // --- Env var helpers ---

    /** A variable is "set" if it is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, was '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        } else if (!node.isNull()) {
            values.add(node.asText());
        }
        return values;
    }
}
