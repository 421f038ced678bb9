package io.errordispatch.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Environment variables override YAML values; empty or whitespace-only values count as unset.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        fullConfigPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/full-config.yaml")
                .toURI());
        envVars.clear();
    }

    @Test
    void scalarKeysAreOverridden() {
        envVars.put("SERVER_HOST", "10.0.0.1");
        envVars.put("SERVER_PORT", " 7070 ");
        envVars.put("DISPATCH_MAX_REDISPATCH", "1");
        envVars.put("DISPATCH_CONSOLE_LOG", "false");
        envVars.put("HEALTH_ENABLED", "true");
        envVars.put("HEALTH_PATH", "/live");
        envVars.put("LOG_FORMAT", "text");
        envVars.put("LOG_LEVEL", "WARN");

        DispatchConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.serverHost()).isEqualTo("10.0.0.1");
        assertThat(config.serverPort()).isEqualTo(7070);
        assertThat(config.maxRedispatch()).isEqualTo(1);
        assertThat(config.consoleLog()).isFalse();
        assertThat(config.healthEnabled()).isTrue();
        assertThat(config.healthPath()).isEqualTo("/live");
        assertThat(config.loggingFormat()).isEqualTo("text");
        assertThat(config.loggingLevel()).isEqualTo("WARN");
    }

    @Test
    void blankValuesLeaveYamlInPlace() {
        envVars.put("SERVER_HOST", "");
        envVars.put("SERVER_PORT", "   ");

        DispatchConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.serverHost()).isEqualTo("127.0.0.1");
        assertThat(config.serverPort()).isEqualTo(9191);
    }

    @Test
    void overriddenValuesAreValidated() {
        envVars.put("DISPATCH_MAX_REDISPATCH", "-2");

        assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("max-redispatch");
    }

    @Test
    void nonNumericIntegerIsRejected() {
        envVars.put("SERVER_PORT", "eighty");

        assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("SERVER_PORT");
    }
}
