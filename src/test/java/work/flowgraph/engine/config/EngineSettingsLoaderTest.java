package work.flowgraph.engine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.flowgraph.engine.runtime.FailurePolicy;

class EngineSettingsLoaderTest {
    @Test
    void readsEveryTable() throws Exception {
        var path = Path.of(EngineSettingsLoaderTest.class.getResource("/engine.toml").toURI());

        var settings = EngineSettingsLoader.load(path, Map.of());

        assertEquals(FailurePolicy.ISOLATE, settings.executor().failurePolicy());
        assertEquals(3, settings.executor().maxConcurrency());
        assertEquals(Duration.ofSeconds(45), settings.executor().runTimeout().orElseThrow());
        assertTrue(settings.telemetry().enabled());
        assertEquals(URI.create("http://127.0.0.1:9/usage"), settings.telemetry().endpoint());
        assertEquals(Duration.ofMillis(250), settings.telemetry().flushInterval());
        assertEquals(4, settings.telemetry().queueSize());
        assertFalse(settings.telemetry().optOut());
        assertNull(settings.telemetry().apiKey());
        assertEquals(URI.create("http://127.0.0.1:9/api"), settings.source().apiBaseUrl());
        assertEquals("file-key", settings.source().apiKey());
        assertEquals(Path.of("build/flowgraph-cache"), settings.source().cacheDir());
    }

    @Test
    void missingFileYieldsDefaults(@TempDir Path dir) {
        var settings = EngineSettingsLoader.load(dir.resolve("absent.toml"), Map.of());

        assertEquals(EngineSettings.defaults().executor(), settings.executor());
        assertEquals(TelemetrySettings.defaults(), settings.telemetry());
        assertEquals(SourceSettings.DEFAULT_API_BASE_URL, settings.source().apiBaseUrl());
    }

    @Test
    void environmentOverridesFile() {
        var toml = """
            [source]
            api_base_url = "http://file.example"
            api_key = "file-key"

            [telemetry]
            opt_out = false
            """;
        var env = Map.of(
            EngineSettingsLoader.ENV_API_KEY, "env-key",
            EngineSettingsLoader.ENV_API_BASE_URL, "http://env.example/api",
            EngineSettingsLoader.ENV_CACHE_DIR, "/tmp/env-cache",
            EngineSettingsLoader.ENV_TELEMETRY_OPT_OUT, "yes"
        );

        var settings = EngineSettingsLoader.parse(toml, env);

        assertEquals("env-key", settings.source().apiKey());
        assertEquals("env-key", settings.telemetry().apiKey());
        assertEquals(URI.create("http://env.example/api"), settings.source().apiBaseUrl());
        assertEquals(Path.of("/tmp/env-cache"), settings.source().cacheDir());
        assertTrue(settings.telemetry().optOut());
    }

    @Test
    void rejectsInvalidValues() {
        var policy = assertThrows(
            IllegalArgumentException.class,
            () -> EngineSettingsLoader.parse("[executor]\nfailure_policy = \"retry\"\n", Map.of())
        );
        assertEquals("Invalid value for executor.failure_policy: retry", policy.getMessage());

        assertThrows(IllegalArgumentException.class, () -> EngineSettingsLoader.parse("[executor]\nmax_concurrency = 0\n", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> EngineSettingsLoader.parse("[executor]\nrun_timeout = \"later\"\n", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> EngineSettingsLoader.parse("[telemetry]\nenabled = \"maybe\"\n", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> EngineSettingsLoader.parse("[source]\napi_base_url = \"not a url\"\n", Map.of()));
        assertThrows(
            IllegalArgumentException.class,
            () -> EngineSettingsLoader.parse("", Map.of(EngineSettingsLoader.ENV_TELEMETRY_OPT_OUT, "perhaps"))
        );
    }

    @Test
    void rejectsMalformedToml() {
        var error = assertThrows(IllegalArgumentException.class, () -> EngineSettingsLoader.parse("[executor\n", Map.of()));
        assertTrue(error.getMessage().startsWith("Invalid engine configuration"));
    }
}
