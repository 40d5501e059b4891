package work.flowgraph.engine.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.flowgraph.engine.runtime.ExecutorSettings;
import work.flowgraph.engine.runtime.FailurePolicy;
import work.flowgraph.engine.shared.DurationParser;

/**
 * Reads {@link EngineSettings} from an {@code engine.toml} file:
 *
 * <pre>
 * [executor]
 * failure_policy = "isolate"
 * max_concurrency = 8
 * run_timeout = "30s"
 *
 * [telemetry]
 * enabled = true
 * endpoint = "https://..."
 * flush_interval = "10s"
 * queue_size = 10
 * opt_out = false
 *
 * [source]
 * api_base_url = "https://..."
 * api_key = "..."
 * cache_dir = "/var/cache/flowgraph"
 * </pre>
 *
 * {@code FLOWGRAPH_*} environment variables override file values.
 */
public final class EngineSettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineSettingsLoader.class);

    public static final String ENV_API_KEY = "FLOWGRAPH_API_KEY";
    public static final String ENV_API_BASE_URL = "FLOWGRAPH_API_BASE_URL";
    public static final String ENV_CACHE_DIR = "FLOWGRAPH_CACHE_DIR";
    public static final String ENV_TELEMETRY_OPT_OUT = "FLOWGRAPH_TELEMETRY_OPT_OUT";

    private EngineSettingsLoader() {}

    public static EngineSettings load(Path path) {
        return load(path, System.getenv());
    }

    /**
     * Missing files yield defaults (still subject to environment overrides).
     */
    public static EngineSettings load(Path path, Map<String, String> environment) {
        if (path == null || !Files.isRegularFile(path)) {
            log.debug("No engine configuration at {}, using defaults", path);
            return parse("", environment);
        }
        try {
            log.debug("Loading engine configuration from {}", path);
            return parse(Files.readString(path), environment);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read engine configuration: " + path, ex);
        }
    }

    public static EngineSettings parse(String toml, Map<String, String> environment) {
        TomlParseResult result = Toml.parse(toml == null ? "" : toml);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid engine configuration: " + errors);
        }
        var env = environment == null ? Map.<String, String>of() : environment;
        var defaults = EngineSettings.defaults();
        return new EngineSettings(executor(result, defaults.executor()), telemetry(result, env), source(result, env));
    }

    private static ExecutorSettings executor(TomlParseResult toml, ExecutorSettings defaults) {
        var policy = string(toml, "executor.failure_policy")
            .map(value -> {
                try {
                    return FailurePolicy.from(value);
                } catch (IllegalArgumentException ex) {
                    throw invalid("executor.failure_policy", value);
                }
            })
            .orElse(defaults.failurePolicy());
        int concurrency = integer(toml, "executor.max_concurrency").orElse(defaults.maxConcurrency());
        if (concurrency < 1) {
            throw invalid("executor.max_concurrency", concurrency);
        }
        var timeout = duration(toml, "executor.run_timeout");
        return new ExecutorSettings(policy, concurrency, timeout);
    }

    private static TelemetrySettings telemetry(TomlParseResult toml, Map<String, String> env) {
        var defaults = TelemetrySettings.defaults();
        boolean enabled = bool(toml, "telemetry.enabled").orElse(defaults.enabled());
        var endpoint = uri(toml, "telemetry.endpoint").orElse(defaults.endpoint());
        var apiKey = env.containsKey(ENV_API_KEY) ? env.get(ENV_API_KEY) : string(toml, "telemetry.api_key").orElse(null);
        var flushInterval = duration(toml, "telemetry.flush_interval").orElse(defaults.flushInterval());
        if (flushInterval.isZero()) {
            throw invalid("telemetry.flush_interval", flushInterval);
        }
        int queueSize = integer(toml, "telemetry.queue_size").orElse(defaults.queueSize());
        if (queueSize < 1) {
            throw invalid("telemetry.queue_size", queueSize);
        }
        boolean optOut = bool(toml, "telemetry.opt_out").orElse(defaults.optOut());
        if (env.containsKey(ENV_TELEMETRY_OPT_OUT)) {
            optOut = parseFlag(ENV_TELEMETRY_OPT_OUT, env.get(ENV_TELEMETRY_OPT_OUT));
        }
        return new TelemetrySettings(enabled, endpoint, apiKey, flushInterval, queueSize, optOut);
    }

    private static SourceSettings source(TomlParseResult toml, Map<String, String> env) {
        var defaults = SourceSettings.defaults();
        var baseUrl = env.containsKey(ENV_API_BASE_URL)
            ? parseUri(ENV_API_BASE_URL, env.get(ENV_API_BASE_URL))
            : uri(toml, "source.api_base_url").orElse(defaults.apiBaseUrl());
        var apiKey = env.containsKey(ENV_API_KEY) ? env.get(ENV_API_KEY) : string(toml, "source.api_key").orElse(null);
        var cacheDir = env.containsKey(ENV_CACHE_DIR)
            ? Path.of(env.get(ENV_CACHE_DIR))
            : string(toml, "source.cache_dir").map(Path::of).orElse(defaults.cacheDir());
        return new SourceSettings(baseUrl, apiKey, cacheDir);
    }

    private static Optional<String> string(TomlParseResult toml, String key) {
        var value = toml.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof String text)) {
            throw invalid(key, value);
        }
        return Optional.of(text);
    }

    private static Optional<Integer> integer(TomlParseResult toml, String key) {
        var value = toml.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof Long number) || number > Integer.MAX_VALUE || number < Integer.MIN_VALUE) {
            throw invalid(key, value);
        }
        return Optional.of(number.intValue());
    }

    private static Optional<Boolean> bool(TomlParseResult toml, String key) {
        var value = toml.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof Boolean flag)) {
            throw invalid(key, value);
        }
        return Optional.of(flag);
    }

    private static Optional<Duration> duration(TomlParseResult toml, String key) {
        var value = toml.get(key);
        if (value == null) {
            return Optional.empty();
        }
        try {
            return DurationParser.parse(value.toString());
        } catch (IllegalArgumentException ex) {
            throw invalid(key, value);
        }
    }

    private static Optional<URI> uri(TomlParseResult toml, String key) {
        return string(toml, key).map(value -> parseUri(key, value));
    }

    private static URI parseUri(String key, String value) {
        try {
            var uri = URI.create(value.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw invalid(key, value);
            }
            return uri;
        } catch (IllegalArgumentException ex) {
            throw invalid(key, value);
        }
    }

    private static boolean parseFlag(String key, String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "on" -> true;
            case "0", "false", "no", "off", "" -> false;
            default -> throw invalid(key, value);
        };
    }

    private static IllegalArgumentException invalid(String key, Object value) {
        return new IllegalArgumentException("Invalid value for " + key + ": " + value);
    }
}
