package work.flowgraph.engine.config;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where stored workflow specifications are fetched from and cached.
 */
public record SourceSettings(URI apiBaseUrl, String apiKey, Path cacheDir) {
    public static final URI DEFAULT_API_BASE_URL = URI.create("https://api.roboflow.com");

    public SourceSettings {
        Objects.requireNonNull(apiBaseUrl, "apiBaseUrl");
        Objects.requireNonNull(cacheDir, "cacheDir");
    }

    public static SourceSettings defaults() {
        return new SourceSettings(DEFAULT_API_BASE_URL, null, defaultCacheDir());
    }

    static Path defaultCacheDir() {
        return Path.of(System.getProperty("java.io.tmpdir"), "flowgraph-cache");
    }
}
