package work.flowgraph.engine.config;

import java.util.Objects;
import work.flowgraph.engine.runtime.ExecutorSettings;

/**
 * Everything an engine instance is configured with. Built by {@link EngineSettingsLoader} or in code.
 */
public record EngineSettings(ExecutorSettings executor, TelemetrySettings telemetry, SourceSettings source) {
    public EngineSettings {
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(telemetry, "telemetry");
        Objects.requireNonNull(source, "source");
    }

    public static EngineSettings defaults() {
        return new EngineSettings(ExecutorSettings.defaults(), TelemetrySettings.defaults(), SourceSettings.defaults());
    }

    public EngineSettings withExecutor(ExecutorSettings settings) {
        return new EngineSettings(settings, telemetry, source);
    }

    public EngineSettings withTelemetry(TelemetrySettings settings) {
        return new EngineSettings(executor, settings, source);
    }

    public EngineSettings withSource(SourceSettings settings) {
        return new EngineSettings(executor, telemetry, settings);
    }
}
