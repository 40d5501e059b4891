package work.flowgraph.engine.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import picocli.CommandLine;
import work.flowgraph.engine.api.LogLevel;
import work.flowgraph.engine.api.RunConfiguration;
import work.flowgraph.engine.api.WorkflowEngine;
import work.flowgraph.engine.api.WorkflowTarget;
import work.flowgraph.engine.config.EngineSettingsLoader;
import work.flowgraph.engine.runtime.FailurePolicy;
import work.flowgraph.engine.shared.DurationParser;

@CommandLine.Command(
    name = "flowgraph-run",
    description = "Compile and run a workflow specification.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class WorkflowRunCommand implements Callable<Integer> {
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Option(
        names = {"-s", "--spec"},
        paramLabel = "PATH",
        description = "Workflow specification file (JSON or YAML).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path specPath;

    @CommandLine.Option(
        names = "--workspace",
        description = "Workspace of a stored workflow (use with --workflow-id).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String workspace;

    @CommandLine.Option(
        names = "--workflow-id",
        description = "Id of a stored workflow (use with --workspace).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String workflowId;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|-|JSON",
        description = "Runtime inputs as a JSON object: a file, '-' for stdin, or inline JSON (default: {}).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String input;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "PATH",
        description = "Engine configuration file (default: ./engine.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configPath;

    @CommandLine.Option(
        names = "--policy",
        description = "Failure policy (fail-fast|isolate).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String policyRaw;

    @CommandLine.Option(
        names = "--max-concurrency",
        description = "Maximum number of block invocations running at once.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxConcurrency;

    @CommandLine.Option(
        names = "--timeout",
        description = "Run timeout (e.g. 500ms, 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        var target = resolveTarget();
        var logLevel = resolveLogLevel();
        System.setProperty(LOG_LEVEL_PROPERTY, logLevel.simpleLoggerName());

        Optional<Duration> timeout = parse(() -> DurationParser.parse(timeoutRaw));
        Optional<FailurePolicy> policy = policyRaw == null
            ? Optional.empty()
            : Optional.of(parse(() -> FailurePolicy.from(policyRaw)));
        if (maxConcurrency != null && maxConcurrency < 1) {
            throw new CommandLine.ParameterException(new CommandLine(this), "--max-concurrency must be at least 1");
        }

        var settings = EngineSettingsLoader.load(configPath != null ? configPath : Paths.get("engine.toml"));
        var configuration = RunConfiguration.builder()
            .target(target)
            .inputPayload(loadInputPayload())
            .failurePolicy(policy)
            .maxConcurrency(Optional.ofNullable(maxConcurrency))
            .timeout(timeout)
            .logLevel(logLevel)
            .build();

        try (var engine = WorkflowEngine.create(settings)) {
            var result = engine.run(configuration);
            System.out.println(result.toPrettyJson());
            return result.status().exitCode();
        }
    }

    private WorkflowTarget resolveTarget() {
        boolean stored = workspace != null || workflowId != null;
        if (specPath != null && stored) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Use either --spec or --workspace/--workflow-id, not both.");
        }
        if (specPath != null) {
            return WorkflowTarget.forFile(specPath.toAbsolutePath().normalize());
        }
        if (workspace == null || workflowId == null) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Either --spec or both --workspace and --workflow-id are required.");
        }
        return WorkflowTarget.forStored(workspace, workflowId);
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw != null && !logLevelRaw.isBlank()
            ? logLevelRaw
            : System.getenv("FLOWGRAPH_LOG_LEVEL");
        return parse(() -> LogLevel.from(candidate));
    }

    private String loadInputPayload() {
        if (input == null || input.isBlank()) {
            return "{}";
        }
        if ("-".equals(input)) {
            String payload = readStdin();
            validateJsonPayload(payload);
            return payload;
        }
        String trimmed = input.trim();
        if (trimmed.startsWith("{")) {
            validateJsonPayload(trimmed);
            return trimmed;
        }
        Path path = Paths.get(input).toAbsolutePath().normalize();
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            validateJsonPayload(content);
            return content;
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Cannot read input file: " + path);
        }
    }

    private void validateJsonPayload(String payload) {
        if (payload == null || payload.isBlank()) {
            return;
        }
        try {
            var node = JSON.readTree(payload.trim());
            if (node != null && !node.isObject()) {
                throw new CommandLine.ParameterException(new CommandLine(this), "JSON payload must be an object");
            }
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Invalid JSON payload: " + ex.getMessage());
        }
    }

    private String readStdin() {
        try {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Cannot read input from stdin: " + ex.getMessage());
        }
    }

    private <T> T parse(Supplier<T> parser) {
        try {
            return parser.get();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), ex.getMessage());
        }
    }
}
