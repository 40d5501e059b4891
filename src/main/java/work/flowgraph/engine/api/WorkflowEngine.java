package work.flowgraph.engine.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.flowgraph.engine.block.BlockRegistry;
import work.flowgraph.engine.compiler.CompiledPlan;
import work.flowgraph.engine.compiler.PlanCache;
import work.flowgraph.engine.compiler.WorkflowCompiler;
import work.flowgraph.engine.config.EngineSettings;
import work.flowgraph.engine.error.ErrorReports;
import work.flowgraph.engine.error.InvalidRuntimeInputException;
import work.flowgraph.engine.runtime.ExecutorSettings;
import work.flowgraph.engine.runtime.RunHandle;
import work.flowgraph.engine.runtime.RunOutput;
import work.flowgraph.engine.runtime.WorkflowExecutor;
import work.flowgraph.engine.source.HttpWorkflowSpecificationSource;
import work.flowgraph.engine.source.WorkflowSpecificationSource;
import work.flowgraph.engine.spec.SpecificationLoader;
import work.flowgraph.engine.spec.WorkflowSpecification;
import work.flowgraph.engine.telemetry.UsageCollector;
import work.flowgraph.engine.telemetry.UsageReporter;

/**
 * Public entry point for embedding the engine: compiles specifications (memoised by content hash) and
 * runs the resulting plans.
 */
public final class WorkflowEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final EngineSettings settings;
    private final PlanCache planCache;
    private final UsageReporter usageReporter;
    private final WorkflowSpecificationSource source;
    private final WorkflowExecutor executor;
    private final Map<ExecutorSettings, WorkflowExecutor> executors = new ConcurrentHashMap<>();
    private final UsageCollector ownedCollector;

    public WorkflowEngine(EngineSettings settings, BlockRegistry registry) {
        this(settings, registry, UsageReporter.NOOP, new HttpWorkflowSpecificationSource(settings.source()), null);
    }

    public WorkflowEngine(
        EngineSettings settings,
        BlockRegistry registry,
        UsageReporter usageReporter,
        WorkflowSpecificationSource source
    ) {
        this(settings, registry, usageReporter, source, null);
    }

    private WorkflowEngine(
        EngineSettings settings,
        BlockRegistry registry,
        UsageReporter usageReporter,
        WorkflowSpecificationSource source,
        UsageCollector ownedCollector
    ) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.planCache = new PlanCache(new WorkflowCompiler(Objects.requireNonNull(registry, "registry")));
        this.usageReporter = usageReporter == null ? UsageReporter.NOOP : usageReporter;
        this.source = Objects.requireNonNull(source, "source");
        this.executor = new WorkflowExecutor(settings.executor(), this.usageReporter);
        this.executors.put(settings.executor(), executor);
        this.ownedCollector = ownedCollector;
    }

    /**
     * Engine with blocks discovered on the class path, the HTTP specification source and, when enabled
     * in {@code settings}, a started usage collector that is closed with the engine.
     */
    public static WorkflowEngine create(EngineSettings settings) {
        var registry = BlockRegistry.discover();
        var source = new HttpWorkflowSpecificationSource(settings.source());
        if (!settings.telemetry().enabled()) {
            return new WorkflowEngine(settings, registry, UsageReporter.NOOP, source, null);
        }
        var collector = new UsageCollector(settings.telemetry()).start();
        return new WorkflowEngine(settings, registry, collector, source, collector);
    }

    public EngineSettings settings() {
        return settings;
    }

    public CompiledPlan compile(WorkflowSpecification specification) {
        return planCache.get(specification);
    }

    public CompiledPlan compile(Map<String, Object> document) {
        return compile(SpecificationLoader.fromMap(document));
    }

    public CompiledPlan compileStored(String workspaceId, String workflowId) {
        return compile(source.fetch(workspaceId, workflowId));
    }

    public RunOutput run(CompiledPlan plan, Map<String, Object> inputs) {
        return executor.run(plan, inputs);
    }

    public RunOutput run(CompiledPlan plan, Map<String, Object> inputs, String workflowId) {
        return executor.run(plan, inputs, workflowId);
    }

    public RunHandle submit(CompiledPlan plan, Map<String, Object> inputs) {
        return executor.submit(plan, inputs);
    }

    /**
     * Compiles and runs the configured workflow. Never throws; failures are reported in the result.
     */
    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        var target = configuration.target();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("workflow", target.display());
        try {
            var plan = target.isStored()
                ? compileStored(target.workspaceId().orElseThrow(), target.workflowId().orElseThrow())
                : compile(SpecificationLoader.loadFromFile(target.specificationPath().orElseThrow()));
            metadata.put("specificationHash", plan.specificationHash());
            var inputs = parseInputs(configuration.inputPayload());
            var workflowId = target.workflowId().orElse(null);
            var output = runWith(configuration, plan, inputs, workflowId);
            metadata.put("batchSize", output.batchSize());
            metadata.put("outputs", output.values());
            if (output.isPartial()) {
                metadata.put("failures", output.failures());
                return RunResult.partial(metadata, started);
            }
            return RunResult.success(metadata, started);
        } catch (RuntimeException ex) {
            log.debug("Run of {} failed", target.display(), ex);
            return RunResult.failure(ErrorReports.describe(ex), metadata, started);
        }
    }

    private RunOutput runWith(RunConfiguration configuration, CompiledPlan plan, Map<String, Object> inputs, String workflowId) {
        if (!configuration.overridesExecution()) {
            return executor.run(plan, inputs, workflowId);
        }
        var defaults = settings.executor();
        var overridden = new ExecutorSettings(
            configuration.failurePolicy().orElse(defaults.failurePolicy()),
            configuration.maxConcurrency().orElse(defaults.maxConcurrency()),
            configuration.timeout().or(defaults::runTimeout)
        );
        return executorFor(overridden).run(plan, inputs, workflowId);
    }

    /**
     * Executor for a per-run override, created on first use and kept until the engine closes.
     */
    WorkflowExecutor executorFor(ExecutorSettings executorSettings) {
        return executors.computeIfAbsent(executorSettings, key -> {
            log.debug("Creating executor for {}", key);
            return new WorkflowExecutor(key, usageReporter);
        });
    }

    private static Map<String, Object> parseInputs(String payload) {
        if (payload == null || payload.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            var parsed = JSON.readValue(payload, MAP_REF);
            return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
        } catch (JsonProcessingException ex) {
            throw new InvalidRuntimeInputException("Invalid JSON input payload: " + ex.getOriginalMessage());
        }
    }

    @Override
    public void close() {
        executors.values().forEach(WorkflowExecutor::close);
        executors.clear();
        if (ownedCollector != null) {
            ownedCollector.close();
        }
    }
}
