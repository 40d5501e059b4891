package work.flowgraph.engine.runtime;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.flowgraph.engine.block.OutputSpec;
import work.flowgraph.engine.compiler.CompiledPlan;
import work.flowgraph.engine.compiler.CompiledStep;
import work.flowgraph.engine.error.StepExecutionException;
import work.flowgraph.engine.error.UnresolvedValueException;
import work.flowgraph.engine.error.WorkflowCancelledException;
import work.flowgraph.engine.error.WorkflowException;
import work.flowgraph.engine.selector.SelectorScope;
import work.flowgraph.engine.telemetry.UsageReporter;
import work.flowgraph.engine.telemetry.WorkflowRunUsage;

/**
 * Runs compiled plans level by level.
 * <p>
 * Steps of one level run concurrently on a shared pool bounded by {@link ExecutorSettings#maxConcurrency()};
 * the next level starts only once every step of the current one has finished. A step that is not batch
 * capable is invoked once per batch item, or once in total when all of its fields are broadcast values.
 * Outputs of a level are committed to the {@link ExecutionContext} in declaration order after the level
 * barrier, so a failed step never leaves partial outputs behind.
 * <p>
 * One executor serves any number of concurrent runs; each run gets its own context and cancellation state.
 */
public final class WorkflowExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutor.class);
    private static final AtomicInteger EXECUTOR_IDS = new AtomicInteger();

    private final ExecutorSettings settings;
    private final UsageReporter usageReporter;
    private final ExecutorService blockPool;
    private final ExecutorService runPool;

    public WorkflowExecutor(ExecutorSettings settings) {
        this(settings, UsageReporter.NOOP);
    }

    public WorkflowExecutor(ExecutorSettings settings, UsageReporter usageReporter) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.usageReporter = usageReporter == null ? UsageReporter.NOOP : usageReporter;
        int id = EXECUTOR_IDS.incrementAndGet();
        this.blockPool = Executors.newFixedThreadPool(settings.maxConcurrency(), daemonThreads("flowgraph-block-" + id + "-"));
        this.runPool = Executors.newCachedThreadPool(daemonThreads("flowgraph-run-" + id + "-"));
    }

    public ExecutorSettings settings() {
        return settings;
    }

    public RunOutput run(CompiledPlan plan, Map<String, Object> inputs) {
        return run(plan, inputs, null);
    }

    /**
     * Runs {@code plan} on the calling thread. {@code workflowId} only labels the usage event.
     */
    public RunOutput run(CompiledPlan plan, Map<String, Object> inputs, String workflowId) {
        return execute(plan, inputs, workflowId, new RunControl());
    }

    public RunHandle submit(CompiledPlan plan, Map<String, Object> inputs) {
        return submit(plan, inputs, null);
    }

    public RunHandle submit(CompiledPlan plan, Map<String, Object> inputs, String workflowId) {
        var control = new RunControl();
        var future = CompletableFuture.supplyAsync(() -> execute(plan, inputs, workflowId, control), runPool);
        return new RunHandle(future, control);
    }

    private RunOutput execute(CompiledPlan plan, Map<String, Object> inputs, String workflowId, RunControl control) {
        var startedAt = Instant.now();
        long deadline = settings.runTimeout().map(timeout -> System.nanoTime() + timeout.toNanos()).orElse(0L);
        var context = ExecutionContext.bind(plan.inputs(), inputs);
        var failures = new LinkedHashMap<String, String>();
        log.debug(
            "Running plan {} ({} level(s), batch size {}, policy {})",
            shortHash(plan), plan.levels().size(), context.batchSize(), settings.failurePolicy()
        );
        try {
            for (var level : plan.levels()) {
                control.ensureActive();
                runLevel(level, context, control, failures, deadline);
            }
        } catch (WorkflowException ex) {
            control.cancel(ex.getMessage());
            throw ex;
        }
        var values = collectOutputs(plan, context, failures.keySet());
        var finishedAt = Instant.now();
        report(new WorkflowRunUsage(plan.stepDescriptors(), workflowId, context.batchSize(), startedAt, finishedAt));
        if (failures.isEmpty()) {
            log.info("Plan {} finished in {} ms", shortHash(plan), Duration.between(startedAt, finishedAt).toMillis());
        } else {
            log.warn("Plan {} finished with {} failed step(s): {}", shortHash(plan), failures.size(), failures.keySet());
        }
        return new RunOutput(values, failures, context.batchSize(), Duration.between(startedAt, finishedAt));
    }

    private void runLevel(
        List<CompiledStep> level,
        ExecutionContext context,
        RunControl control,
        Map<String, String> failures,
        long deadline
    ) {
        var pending = new LinkedHashMap<CompiledStep, CompletableFuture<Map<String, BatchValue>>>();
        for (var step : level) {
            var blocker = failedProducer(step, failures.keySet());
            if (blocker != null) {
                failures.put(step.name(), "skipped: depends on failed step '" + blocker + "'");
                log.warn("Skipping step '{}' because step '{}' failed", step.name(), blocker);
                continue;
            }
            pending.put(step, startStep(step, context, control));
        }
        var firstFailure = awaitLevel(pending.values(), control, deadline);
        control.ensureActive();
        if (firstFailure != null && settings.failurePolicy() == FailurePolicy.FAIL_FAST) {
            var error = asWorkflowException(null, firstFailure);
            control.cancel(error.getMessage());
            throw error;
        }
        for (var entry : pending.entrySet()) {
            var step = entry.getKey();
            var failure = failureOf(entry.getValue());
            if (failure == null) {
                context.commit(step.name(), entry.getValue().join());
                continue;
            }
            var error = asWorkflowException(step.name(), failure);
            if (!(error instanceof StepExecutionException)) {
                throw error;
            }
            failures.put(step.name(), error.getMessage());
            log.warn("Step '{}' failed: {}", step.name(), error.getMessage());
        }
    }

    /**
     * Waits for the level to settle. Under fail-fast, returns as soon as one step fails.
     */
    private Throwable awaitLevel(Collection<CompletableFuture<Map<String, BatchValue>>> futures, RunControl control, long deadline) {
        if (futures.isEmpty()) {
            return null;
        }
        var barrier = new CompletableFuture<Throwable>();
        var remaining = new AtomicInteger(futures.size());
        var failFast = settings.failurePolicy() == FailurePolicy.FAIL_FAST;
        for (var future : futures) {
            future.whenComplete((value, error) -> {
                if (error != null && failFast) {
                    barrier.complete(unwrap(error));
                }
                if (remaining.decrementAndGet() == 0) {
                    barrier.complete(null);
                }
            });
        }
        control.waitingOn(barrier);
        try {
            if (settings.runTimeout().isPresent()) {
                return barrier.get(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
            }
            return barrier.get();
        } catch (TimeoutException ex) {
            var message = "Run exceeded timeout of " + settings.runTimeout().get().toMillis() + " ms";
            control.cancel(message);
            throw new WorkflowCancelledException(message);
        } catch (CancellationException ex) {
            throw new WorkflowCancelledException(control.reason());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            control.cancel("Run interrupted");
            throw new WorkflowCancelledException("Run interrupted");
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Level barrier failed unexpectedly", ex.getCause());
        } finally {
            control.levelDone();
        }
    }

    private CompletableFuture<Map<String, BatchValue>> startStep(CompiledStep step, ExecutionContext context, RunControl control) {
        var name = step.name();
        final Map<String, BatchValue> fields;
        final int size;
        try {
            fields = FieldResolver.resolve(name, step.manifest().fields(), context);
            size = FieldResolver.batchSize(name, fields);
        } catch (WorkflowException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        var block = step.block();
        var outputs = block.declareOutputs();
        CompletableFuture<Map<String, BatchValue>> result;
        if (size < 0) {
            log.debug("Step '{}' invoked once with broadcast fields", name);
            var values = FieldResolver.whole(fields);
            result = control.submit(blockPool, () -> invoke(step, values))
                .thenApply(produced -> broadcastOutputs(outputs, produced));
        } else if (block.acceptsBatchInput()) {
            log.debug("Step '{}' invoked once for a batch of {}", name, size);
            var values = FieldResolver.whole(fields);
            result = control.submit(blockPool, () -> invoke(step, values))
                .thenApply(produced -> batchOutputs(name, outputs, produced, size));
        } else {
            log.debug("Step '{}' invoked for each of {} batch item(s)", name, size);
            var items = new ArrayList<CompletableFuture<Map<String, Object>>>(size);
            for (int i = 0; i < size; i++) {
                var values = FieldResolver.item(fields, i);
                items.add(control.submit(blockPool, () -> invoke(step, values)));
            }
            result = joinItems(name, outputs, items, control);
        }
        return result.handle((value, error) -> {
            if (error != null) {
                throw asWorkflowException(name, error);
            }
            return value;
        });
    }

    /**
     * Completes with the stitched outputs once every item succeeded, or with the first item failure, in
     * which case the remaining items are interrupted.
     */
    private static CompletableFuture<Map<String, BatchValue>> joinItems(
        String step,
        List<OutputSpec> outputs,
        List<CompletableFuture<Map<String, Object>>> items,
        RunControl control
    ) {
        var joined = new CompletableFuture<Map<String, BatchValue>>();
        if (items.isEmpty()) {
            joined.complete(stitchOutputs(outputs, items));
            return joined;
        }
        var remaining = new AtomicInteger(items.size());
        for (var item : items) {
            item.whenComplete((value, error) -> {
                if (error != null) {
                    if (joined.completeExceptionally(unwrap(error))) {
                        log.debug("Step '{}' lost a batch item, interrupting its siblings", step);
                        items.forEach(sibling -> control.abandon(sibling, "Sibling item of step '" + step + "' failed"));
                    }
                    return;
                }
                if (remaining.decrementAndGet() == 0) {
                    try {
                        joined.complete(stitchOutputs(outputs, items));
                    } catch (RuntimeException ex) {
                        joined.completeExceptionally(ex);
                    }
                }
            });
        }
        return joined;
    }

    private static Map<String, Object> invoke(CompiledStep step, Map<String, Object> fields) throws Exception {
        var produced = step.block().run(fields);
        if (produced == null) {
            throw new StepExecutionException(step.name(), "block returned no outputs");
        }
        return produced;
    }

    private static Map<String, BatchValue> broadcastOutputs(List<OutputSpec> outputs, Map<String, Object> produced) {
        var values = new LinkedHashMap<String, BatchValue>();
        for (var output : outputs) {
            values.put(output.name(), BatchValue.broadcast(produced.get(output.name())));
        }
        return values;
    }

    private static Map<String, BatchValue> batchOutputs(String step, List<OutputSpec> outputs, Map<String, Object> produced, int size) {
        var values = new LinkedHashMap<String, BatchValue>();
        for (var output : outputs) {
            var value = produced.get(output.name());
            if (value == null) {
                var empty = new ArrayList<>(size);
                for (int i = 0; i < size; i++) {
                    empty.add(null);
                }
                values.put(output.name(), BatchValue.batch(empty));
                continue;
            }
            if (!(value instanceof List<?> list) || list.size() != size) {
                throw new StepExecutionException(step, "batch output '" + output.name() + "' must be a list of " + size + " item(s)");
            }
            values.put(output.name(), BatchValue.batch(list));
        }
        return values;
    }

    private static Map<String, BatchValue> stitchOutputs(List<OutputSpec> outputs, List<CompletableFuture<Map<String, Object>>> items) {
        var values = new LinkedHashMap<String, BatchValue>();
        for (var output : outputs) {
            var perItem = new ArrayList<>(items.size());
            for (var item : items) {
                perItem.add(item.join().get(output.name()));
            }
            values.put(output.name(), BatchValue.batch(perItem));
        }
        return values;
    }

    private static Map<String, Object> collectOutputs(CompiledPlan plan, ExecutionContext context, Set<String> failed) {
        var values = new LinkedHashMap<String, Object>();
        for (var output : plan.outputs()) {
            var selector = output.selector();
            if (selector.scope() == SelectorScope.STEP_OUTPUT && failed.contains(selector.name())) {
                continue;
            }
            var label = "outputs." + output.name();
            var found = context.lookup(selector.socket())
                .orElseThrow(() -> new UnresolvedValueException(label, selector.text()));
            if (selector.hasProperty()) {
                found = found.map(value -> FieldResolver.readProperty(label, selector, value));
            }
            values.put(output.name(), found.toOutput());
        }
        return values;
    }

    private static String failedProducer(CompiledStep step, Set<String> failed) {
        for (var producer : step.producerStepNames()) {
            if (failed.contains(producer)) {
                return producer;
            }
        }
        return null;
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        if (!future.isCompletedExceptionally()) {
            return null;
        }
        try {
            future.join();
            return null;
        } catch (CompletionException | CancellationException ex) {
            return unwrap(ex);
        }
    }

    private static Throwable unwrap(Throwable error) {
        var current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static WorkflowException asWorkflowException(String step, Throwable error) {
        var cause = unwrap(error);
        if (cause instanceof WorkflowException we) {
            return we;
        }
        if (cause instanceof CancellationException || cause instanceof InterruptedException) {
            return new WorkflowCancelledException(step == null ? "Run cancelled" : "Step '" + step + "' was interrupted");
        }
        return new StepExecutionException(step == null ? "<unknown>" : step, cause);
    }

    private void report(WorkflowRunUsage usage) {
        try {
            usageReporter.recordWorkflowRun(usage);
        } catch (RuntimeException ex) {
            log.debug("Usage reporting failed: {}", ex.getMessage(), ex);
        }
    }

    private static String shortHash(CompiledPlan plan) {
        var hash = plan.specificationHash();
        return hash == null || hash.length() <= 12 ? String.valueOf(hash) : hash.substring(0, 12);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        runPool.shutdown();
        blockPool.shutdown();
        try {
            if (!blockPool.awaitTermination(5, TimeUnit.SECONDS)) {
                blockPool.shutdownNow();
            }
            if (!runPool.awaitTermination(5, TimeUnit.SECONDS)) {
                runPool.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            blockPool.shutdownNow();
            runPool.shutdownNow();
        }
    }
}
