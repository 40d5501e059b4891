package work.flowgraph.engine.telemetry;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.flowgraph.engine.config.TelemetrySettings;

/**
 * Aggregates usage in memory and ships it to a {@link UsageSink} in the background.
 * <p>
 * Recording only touches the in-memory aggregate. A collector thread moves the aggregate into a bounded
 * queue every flush interval and a sender thread drains, merges and sends the queue on the same cadence.
 * When the queue is full its content is merged with the new payload instead of being dropped. Keys whose
 * send fails go back into the queue.
 */
public final class UsageCollector implements UsageReporter, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UsageCollector.class);
    public static final String WORKFLOWS_CATEGORY = "workflows";

    private final TelemetrySettings settings;
    private final UsageSink sink;
    private final String execSessionId;
    private final Object usageLock = new Object();
    private final Object queueLock = new Object();
    private final BlockingQueue<Map<String, Map<String, UsageRecord>>> queue;
    private final CountDownLatch terminate = new CountDownLatch(1);
    private Map<String, Map<String, UsageRecord>> usage = new LinkedHashMap<>();
    private Thread collectorThread;
    private Thread senderThread;

    public UsageCollector(TelemetrySettings settings) {
        this(settings, new HttpUsageSink(settings.endpoint()));
    }

    public UsageCollector(TelemetrySettings settings, UsageSink sink) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.execSessionId = System.nanoTime() + "_" + UUID.randomUUID().toString().substring(0, 4);
        this.queue = new ArrayBlockingQueue<>(settings.queueSize());
    }

    public synchronized UsageCollector start() {
        if (collectorThread != null) {
            return this;
        }
        collectorThread = daemon("flowgraph-usage-collector", this::collectLoop);
        senderThread = daemon("flowgraph-usage-sender", this::sendLoop);
        collectorThread.start();
        senderThread.start();
        log.debug("Usage collector started (flush every {} ms)", settings.flushInterval().toMillis());
        return this;
    }

    @Override
    public void recordWorkflowRun(WorkflowRunUsage run) {
        var resourceId = ResourceIds.resolve(run.workflowId(), run.stepDescriptors());
        var seconds = run.duration().toNanos() / 1_000_000_000.0;
        var fps = seconds > 0 ? run.processedItems() / seconds : 0;
        recordUsage(
            settings.apiKey(),
            WORKFLOWS_CATEGORY,
            resourceId,
            ResourceIds.details(run.stepDescriptors()),
            run.processedItems(),
            fps,
            false,
            run.startedAt(),
            run.finishedAt()
        );
    }

    /**
     * Adds usage to the in-memory aggregate. Ignored when the user opted out, unless {@code enterprise}.
     */
    public void recordUsage(
        String apiKey,
        String category,
        String resourceId,
        String resourceDetails,
        long frames,
        double fps,
        boolean enterprise,
        Instant startedAt,
        Instant finishedAt
    ) {
        if (settings.optOut() && !enterprise) {
            return;
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Usage category is required");
        }
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("Dropping usage for {}:{} without an API key", category, resourceId);
            return;
        }
        double sourceDuration = fps > 0 ? frames / fps : 0;
        var record = new UsageRecord(
            apiKey,
            category,
            resourceId,
            resourceDetails,
            execSessionId,
            epochNanos(startedAt),
            epochNanos(finishedAt),
            frames,
            UsageRecords.fps(frames, sourceDuration),
            sourceDuration,
            false,
            enterprise
        );
        synchronized (usageLock) {
            usage.computeIfAbsent(apiKey, key -> new LinkedHashMap<>())
                .merge(record.aggregationKey(), record, UsageRecords::merge);
        }
        log.debug("Recorded usage {}", record);
    }

    /**
     * Moves the aggregate to the queue and sends everything queued, on the calling thread.
     */
    public void flushNow() {
        collect();
        flush();
    }

    /**
     * Payloads waiting to be sent, merged. Mostly useful for diagnostics and tests.
     */
    public Map<String, Map<String, UsageRecord>> pending() {
        synchronized (queueLock) {
            return UsageRecords.zip(new ArrayList<>(queue));
        }
    }

    void collect() {
        Map<String, Map<String, UsageRecord>> snapshot;
        synchronized (usageLock) {
            if (usage.isEmpty()) {
                return;
            }
            snapshot = usage;
            usage = new LinkedHashMap<>();
        }
        enqueue(snapshot);
    }

    void enqueue(Map<String, Map<String, UsageRecord>> payload) {
        if (payload.isEmpty()) {
            return;
        }
        synchronized (queueLock) {
            if (queue.offer(payload)) {
                return;
            }
            var drained = new ArrayList<Map<String, Map<String, UsageRecord>>>();
            queue.drainTo(drained);
            drained.add(payload);
            queue.offer(UsageRecords.zip(drained));
        }
    }

    void flush() {
        var drained = new ArrayList<Map<String, Map<String, UsageRecord>>>();
        synchronized (queueLock) {
            queue.drainTo(drained);
        }
        if (drained.isEmpty()) {
            return;
        }
        var failed = new HashMap<String, Map<String, UsageRecord>>();
        for (var entry : UsageRecords.zip(drained).entrySet()) {
            try {
                sink.send(entry.getKey(), List.copyOf(entry.getValue().values()));
            } catch (IOException | RuntimeException ex) {
                log.debug("Failed to send usage: {}", ex.getMessage());
                failed.put(entry.getKey(), entry.getValue());
            }
        }
        if (!failed.isEmpty()) {
            log.debug("Re-enqueuing unsent usage for {} key(s)", failed.size());
            enqueue(failed);
        }
    }

    private void collectLoop() {
        try {
            while (!terminate.await(settings.flushInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                collect();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        log.debug("Terminating usage collector thread");
    }

    private void sendLoop() {
        try {
            while (!terminate.await(settings.flushInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                flush();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        log.debug("Terminating usage sender thread");
    }

    /**
     * Stops both threads, then collects and flushes one last time.
     */
    @Override
    public void close() {
        terminate.countDown();
        Thread collector;
        Thread sender;
        synchronized (this) {
            collector = collectorThread;
            sender = senderThread;
        }
        try {
            if (collector != null) {
                collector.join();
            }
            if (sender != null) {
                sender.join();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        flushNow();
    }

    private static long epochNanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    private static Thread daemon(String name, Runnable task) {
        var thread = new Thread(task, name);
        thread.setDaemon(true);
        return thread;
    }
}
