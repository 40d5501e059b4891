package work.flowgraph.engine.runtime;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import work.flowgraph.engine.error.WorkflowCancelledException;

/**
 * Cancellation state of one run plus the block invocations it currently has in flight.
 */
final class RunControl {
    private volatile boolean cancelled = false;
    private volatile String reason = "Run cancelled";
    private volatile CompletableFuture<?> barrier;
    private final Map<CompletableFuture<?>, Future<?>> inFlight = new ConcurrentHashMap<>();

    boolean isCancelled() {
        return cancelled;
    }

    String reason() {
        return reason;
    }

    void ensureActive() {
        if (cancelled) {
            throw new WorkflowCancelledException(reason);
        }
    }

    /**
     * Marks the run cancelled, interrupts running invocations and releases the executor thread if it is
     * waiting on a level. The first reason wins.
     */
    void cancel(String why) {
        synchronized (this) {
            if (cancelled) {
                return;
            }
            reason = why;
            cancelled = true;
        }
        for (var entry : inFlight.entrySet()) {
            entry.getValue().cancel(true);
            entry.getKey().completeExceptionally(new CancellationException(why));
        }
        var current = barrier;
        if (current != null) {
            current.cancel(false);
        }
    }

    /**
     * Interrupts one in-flight invocation without cancelling the run. No-op once it has completed.
     */
    void abandon(CompletableFuture<?> promise, String why) {
        var future = inFlight.remove(promise);
        if (future != null) {
            future.cancel(true);
        }
        promise.completeExceptionally(new CancellationException(why));
    }

    void waitingOn(CompletableFuture<?> levelBarrier) {
        this.barrier = levelBarrier;
        if (cancelled) {
            levelBarrier.cancel(false);
        }
    }

    void levelDone() {
        this.barrier = null;
    }

    /**
     * Runs {@code task} on {@code pool}. The returned future also completes when the run is cancelled,
     * even if the task never started.
     */
    <T> CompletableFuture<T> submit(ExecutorService pool, Callable<T> task) {
        var promise = new CompletableFuture<T>();
        if (cancelled) {
            promise.completeExceptionally(new CancellationException(reason));
            return promise;
        }
        Future<?> future = pool.submit(() -> {
            if (cancelled || promise.isDone()) {
                promise.completeExceptionally(new CancellationException(reason));
                return;
            }
            try {
                promise.complete(task.call());
            } catch (Throwable error) {
                promise.completeExceptionally(error);
            }
        });
        inFlight.put(promise, future);
        promise.whenComplete((value, error) -> inFlight.remove(promise));
        if (cancelled) {
            future.cancel(true);
            promise.completeExceptionally(new CancellationException(reason));
        }
        return promise;
    }
}
