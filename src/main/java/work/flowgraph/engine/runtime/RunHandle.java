package work.flowgraph.engine.runtime;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import work.flowgraph.engine.error.WorkflowCancelledException;
import work.flowgraph.engine.error.WorkflowException;

/**
 * A run started with {@link WorkflowExecutor#submit}. Cancelling stops scheduling of new steps and
 * interrupts in-flight block invocations; {@link #await()} then fails with {@link WorkflowCancelledException}.
 */
public final class RunHandle {
    private final CompletableFuture<RunOutput> result;
    private final RunControl control;

    RunHandle(CompletableFuture<RunOutput> result, RunControl control) {
        this.result = result;
        this.control = control;
    }

    public void cancel() {
        control.cancel("Run cancelled");
    }

    public boolean isCancelled() {
        return control.isCancelled();
    }

    public boolean isDone() {
        return result.isDone();
    }

    public RunOutput await() {
        try {
            return result.join();
        } catch (CompletionException | CancellationException ex) {
            throw unwrap(ex);
        }
    }

    /**
     * Waits at most {@code timeout}; the run keeps going if the wait times out.
     */
    public RunOutput await(Duration timeout) throws TimeoutException {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException ex) {
            throw unwrap(ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new WorkflowCancelledException("Interrupted while waiting for the run");
        }
    }

    public CompletableFuture<RunOutput> future() {
        return result;
    }

    private RuntimeException unwrap(Exception ex) {
        var cause = ex.getCause() == null ? ex : ex.getCause();
        if (cause instanceof WorkflowException we) {
            return we;
        }
        if (cause instanceof CancellationException) {
            return new WorkflowCancelledException(control.reason());
        }
        return new WorkflowException("unexpected_error", "Run failed: " + cause.getMessage(), cause);
    }
}
