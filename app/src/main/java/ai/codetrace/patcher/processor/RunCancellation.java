package ai.codetrace.patcher.processor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked before each file task starts. Files already in flight run to a
 * terminal state; {@link #awaitDrained(Duration)} lets a shutdown hook wait for them.
 */
public final class RunCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CountDownLatch drained = new CountDownLatch(1);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Signals that no file task of the run is running any more and its results are persisted.
     */
    public void markDrained() {
        drained.countDown();
    }

    /**
     * @return whether the run drained within {@code timeout}
     */
    public boolean awaitDrained(Duration timeout) throws InterruptedException {
        return drained.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
