package co.fanki.reposync.sync.domain;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot shutdown signal shared by the coordinator, its jobs and the
 * sync engine.
 *
 * <p>Besides being polled, the token doubles as an interruptible timer:
 * backoff waits block on it and wake up early when it fires.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);

    /** Fires the signal. Idempotent. */
    public void cancel() {
        latch.countDown();
    }

    /**
     * Checks whether the signal has fired.
     *
     * @return true once cancelled
     */
    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits for the given time unless the signal fires first.
     *
     * @param timeout how long to wait
     * @return true if the wait ended because of cancellation
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitCancellation(final Duration timeout)
            throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

}
