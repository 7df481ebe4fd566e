package pfl.domain.printer;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation handed to a worker. Waiting on it replaces sleep-then-check-a-flag, so a
 * stopped worker wakes up at once instead of at the end of its interval.
 * @since 13/01/2026
 */
public final class StopSignal {
    private final CountDownLatch latch = new CountDownLatch(1);

    public void stop() {
        latch.countDown();
    }

    public boolean isStopped() {
        return latch.getCount() == 0;
    }

    /**
     * Wait up to {@code timeoutMs}.
     * @return true when the signal fired during or before the wait
     */
    public boolean await(long timeoutMs) throws InterruptedException {
        return latch.await(timeoutMs, TimeUnit.MILLISECONDS);
    }
}
