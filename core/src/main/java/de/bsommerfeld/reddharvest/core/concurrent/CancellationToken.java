package de.bsommerfeld.reddharvest.core.concurrent;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation flag shared between the harvest loop and
 * whoever wants to stop it (the shutdown hook). Sleeping through
 * {@link #sleep(Duration)} wakes up immediately on cancellation.
 */
public final class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);
    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
        latch.countDown();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Waits for the given duration or until cancelled.
     *
     * @return {@code true} if the token was cancelled while (or before) sleeping
     */
    public boolean sleep(Duration duration) {
        if (cancelled) {
            return true;
        }
        if (duration.isZero() || duration.isNegative()) {
            return false;
        }
        try {
            return latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return true;
        }
    }
}
