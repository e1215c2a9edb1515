package io.malicki.messaging.retry;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation signal shared by everything that must stop on shutdown.
 */
@Slf4j
public class ShutdownSignal {

    private final CountDownLatch fired = new CountDownLatch(1);

    public void fire() {
        if (fired.getCount() > 0) {
            log.info("🛑 Shutdown signal fired");
        }
        fired.countDown();
    }

    public boolean isFired() {
        return fired.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout}. Returns {@code true} when the wait was cut
     * short by the signal or by an interrupt (the interrupt flag is restored).
     */
    public boolean await(Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            return isFired() || Thread.currentThread().isInterrupted();
        }
        try {
            return fired.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️ Backoff wait interrupted");
            return true;
        }
    }
}
