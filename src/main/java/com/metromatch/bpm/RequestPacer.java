package com.metromatch.bpm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Enforces a minimum interval between consecutive outgoing requests of one client.
 * Blocks the calling thread; shared by all callers of the owning client instance.
 */
public class RequestPacer {
    private static final Logger logger = LoggerFactory.getLogger(RequestPacer.class);

    private final long minIntervalNanos;
    private long lastRequestNanos;
    private boolean started;

    public RequestPacer(Duration minInterval) {
        this.minIntervalNanos = minInterval == null || minInterval.isNegative() ? 0L : minInterval.toNanos();
    }

    /**
     * Waits until the interval since the previous request has elapsed, then records a new request.
     * @return false if the thread was interrupted while waiting (the interrupt flag is restored)
     */
    public synchronized boolean awaitTurn() {
        if (started && minIntervalNanos > 0) {
            long waitNanos = minIntervalNanos - (System.nanoTime() - lastRequestNanos);
            if (waitNanos > 0) {
                logger.debug("Pacing request for {} ms", waitNanos / 1_000_000);
                try {
                    Thread.sleep(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        started = true;
        lastRequestNanos = System.nanoTime();
        return true;
    }
}
