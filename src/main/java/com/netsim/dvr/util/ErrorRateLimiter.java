package com.netsim.dvr.util;

import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.Logger;

/**
 * Limits how often a recurring failure is written to the log.
 *
 * Used where faults are expected to repeat every round (a dead peer, a
 * display that keeps throwing) and each occurrence is dropped anyway. At most
 * one line per interval is written; the line reports how many occurrences
 * were suppressed since the previous one.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime;
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        // First occurrence is always logged
        this.lastLogTime = new AtomicLong(System.nanoTime() - minIntervalNanos - 1);
    }

    public void log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            long skipped = suppressed.getAndSet(0);
            if (skipped > 0)
                logger.warn("{} ({} similar suppressed)", message, skipped, t);
            else
                logger.warn(message, t);
        } else {
            suppressed.incrementAndGet();
        }
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
