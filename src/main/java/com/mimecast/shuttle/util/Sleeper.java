package com.mimecast.shuttle.util;

import java.time.Duration;

/**
 * Pause abstraction for retry backoff, reconnect cooldown and inter-batch delays.
 *
 * <p>The default implementation blocks the calling thread.
 * <p>Tests inject a recording implementation so delays cost no wall-clock time.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Blocking sleeper backed by {@link Thread#sleep(long)}.
     */
    Sleeper SYSTEM = duration -> {
        if (duration != null && !duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    /**
     * Pause for the given duration.
     * <p>Zero or negative durations return immediately.
     *
     * @param duration Duration instance.
     * @throws InterruptedException If the thread is interrupted while waiting.
     */
    void sleep(Duration duration) throws InterruptedException;
}
