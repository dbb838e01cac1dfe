package com.mimecast.shuttle.retry;

import com.mimecast.shuttle.imap.ImapException;
import com.mimecast.shuttle.imap.SessionAbortedException;
import com.mimecast.shuttle.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;

/**
 * Bounded retry of a single IMAP operation.
 * <p>Only {@link SessionAbortedException} is retried; application level errors propagate at once.
 *
 * <p>The wait after failed attempt <i>k</i> is linear:
 * <pre>
 *     wait_time = baseDelay * k
 * </pre>
 * <p>When a {@link Recovery} is supplied it runs between attempts, after the wait,
 * <br>to replace the dead session (reopen and re-select).
 * <p>Once <i>maxAttempts</i> have failed the last error is rethrown.
 */
public class RetryPolicy {
    private static final Logger log = LogManager.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    /**
     * Constructs a new RetryPolicy instance.
     *
     * @param maxAttempts Total attempts, at least 1.
     * @param baseDelay   Base delay for linear backoff.
     * @param sleeper     Sleeper instance.
     */
    public RetryPolicy(int maxAttempts, Duration baseDelay, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay == null ? Duration.ZERO : baseDelay;
        this.sleeper = sleeper;
    }

    /**
     * Gets the wait before the attempt following failed attempt <i>k</i>.
     *
     * @param attempt Failed attempt number, 1 based.
     * @return Duration instance.
     */
    public Duration getDelay(int attempt) {
        return baseDelay.multipliedBy(Math.max(1, attempt));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    /**
     * Runs operation with retries and no recovery.
     *
     * @param name      Operation name for logging.
     * @param operation Operation to run.
     * @param <T>       Result type.
     * @return Operation result.
     * @throws ImapException        Terminal or non-retryable error.
     * @throws InterruptedException Interrupted while waiting.
     */
    public <T> T execute(String name, ImapOperation<T> operation) throws ImapException, InterruptedException {
        return execute(name, operation, null);
    }

    /**
     * Runs operation with retries, invoking recovery between attempts.
     * <p>Errors raised by the recovery itself are not retried.
     *
     * @param name      Operation name for logging.
     * @param operation Operation to run.
     * @param recovery  Recovery to run before each retry, may be null.
     * @param <T>       Result type.
     * @return Operation result.
     * @throws ImapException        Terminal, non-retryable or recovery error.
     * @throws InterruptedException Interrupted while waiting.
     */
    public <T> T execute(String name, ImapOperation<T> operation, Recovery recovery) throws ImapException, InterruptedException {
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.run();
            } catch (SessionAbortedException e) {
                log.warn("{} failed (attempt {}/{}): {}", name, attempt, maxAttempts, e.getMessage());
                if (attempt >= maxAttempts) {
                    throw e;
                }

                Duration delay = getDelay(attempt);
                if (!delay.isZero()) {
                    log.debug("{} retrying in {} ms", name, delay.toMillis());
                    sleeper.sleep(delay);
                }
                if (recovery != null) {
                    recovery.recover();
                }
            }
        }
    }

    /**
     * A single IMAP operation.
     *
     * @param <T> Result type.
     */
    @FunctionalInterface
    public interface ImapOperation<T> {
        T run() throws ImapException;
    }

    /**
     * Restores a usable session between attempts.
     */
    @FunctionalInterface
    public interface Recovery {
        void recover() throws ImapException, InterruptedException;
    }
}
