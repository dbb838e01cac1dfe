package com.mimecast.shuttle.migrate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Logs a progress heartbeat at most once per interval.
 *
 * <p>The last batch of a mailbox is always logged.
 */
public class LoggingProgressListener implements ProgressListener {
    private static final Logger log = LogManager.getLogger(LoggingProgressListener.class);

    /**
     * Default heartbeat interval.
     */
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(15);

    private final Duration interval;
    private final Clock clock;
    private Instant last;

    /**
     * Constructs a new LoggingProgressListener instance with default interval.
     */
    public LoggingProgressListener() {
        this(DEFAULT_INTERVAL, Clock.systemUTC());
    }

    /**
     * Constructs a new LoggingProgressListener instance.
     *
     * @param interval Minimum time between heartbeats.
     * @param clock    Clock instance.
     */
    public LoggingProgressListener(Duration interval, Clock clock) {
        this.interval = interval;
        this.clock = clock;
    }

    @Override
    public void onBatch(String mailbox, int batchIndex, int batchCount, int processed, int total) {
        if (shouldReport(batchIndex, batchCount)) {
            log.info("Migration of {} still in progress: batch {}/{}, {}/{} messages",
                    mailbox, batchIndex, batchCount, processed, total);
        }
    }

    /**
     * Checks and advances the throttle.
     *
     * @param batchIndex Finished batch, 1 based.
     * @param batchCount Number of batches.
     * @return true if a heartbeat is due
     */
    boolean shouldReport(int batchIndex, int batchCount) {
        Instant now = clock.instant();
        if (batchIndex >= batchCount || last == null || !now.isBefore(last.plus(interval))) {
            last = now;
            return true;
        }
        return false;
    }
}
