package com.mimecast.shuttle.migrate;

import java.time.Duration;

/**
 * Pipeline tuning options.
 *
 * <p>Defaults match an unconfigured run.
 */
public class MigrationOptions {

    /**
     * Default messages per batch.
     */
    public static final int DEFAULT_BATCH_SIZE = 50;

    /**
     * Default archive namespace at the source.
     */
    public static final String DEFAULT_ARCHIVE_PREFIX = "Migrated/";

    private int batchSize = DEFAULT_BATCH_SIZE;
    private Duration batchDelay = Duration.ofSeconds(2);
    private String archivePrefix = DEFAULT_ARCHIVE_PREFIX;
    private Duration reconnectDelay = Duration.ofSeconds(3);
    private int searchMaxAttempts = 5;
    private Duration searchBaseDelay = Duration.ofSeconds(5);
    private int transferAttempts = 3;
    private boolean dryRun = false;

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Sets batch size.
     *
     * @param batchSize Messages per batch, at least 1.
     * @return Self.
     */
    public MigrationOptions setBatchSize(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1: " + batchSize);
        }
        this.batchSize = batchSize;
        return this;
    }

    public Duration getBatchDelay() {
        return batchDelay;
    }

    public MigrationOptions setBatchDelay(Duration batchDelay) {
        this.batchDelay = batchDelay;
        return this;
    }

    public String getArchivePrefix() {
        return archivePrefix;
    }

    public MigrationOptions setArchivePrefix(String archivePrefix) {
        this.archivePrefix = archivePrefix;
        return this;
    }

    /**
     * Gets archive mailbox name for a source mailbox.
     *
     * @param sourceMailbox Source mailbox name.
     * @return Archive mailbox name.
     */
    public String getArchiveMailbox(String sourceMailbox) {
        return archivePrefix + sourceMailbox;
    }

    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    public MigrationOptions setReconnectDelay(Duration reconnectDelay) {
        this.reconnectDelay = reconnectDelay;
        return this;
    }

    public int getSearchMaxAttempts() {
        return searchMaxAttempts;
    }

    public MigrationOptions setSearchMaxAttempts(int searchMaxAttempts) {
        this.searchMaxAttempts = searchMaxAttempts;
        return this;
    }

    public Duration getSearchBaseDelay() {
        return searchBaseDelay;
    }

    public MigrationOptions setSearchBaseDelay(Duration searchBaseDelay) {
        this.searchBaseDelay = searchBaseDelay;
        return this;
    }

    public int getTransferAttempts() {
        return transferAttempts;
    }

    public MigrationOptions setTransferAttempts(int transferAttempts) {
        this.transferAttempts = transferAttempts;
        return this;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public MigrationOptions setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
        return this;
    }

    @Override
    public String toString() {
        return "MigrationOptions{" +
                "batchSize=" + batchSize +
                ", batchDelay=" + batchDelay +
                ", archivePrefix='" + archivePrefix + '\'' +
                ", reconnectDelay=" + reconnectDelay +
                ", searchMaxAttempts=" + searchMaxAttempts +
                ", searchBaseDelay=" + searchBaseDelay +
                ", transferAttempts=" + transferAttempts +
                ", dryRun=" + dryRun +
                '}';
    }
}
