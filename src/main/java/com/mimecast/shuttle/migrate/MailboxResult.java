package com.mimecast.shuttle.migrate;

/**
 * Counters and status of one mailbox migration.
 *
 * <p>Mutated only by the pipeline while it runs.
 */
public class MailboxResult {

    private final String sourceMailbox;
    private final String destinationMailbox;
    private MailboxStatus status = MailboxStatus.COMPLETED;
    private String reason;

    private int total;
    private int transferred;
    private int alreadyMigrated;
    private int missing;
    private int failed;
    private int skippedBatches;
    private int wouldTransfer;

    /**
     * Constructs a new MailboxResult instance.
     *
     * @param sourceMailbox      Source mailbox name.
     * @param destinationMailbox Destination mailbox name.
     */
    public MailboxResult(String sourceMailbox, String destinationMailbox) {
        this.sourceMailbox = sourceMailbox;
        this.destinationMailbox = destinationMailbox;
    }

    public String getSourceMailbox() {
        return sourceMailbox;
    }

    public String getDestinationMailbox() {
        return destinationMailbox;
    }

    public MailboxStatus getStatus() {
        return status;
    }

    /**
     * Gets the reason for a SKIPPED or ABORTED status.
     *
     * @return String, null when completed.
     */
    public String getReason() {
        return reason;
    }

    MailboxResult skip(String reason) {
        this.status = MailboxStatus.SKIPPED;
        this.reason = reason;
        return this;
    }

    MailboxResult abort(String reason) {
        this.status = MailboxStatus.ABORTED;
        this.reason = reason;
        return this;
    }

    /**
     * Gets number of message keys found by search.
     *
     * @return Integer.
     */
    public int getTotal() {
        return total;
    }

    void setTotal(int total) {
        this.total = total;
    }

    public int getTransferred() {
        return transferred;
    }

    void incrementTransferred() {
        transferred++;
    }

    public int getAlreadyMigrated() {
        return alreadyMigrated;
    }

    void incrementAlreadyMigrated() {
        alreadyMigrated++;
    }

    /**
     * Gets number of keys with no fetched data (expunged between search and fetch).
     *
     * @return Integer.
     */
    public int getMissing() {
        return missing;
    }

    void incrementMissing() {
        missing++;
    }

    public int getFailed() {
        return failed;
    }

    void incrementFailed() {
        failed++;
    }

    public int getSkippedBatches() {
        return skippedBatches;
    }

    void incrementSkippedBatches() {
        skippedBatches++;
    }

    /**
     * Gets number of messages a dry run found eligible.
     *
     * @return Integer.
     */
    public int getWouldTransfer() {
        return wouldTransfer;
    }

    void incrementWouldTransfer() {
        wouldTransfer++;
    }

    /**
     * Gets processed message count.
     *
     * @return Integer.
     */
    public int getProcessed() {
        return transferred + alreadyMigrated + missing + failed + wouldTransfer;
    }

    @Override
    public String toString() {
        return sourceMailbox + " -> " + destinationMailbox + ": " + status +
                (reason != null ? " (" + reason + ")" : "") +
                " total=" + total +
                " transferred=" + transferred +
                " alreadyMigrated=" + alreadyMigrated +
                " missing=" + missing +
                " failed=" + failed +
                " skippedBatches=" + skippedBatches +
                (wouldTransfer > 0 ? " wouldTransfer=" + wouldTransfer : "");
    }
}
