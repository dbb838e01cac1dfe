package com.mimecast.shuttle.migrate;

/**
 * Outcome of one mailbox migration.
 */
public enum MailboxStatus {

    /**
     * Every batch was processed. Individual messages may still have failed.
     */
    COMPLETED,

    /**
     * Destination mailbox unusable, source left untouched.
     */
    SKIPPED,

    /**
     * A mailbox prerequisite failed part way (source select, search, reconnect or ledger).
     */
    ABORTED
}
