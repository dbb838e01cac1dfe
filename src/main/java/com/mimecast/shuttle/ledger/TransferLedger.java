package com.mimecast.shuttle.ledger;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

/**
 * Interface for transfer ledger implementations.
 * <p>Defines the contract for the durable record of completed message transfers.
 *
 * <p>Entries are keyed by source mailbox and source message key.
 * <br>Writing a colliding key replaces the previous entry.
 * <br>Entries are never deleted.
 */
public interface TransferLedger extends Closeable {

    /**
     * Initialize the storage and schema.
     * <p>Must be idempotent, running it against an existing store keeps its data.
     */
    void initialize();

    /**
     * Checks if a transfer was recorded.
     *
     * @param sourceMailbox    Source mailbox name.
     * @param sourceMessageKey Source message key.
     * @return true if a matching record exists
     */
    boolean isTransferred(String sourceMailbox, String sourceMessageKey);

    /**
     * Durably record a transfer, replacing any record with the same key.
     * <p>Returns only once the record is committed.
     *
     * @param record The record to persist
     */
    void recordTransfer(TransferRecord record);

    /**
     * Find a record by key.
     *
     * @param sourceMailbox    Source mailbox name.
     * @param sourceMessageKey Source message key.
     * @return Optional of TransferRecord
     */
    Optional<TransferRecord> find(String sourceMailbox, String sourceMessageKey);

    /**
     * Find records by Message-ID header.
     *
     * @param messageId Message-ID header value.
     * @return List of records, possibly empty
     */
    List<TransferRecord> findByMessageId(String messageId);

    /**
     * Get the number of records.
     *
     * @return Record count
     */
    long count();

    /**
     * Release resources.
     */
    @Override
    void close();
}
