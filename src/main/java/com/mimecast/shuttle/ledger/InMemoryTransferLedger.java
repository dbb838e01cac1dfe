package com.mimecast.shuttle.ledger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of TransferLedger for testing and dry runs.
 * <p>This implementation does not persist data to disk and is lost on application restart.
 */
public class InMemoryTransferLedger implements TransferLedger {

    private final Map<String, TransferRecord> records = new LinkedHashMap<>();

    /**
     * No initialization needed for in-memory implementation.
     */
    @Override
    public void initialize() {
        // No initialization needed for in-memory implementation.
    }

    @Override
    public synchronized boolean isTransferred(String sourceMailbox, String sourceMessageKey) {
        return records.containsKey(key(sourceMailbox, sourceMessageKey));
    }

    @Override
    public synchronized void recordTransfer(TransferRecord record) {
        String key = key(record.getSourceMailbox(), record.getSourceMessageKey());
        // Replacement moves the entry to the end, matching insertion order of a replaced row.
        records.remove(key);
        records.put(key, record);
    }

    @Override
    public synchronized Optional<TransferRecord> find(String sourceMailbox, String sourceMessageKey) {
        return Optional.ofNullable(records.get(key(sourceMailbox, sourceMessageKey)));
    }

    @Override
    public synchronized List<TransferRecord> findByMessageId(String messageId) {
        List<TransferRecord> found = new ArrayList<>();
        for (TransferRecord record : records.values()) {
            if (record.getMessageId().filter(messageId::equals).isPresent()) {
                found.add(record);
            }
        }
        return found;
    }

    @Override
    public synchronized long count() {
        return records.size();
    }

    /**
     * Take a snapshot copy of current records for read-only inspection.
     *
     * @return List of all records in insertion order
     */
    public synchronized List<TransferRecord> snapshot() {
        return new ArrayList<>(records.values());
    }

    @Override
    public void close() {
        // Nothing to release.
    }

    private static String key(String sourceMailbox, String sourceMessageKey) {
        return sourceMailbox + "\u0000" + sourceMessageKey;
    }
}
