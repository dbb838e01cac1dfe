package com.mimecast.shuttle.ledger;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One completed message transfer.
 *
 * <p>Identity is the pair of source mailbox and source message key (the IMAP UID within that mailbox).
 * <br>The destination fields and the Message-ID are informational only.
 */
public final class TransferRecord {

    private final String sourceMailbox;
    private final String sourceMessageKey;
    private final String destinationMailbox;
    private final String destinationMessageKey;
    private final String messageId;
    private final Instant transferredAt;

    /**
     * Constructs a new TransferRecord instance.
     *
     * @param sourceMailbox         Source mailbox name.
     * @param sourceMessageKey      Source message UID.
     * @param destinationMailbox    Destination mailbox name, may be null.
     * @param destinationMessageKey Destination message UID, may be null.
     * @param messageId             Message-ID header, may be null.
     * @param transferredAt         Commit time.
     */
    public TransferRecord(String sourceMailbox, String sourceMessageKey, String destinationMailbox,
                          String destinationMessageKey, String messageId, Instant transferredAt) {
        this.sourceMailbox = Objects.requireNonNull(sourceMailbox, "sourceMailbox");
        this.sourceMessageKey = Objects.requireNonNull(sourceMessageKey, "sourceMessageKey");
        this.destinationMailbox = destinationMailbox;
        this.destinationMessageKey = destinationMessageKey;
        this.messageId = messageId;
        this.transferredAt = Objects.requireNonNull(transferredAt, "transferredAt");
    }

    public String getSourceMailbox() {
        return sourceMailbox;
    }

    public String getSourceMessageKey() {
        return sourceMessageKey;
    }

    public Optional<String> getDestinationMailbox() {
        return Optional.ofNullable(destinationMailbox);
    }

    public Optional<String> getDestinationMessageKey() {
        return Optional.ofNullable(destinationMessageKey);
    }

    public Optional<String> getMessageId() {
        return Optional.ofNullable(messageId);
    }

    public Instant getTransferredAt() {
        return transferredAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransferRecord)) return false;
        TransferRecord that = (TransferRecord) o;
        return sourceMailbox.equals(that.sourceMailbox)
                && sourceMessageKey.equals(that.sourceMessageKey)
                && Objects.equals(destinationMailbox, that.destinationMailbox)
                && Objects.equals(destinationMessageKey, that.destinationMessageKey)
                && Objects.equals(messageId, that.messageId)
                && transferredAt.equals(that.transferredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceMailbox, sourceMessageKey, destinationMailbox, destinationMessageKey, messageId, transferredAt);
    }

    @Override
    public String toString() {
        return "TransferRecord{" + sourceMailbox + "/" + sourceMessageKey
                + " -> " + destinationMailbox + "/" + destinationMessageKey
                + ", messageId=" + messageId
                + ", transferredAt=" + transferredAt + "}";
    }
}
