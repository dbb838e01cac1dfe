package com.mimecast.shuttle.ledger;

/**
 * Ledger storage failure.
 */
public class LedgerException extends RuntimeException {

    /**
     * Constructs a new LedgerException instance.
     *
     * @param message Message string.
     * @param cause   Cause.
     */
    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new LedgerException instance.
     *
     * @param message Message string.
     */
    public LedgerException(String message) {
        super(message);
    }
}
