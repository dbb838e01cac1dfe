package com.mimecast.shuttle.imap;

/**
 * IMAP operation failure.
 *
 * <p>Base of the protocol error taxonomy.
 * <br>Plain instances are application level errors (e.g. mailbox does not exist) and are never retried.
 *
 * @see SessionAbortedException
 * @see ImapConnectionException
 */
public class ImapException extends Exception {

    /**
     * Constructs a new ImapException instance.
     *
     * @param message Message string.
     */
    public ImapException(String message) {
        super(message);
    }

    /**
     * Constructs a new ImapException instance.
     *
     * @param message Message string.
     * @param cause   Cause.
     */
    public ImapException(String message, Throwable cause) {
        super(message, cause);
    }
}
