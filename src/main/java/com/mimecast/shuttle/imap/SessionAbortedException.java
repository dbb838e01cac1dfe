package com.mimecast.shuttle.imap;

/**
 * The session died under an operation.
 *
 * <p>Raised for dropped connections, closed stores or folders and socket errors.
 * <br>The session that raised it must not be used again; callers reopen a fresh one.
 */
public class SessionAbortedException extends ImapException {

    /**
     * Constructs a new SessionAbortedException instance.
     *
     * @param message Message string.
     */
    public SessionAbortedException(String message) {
        super(message);
    }

    /**
     * Constructs a new SessionAbortedException instance.
     *
     * @param message Message string.
     * @param cause   Cause.
     */
    public SessionAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
