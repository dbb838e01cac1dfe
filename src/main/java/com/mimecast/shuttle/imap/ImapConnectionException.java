package com.mimecast.shuttle.imap;

/**
 * Unable to open a session: network negotiation or authentication failed.
 */
public class ImapConnectionException extends ImapException {

    /**
     * Constructs a new ImapConnectionException instance.
     *
     * @param message Message string.
     */
    public ImapConnectionException(String message) {
        super(message);
    }

    /**
     * Constructs a new ImapConnectionException instance.
     *
     * @param message Message string.
     * @param cause   Cause.
     */
    public ImapConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
