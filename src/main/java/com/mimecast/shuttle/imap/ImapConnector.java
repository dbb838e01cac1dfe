package com.mimecast.shuttle.imap;

import com.mimecast.shuttle.config.EndpointConfig;

/**
 * Opens authenticated sessions.
 */
@FunctionalInterface
public interface ImapConnector {

    /**
     * Connects and authenticates.
     *
     * @param endpoint Endpoint configuration.
     * @return Ready ImapSession with no mailbox selected.
     * @throws ImapConnectionException Network negotiation or authentication failure.
     */
    ImapSession open(EndpointConfig endpoint) throws ImapConnectionException;
}
