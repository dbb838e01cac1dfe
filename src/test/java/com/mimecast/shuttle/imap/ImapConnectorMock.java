package com.mimecast.shuttle.imap;

import com.mimecast.shuttle.config.EndpointConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Connector resolving endpoints to {@link ImapServerMock} instances by host.
 */
public class ImapConnectorMock implements ImapConnector {

    private final Map<String, ImapServerMock> servers = new HashMap<>();

    /**
     * Sessions opened so far.
     */
    public final List<ImapSessionMock> sessions = new ArrayList<>();

    public ImapConnectorMock add(String host, ImapServerMock server) {
        servers.put(host, server);
        return this;
    }

    @Override
    public ImapSession open(EndpointConfig endpoint) throws ImapConnectionException {
        ImapServerMock server = servers.get(endpoint.getHost());
        if (server == null) {
            throw new ImapConnectionException("Unknown host " + endpoint.getHost());
        }
        server.login();

        ImapSessionMock session = new ImapSessionMock(endpoint, server);
        sessions.add(session);
        return session;
    }

    /**
     * Checks every session opened was logged out.
     *
     * @return Boolean.
     */
    public boolean allClosed() {
        return sessions.stream().allMatch(ImapSessionMock::isClosed);
    }
}
