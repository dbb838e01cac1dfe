package com.mimecast.shuttle.imap;

import com.mimecast.shuttle.config.EndpointConfig;
import com.mimecast.shuttle.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;

/**
 * Opens, replaces and closes IMAP sessions.
 *
 * <p>Reconnection hides abrupt session termination from callers:
 * <br>the stale session is logged out best effort, a cooldown is observed so the remote endpoint
 * <br>is not hammered, then a brand new session is opened. The stale instance must not be used again.
 *
 * <p>No retry happens at this layer, {@link com.mimecast.shuttle.retry.RetryPolicy} decides that.
 */
public class SessionManager {
    private static final Logger log = LogManager.getLogger(SessionManager.class);

    /**
     * Default reconnect cooldown.
     */
    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(3);

    private final ImapConnector connector;
    private final Duration reconnectDelay;
    private final Sleeper sleeper;

    /**
     * Constructs a new SessionManager instance with default cooldown.
     *
     * @param connector ImapConnector instance.
     */
    public SessionManager(ImapConnector connector) {
        this(connector, DEFAULT_RECONNECT_DELAY, Sleeper.SYSTEM);
    }

    /**
     * Constructs a new SessionManager instance.
     *
     * @param connector      ImapConnector instance.
     * @param reconnectDelay Cooldown between logout and new login.
     * @param sleeper        Sleeper instance.
     */
    public SessionManager(ImapConnector connector, Duration reconnectDelay, Sleeper sleeper) {
        this.connector = connector;
        this.reconnectDelay = reconnectDelay;
        this.sleeper = sleeper;
    }

    /**
     * Opens an authenticated session.
     *
     * @param endpoint Endpoint configuration.
     * @return ImapSession instance.
     * @throws ImapConnectionException Authentication or network failure.
     */
    public ImapSession open(EndpointConfig endpoint) throws ImapConnectionException {
        return connector.open(endpoint);
    }

    /**
     * Replaces a stale session with a fresh one.
     * <p>The new session has no mailbox selected.
     *
     * @param stale    Stale session, may be null.
     * @param endpoint Endpoint configuration.
     * @return New ImapSession instance.
     * @throws ImapConnectionException Unable to open the new session.
     * @throws InterruptedException    Interrupted during cooldown.
     */
    public ImapSession reopen(ImapSession stale, EndpointConfig endpoint) throws ImapConnectionException, InterruptedException {
        log.warn("Reconnecting to {}", endpoint);
        close(stale);
        sleeper.sleep(reconnectDelay);
        return open(endpoint);
    }

    /**
     * Lists mailboxes in server order.
     *
     * @param session ImapSession instance.
     * @return List of mailbox names.
     * @throws ImapException On protocol failure.
     */
    public List<String> listMailboxes(ImapSession session) throws ImapException {
        List<String> mailboxes = session.listMailboxes();
        log.debug("Found {} mailboxes on {}", mailboxes.size(), session.getEndpoint().getHost());
        return mailboxes;
    }

    /**
     * Selects a mailbox, creating it first if selection fails.
     * <p>A false result means the mailbox should be skipped, not that the run should stop.
     *
     * @param session ImapSession instance.
     * @param mailbox Mailbox name.
     * @return true if the mailbox is now selected
     */
    public boolean ensureMailboxSelected(ImapSession session, String mailbox) {
        try {
            session.select(mailbox);
            return true;
        } catch (ImapException e) {
            log.debug("Select {} failed, trying to create it: {}", mailbox, e.getMessage());
        }

        try {
            session.create(mailbox);
            session.select(mailbox);
            return true;
        } catch (ImapException e) {
            log.warn("Could not create mailbox {}: {}", mailbox, e.getMessage());
            return false;
        }
    }

    /**
     * Selects a mailbox without creating it.
     *
     * @param session ImapSession instance.
     * @param mailbox Mailbox name.
     * @return true if the mailbox is now selected
     */
    public boolean trySelect(ImapSession session, String mailbox) {
        try {
            session.select(mailbox);
            return true;
        } catch (ImapException e) {
            log.debug("Select {} failed: {}", mailbox, e.getMessage());
            return false;
        }
    }

    /**
     * Logs out, errors discarded.
     *
     * @param session ImapSession instance, may be null.
     * @return true if the logout completed cleanly
     */
    public boolean close(ImapSession session) {
        if (session == null) {
            return true;
        }
        boolean clean = session.logout();
        if (!clean) {
            log.debug("Logout from {} was not clean", session.getEndpoint());
        }
        return clean;
    }
}
