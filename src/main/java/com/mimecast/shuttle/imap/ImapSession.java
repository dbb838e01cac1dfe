package com.mimecast.shuttle.imap;

import com.mimecast.shuttle.config.EndpointConfig;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One authenticated IMAP session.
 *
 * <p>A session has at most one selected mailbox and is owned by a single caller.
 * <br>Any method may raise {@link SessionAbortedException}, after which the instance is dead
 * <br>and must be replaced through {@link SessionManager#reopen(ImapSession, EndpointConfig)}.
 *
 * <p>Message keys are UIDs of the currently selected mailbox.
 */
public interface ImapSession {

    /**
     * Gets the endpoint this session is connected to.
     *
     * @return EndpointConfig instance.
     */
    EndpointConfig getEndpoint();

    /**
     * Lists all mailbox names visible to the account, in server order.
     *
     * @return List of mailbox names.
     * @throws ImapException On protocol failure.
     */
    List<String> listMailboxes() throws ImapException;

    /**
     * Selects a mailbox for read/write.
     *
     * @param mailbox Mailbox name.
     * @throws ImapException Mailbox missing or not selectable.
     */
    void select(String mailbox) throws ImapException;

    /**
     * Creates a mailbox.
     *
     * @param mailbox Mailbox name.
     * @throws ImapException Unable to create.
     */
    void create(String mailbox) throws ImapException;

    /**
     * UIDs of all messages in the selected mailbox, in mailbox order.
     *
     * @return List of UIDs.
     * @throws ImapException On protocol failure or no mailbox selected.
     */
    List<Long> searchAll() throws ImapException;

    /**
     * Fetches body, flags and internal date for the given UIDs.
     * <p>UIDs no longer present (expunged) are absent from the result.
     *
     * @param uids UIDs in the selected mailbox.
     * @return Map of UID to message, in request order.
     * @throws ImapException On protocol failure.
     */
    Map<Long, FetchedMessage> fetch(List<Long> uids) throws ImapException;

    /**
     * Appends a message with its flags and internal date to a mailbox.
     *
     * @param mailbox Target mailbox name.
     * @param message Message to append.
     * @return Optional of the new UID, present when the server reports it (UIDPLUS).
     * @throws ImapException On protocol failure.
     */
    Optional<Long> append(String mailbox, FetchedMessage message) throws ImapException;

    /**
     * Moves messages from the selected mailbox to another mailbox.
     * <p>Must never remove any other message from the selected mailbox.
     * <br>Where the server cannot expunge by UID the originals may stay behind flagged deleted.
     *
     * @param uids          UIDs in the selected mailbox.
     * @param targetMailbox Target mailbox name.
     * @throws ImapException On protocol failure.
     */
    void move(List<Long> uids, String targetMailbox) throws ImapException;

    /**
     * Graceful logout, best effort.
     * <p>Errors are discarded, the session is presumed unusable afterward either way.
     *
     * @return true if the logout completed cleanly
     */
    boolean logout();
}
