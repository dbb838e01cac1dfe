package com.mimecast.shuttle.imap;

import com.mimecast.shuttle.config.EndpointConfig;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.FolderClosedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.StoreClosedException;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.MimeMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.angus.mail.iap.ConnectionException;
import org.eclipse.angus.mail.imap.AppendUID;
import org.eclipse.angus.mail.imap.IMAPFolder;
import org.eclipse.angus.mail.imap.IMAPStore;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Jakarta Mail backed IMAP session.
 *
 * <p>Wraps one {@link IMAPStore} and the currently open {@link IMAPFolder}.
 * <br>All message addressing is by UID.
 *
 * <p>Jakarta Mail failures are translated into the session error taxonomy:
 * <ul>
 *     <li>Closed store or folder, IAP connection loss and socket errors become {@link SessionAbortedException}.</li>
 *     <li>Everything else becomes a plain {@link ImapException}.</li>
 * </ul>
 */
public class JakartaImapSession implements ImapSession {
    private static final Logger log = LogManager.getLogger(JakartaImapSession.class);

    private final EndpointConfig endpoint;
    private final Session session;
    private final IMAPStore store;

    private IMAPFolder folder;
    private boolean expungeWarned = false;

    /**
     * Constructs a new JakartaImapSession instance around a connected store.
     *
     * @param endpoint Endpoint configuration.
     * @param session  Jakarta Mail session.
     * @param store    Connected store.
     */
    JakartaImapSession(EndpointConfig endpoint, Session session, IMAPStore store) {
        this.endpoint = endpoint;
        this.session = session;
        this.store = store;
    }

    @Override
    public EndpointConfig getEndpoint() {
        return endpoint;
    }

    @Override
    public List<String> listMailboxes() throws ImapException {
        try {
            List<String> names = new ArrayList<>();
            for (Folder child : store.getDefaultFolder().list("*")) {
                names.add(child.getFullName());
            }
            return names;
        } catch (MessagingException e) {
            throw translate("LIST", e);
        }
    }

    @Override
    public void select(String mailbox) throws ImapException {
        closeSelected();
        try {
            IMAPFolder candidate = (IMAPFolder) store.getFolder(mailbox);
            candidate.open(Folder.READ_WRITE);
            folder = candidate;
            log.debug("Selected {} on {}", mailbox, endpoint.getHost());
        } catch (MessagingException e) {
            throw translate("SELECT " + mailbox, e);
        }
    }

    @Override
    public void create(String mailbox) throws ImapException {
        try {
            Folder candidate = store.getFolder(mailbox);
            if (candidate.exists()) {
                return;
            }
            if (!candidate.create(Folder.HOLDS_MESSAGES)) {
                throw new ImapException("Server refused to create mailbox " + mailbox);
            }
            log.info("Created mailbox {} on {}", mailbox, endpoint.getHost());
        } catch (MessagingException e) {
            throw translate("CREATE " + mailbox, e);
        }
    }

    @Override
    public List<Long> searchAll() throws ImapException {
        IMAPFolder selected = requireSelected();
        try {
            Message[] messages = selected.getMessages();
            FetchProfile fp = new FetchProfile();
            fp.add(UIDFolder.FetchProfileItem.UID);
            selected.fetch(messages, fp);

            List<Long> uids = new ArrayList<>(messages.length);
            for (Message message : messages) {
                if (!message.isExpunged()) {
                    uids.add(selected.getUID(message));
                }
            }
            return uids;
        } catch (MessagingException e) {
            throw translate("SEARCH", e);
        } catch (IllegalStateException e) {
            throw new SessionAbortedException("SEARCH failed, folder closed: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<Long, FetchedMessage> fetch(List<Long> uids) throws ImapException {
        IMAPFolder selected = requireSelected();
        try {
            Message[] found = selected.getMessagesByUID(toArray(uids));
            List<Message> present = new ArrayList<>();
            for (Message message : found) {
                if (message != null && !message.isExpunged()) {
                    present.add(message);
                }
            }

            FetchProfile fp = new FetchProfile();
            fp.add(FetchProfile.Item.FLAGS);
            fp.add(UIDFolder.FetchProfileItem.UID);
            fp.add(IMAPFolder.FetchProfileItem.INTERNALDATE);
            fp.add(IMAPFolder.FetchProfileItem.MESSAGE);
            Message[] batch = present.toArray(new Message[0]);
            selected.fetch(batch, fp);

            Map<Long, FetchedMessage> result = new LinkedHashMap<>();
            for (Message message : batch) {
                long uid = selected.getUID(message);
                ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(message.getSize(), 1024));
                message.writeTo(out);
                result.put(uid, new FetchedMessage(uid, out.toByteArray(), message.getFlags(), message.getReceivedDate()));
            }
            return result;
        } catch (MessagingException e) {
            throw translate("FETCH", e);
        } catch (IOException e) {
            throw new SessionAbortedException("FETCH failed reading message content: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new SessionAbortedException("FETCH failed, folder closed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Long> append(String mailbox, FetchedMessage message) throws ImapException {
        try {
            IMAPFolder target = (IMAPFolder) store.getFolder(mailbox);

            MimeMessage copy = new RawMimeMessage(session, message.getContent(), message.getInternalDate());
            Flags flags = message.getFlags();
            flags.remove(Flags.Flag.RECENT);
            copy.setFlags(flags, true);

            AppendUID[] appended = target.appendUIDMessages(new Message[]{copy});
            if (appended != null && appended.length == 1 && appended[0] != null) {
                return Optional.of(appended[0].uid);
            }
            return Optional.empty();
        } catch (MessagingException e) {
            throw translate("APPEND " + mailbox, e);
        }
    }

    @Override
    public void move(List<Long> uids, String targetMailbox) throws ImapException {
        IMAPFolder selected = requireSelected();
        try {
            List<Message> present = new ArrayList<>();
            for (Message message : selected.getMessagesByUID(toArray(uids))) {
                if (message != null) {
                    present.add(message);
                }
            }
            if (present.size() != uids.size()) {
                throw new ImapException("MOVE of " + uids + " failed, " + (uids.size() - present.size()) + " no longer present");
            }

            Message[] messages = present.toArray(new Message[0]);
            Folder target = store.getFolder(targetMailbox);
            if (store.hasCapability("MOVE")) {
                selected.moveMessages(messages, target);
            } else {
                // No RFC 6851 support: copy, flag deleted, UID EXPUNGE just these where UIDPLUS allows.
                selected.copyMessages(messages, target);
                selected.setFlags(messages, new Flags(Flags.Flag.DELETED), true);
                if (store.hasCapability("UIDPLUS")) {
                    selected.expunge(messages);
                } else if (!expungeWarned) {
                    // Never a plain EXPUNGE, it removes every \Deleted message in the mailbox.
                    expungeWarned = true;
                    log.warn("{} lacks MOVE and UIDPLUS, archived messages stay flagged \\Deleted in {}",
                            endpoint.getHost(), selected.getFullName());
                }
            }
        } catch (MessagingException e) {
            throw translate("MOVE " + targetMailbox, e);
        } catch (IllegalStateException e) {
            throw new SessionAbortedException("MOVE failed, folder closed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean logout() {
        boolean clean = closeSelected();
        try {
            store.close();
        } catch (MessagingException e) {
            log.debug("Logout from {} failed: {}", endpoint.getHost(), e.getMessage());
            clean = false;
        }
        return clean;
    }

    /**
     * Close the open folder without expunging.
     *
     * @return true if nothing was open or it closed cleanly
     */
    private boolean closeSelected() {
        if (folder == null) {
            return true;
        }
        IMAPFolder closing = folder;
        folder = null;
        try {
            if (closing.isOpen()) {
                closing.close(false);
            }
            return true;
        } catch (MessagingException | IllegalStateException e) {
            log.debug("Closing {} failed: {}", closing.getFullName(), e.getMessage());
            return false;
        }
    }

    private IMAPFolder requireSelected() throws ImapException {
        if (folder == null) {
            throw new ImapException("No mailbox selected");
        }
        return folder;
    }

    private static long[] toArray(List<Long> uids) {
        long[] array = new long[uids.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = uids.get(i);
        }
        return array;
    }

    /**
     * Translate a Jakarta Mail failure into the session error taxonomy.
     *
     * @param operation Operation name for the message.
     * @param e         MessagingException instance.
     * @return ImapException or SessionAbortedException.
     */
    static ImapException translate(String operation, MessagingException e) {
        String message = operation + " failed: " + e.getMessage();
        return isAbort(e) ? new SessionAbortedException(message, e) : new ImapException(message, e);
    }

    /**
     * Checks the cause chain for signs of a dead connection.
     *
     * @param e Throwable instance.
     * @return Boolean.
     */
    static boolean isAbort(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof FolderClosedException
                    || t instanceof StoreClosedException
                    || t instanceof ConnectionException
                    || t instanceof IOException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Unmodified raw message carrying its original receipt time for APPEND.
     */
    private static final class RawMimeMessage extends MimeMessage {
        private final Date receivedDate;

        RawMimeMessage(Session session, byte[] content, Date receivedDate) throws MessagingException {
            super(session, new ByteArrayInputStream(content));
            this.receivedDate = receivedDate;
        }

        @Override
        public Date getReceivedDate() {
            return receivedDate;
        }
    }
}
