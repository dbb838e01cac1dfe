package com.mimecast.shuttle.imap;

import jakarta.mail.Flags;

import java.util.Date;

/**
 * A message fetched from the selected mailbox.
 *
 * <p>Holds the raw RFC 822 bytes, the flags and the original INTERNALDATE,
 * <br>everything needed to append an identical copy elsewhere.
 */
public final class FetchedMessage {

    private final long uid;
    private final byte[] content;
    private final Flags flags;
    private final Date internalDate;

    /**
     * Constructs a new FetchedMessage instance.
     *
     * @param uid          Message UID in the source mailbox.
     * @param content      Raw message bytes.
     * @param flags        Message flags, null treated as none.
     * @param internalDate Original receipt time, may be null.
     */
    public FetchedMessage(long uid, byte[] content, Flags flags, Date internalDate) {
        this.uid = uid;
        this.content = content != null ? content.clone() : new byte[0];
        this.flags = flags != null ? new Flags(flags) : new Flags();
        this.internalDate = internalDate != null ? new Date(internalDate.getTime()) : null;
    }

    public long getUid() {
        return uid;
    }

    /**
     * Gets raw message bytes.
     *
     * @return Copy of the content.
     */
    public byte[] getContent() {
        return content.clone();
    }

    public int getSize() {
        return content.length;
    }

    /**
     * Gets flags.
     *
     * @return Copy of the flags.
     */
    public Flags getFlags() {
        return new Flags(flags);
    }

    /**
     * Gets original receipt time.
     *
     * @return Date copy or null.
     */
    public Date getInternalDate() {
        return internalDate != null ? new Date(internalDate.getTime()) : null;
    }
}
