package com.mimecast.shuttle.migrate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MigrationSummaryTest {

    @Test
    void completedMailboxesAreClean() {
        MailboxResult inbox = new MailboxResult("INBOX", "INBOX");
        inbox.incrementTransferred();
        inbox.incrementAlreadyMigrated();

        MigrationSummary summary = new MigrationSummary();
        summary.add(inbox);
        summary.addExcluded("Junk");

        assertTrue(summary.isClean());
        assertEquals(1, summary.getTransferred());
        assertEquals(1, summary.getExcluded().size());
    }

    @Test
    void skippedBatchIsNotClean() {
        MailboxResult inbox = new MailboxResult("INBOX", "INBOX");
        inbox.incrementTransferred();
        inbox.incrementSkippedBatches();

        MigrationSummary summary = new MigrationSummary();
        summary.add(inbox);

        assertEquals(MailboxStatus.COMPLETED, inbox.getStatus());
        assertFalse(summary.isClean());
    }

    @Test
    void failedMessageIsNotClean() {
        MailboxResult inbox = new MailboxResult("INBOX", "INBOX");
        inbox.incrementFailed();

        MigrationSummary summary = new MigrationSummary();
        summary.add(inbox);

        assertFalse(summary.isClean());
        assertEquals(1, summary.getFailed());
    }

    @Test
    void skippedMailboxIsNotClean() {
        MigrationSummary summary = new MigrationSummary();
        summary.add(new MailboxResult("Sent", "Sent").skip("destination unusable"));

        assertFalse(summary.isClean());
        assertEquals(1, summary.count(MailboxStatus.SKIPPED));
    }
}
