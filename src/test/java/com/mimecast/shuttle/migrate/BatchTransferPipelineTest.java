package com.mimecast.shuttle.migrate;

import com.mimecast.shuttle.config.EndpointConfig;
import com.mimecast.shuttle.imap.ImapConnectorMock;
import com.mimecast.shuttle.imap.ImapServerMock;
import com.mimecast.shuttle.imap.SessionManager;
import com.mimecast.shuttle.ledger.InMemoryTransferLedger;
import com.mimecast.shuttle.ledger.LedgerException;
import com.mimecast.shuttle.ledger.SqliteTransferLedger;
import com.mimecast.shuttle.ledger.TransferLedger;
import com.mimecast.shuttle.ledger.TransferRecord;
import com.mimecast.shuttle.util.Sleeper;
import com.mimecast.shuttle.util.SleeperMock;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchTransferPipelineTest {

    private static final EndpointConfig SOURCE = new EndpointConfig(Map.of("host", "src.example.com", "user", "tony"));
    private static final EndpointConfig DESTINATION = new EndpointConfig(Map.of("host", "dst.example.com", "user", "tony"));

    private ImapServerMock src;
    private ImapServerMock dst;
    private ImapConnectorMock connector;
    private SleeperMock sleeper;
    private InMemoryTransferLedger ledger;
    private MigrationOptions options;

    @BeforeEach
    void setUp() {
        src = new ImapServerMock();
        dst = new ImapServerMock().addMailbox("INBOX");
        connector = new ImapConnectorMock().add("src.example.com", src).add("dst.example.com", dst);
        sleeper = new SleeperMock();
        ledger = new InMemoryTransferLedger();
        options = new MigrationOptions().setBatchSize(2);
    }

    private BatchTransferPipeline pipeline(TransferLedger ledger, Sleeper sleeper, ProgressListener listener) {
        SessionManager sessionManager = new SessionManager(connector, options.getReconnectDelay(), sleeper);
        return new BatchTransferPipeline(sessionManager, ledger, options, sleeper, listener);
    }

    private MailboxResult migrate(String sourceMailbox, String destinationMailbox) throws InterruptedException {
        return pipeline(ledger, sleeper, ProgressListener.NONE).migrate(SOURCE, DESTINATION, sourceMailbox, destinationMailbox);
    }

    @Test
    void threeMessagesInBatchesOfTwo() throws InterruptedException {
        src.addMessages("INBOX", 3);

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(MailboxStatus.COMPLETED, result.getStatus());
        assertEquals(3, result.getTotal());
        assertEquals(3, result.getTransferred());
        assertEquals(List.of("fetch [1, 2]", "fetch [3]"), src.calls("fetch"));
        assertEquals(3L, ledger.count());
        assertTrue(src.uids("INBOX").isEmpty());
        assertEquals(3, src.uids("Migrated/INBOX").size());
        assertEquals(3, dst.messages("INBOX").size());
        assertTrue(connector.allClosed());
    }

    @Test
    void messagesProcessedInSearchOrder() throws InterruptedException {
        src.addMessages("INBOX", 5);

        migrate("INBOX", "INBOX");

        assertEquals(List.of("append INBOX 1", "append INBOX 2", "append INBOX 3", "append INBOX 4", "append INBOX 5"),
                dst.calls("append"));
        assertEquals(List.of("move [1] Migrated/INBOX", "move [2] Migrated/INBOX", "move [3] Migrated/INBOX",
                "move [4] Migrated/INBOX", "move [5] Migrated/INBOX"), src.calls("move"));
        List<String> keys = new ArrayList<>();
        ledger.snapshot().forEach(r -> keys.add(r.getSourceMessageKey()));
        assertEquals(List.of("1", "2", "3", "4", "5"), keys);
    }

    @Test
    void appendKeepsContentFlagsAndDate() throws InterruptedException {
        src.addMessages("INBOX", 1);
        byte[] content = src.messages("INBOX").get(0).getContent();

        migrate("INBOX", "INBOX");

        assertArrayEquals(content, dst.messages("INBOX").get(0).getContent());
        assertTrue(dst.messages("INBOX").get(0).getFlags().contains(jakarta.mail.Flags.Flag.SEEN));
        assertEquals(1000L, dst.messages("INBOX").get(0).getInternalDate().getTime());
    }

    @Test
    void existingRecordIsSkipped() throws InterruptedException {
        src.addMessages("INBOX", 3);
        TransferRecord existing = new TransferRecord("INBOX", "2", "INBOX", null, null, Instant.EPOCH);
        ledger.recordTransfer(existing);
        options.setBatchSize(50);

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(List.of("fetch [1, 2, 3]"), src.calls("fetch"));
        assertEquals(List.of("append INBOX 1", "append INBOX 3"), dst.calls("append"));
        assertEquals(0, src.count("move [2]"));
        assertEquals(1, result.getAlreadyMigrated());
        assertEquals(2, result.getTransferred());
        assertEquals(3L, ledger.count());
        assertSame(existing, ledger.find("INBOX", "2").orElseThrow());
    }

    @Test
    void appendExhaustionLeavesMessageInSource() throws InterruptedException {
        src.addMessages("INBOX", 6);
        dst.abortAppendOf(5);
        options.setBatchSize(50);

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(MailboxStatus.COMPLETED, result.getStatus());
        assertEquals(1, result.getFailed());
        assertEquals(5, result.getTransferred());
        assertEquals(3, dst.count("append INBOX 5"));
        assertFalse(ledger.isTransferred("INBOX", "5"));
        assertEquals(0, src.count("move [5]"));
        assertEquals(List.of(5L), src.uids("INBOX"));
        assertEquals(1, dst.count("append INBOX 6"));
        assertTrue(ledger.isTransferred("INBOX", "6"));
        assertTrue(connector.allClosed());
    }

    @Test
    void appendRecoversAfterReconnect() throws InterruptedException {
        src.addMessages("INBOX", 2);
        dst.abortNext("append", 2);

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(2, result.getTransferred());
        assertEquals(0, result.getFailed());
        assertEquals(3, dst.logins);
        assertEquals(2, dst.messages("INBOX").size());
        assertEquals(List.of(Duration.ofSeconds(3), Duration.ofSeconds(3), Duration.ofSeconds(2)), sleeper.sleeps);
    }

    @Test
    void rerunIsIdempotent() throws InterruptedException {
        src.addMessages("INBOX", 3);
        migrate("INBOX", "INBOX");
        List<TransferRecord> first = ledger.snapshot();

        MailboxResult second = migrate("INBOX", "INBOX");

        assertEquals(0, second.getTransferred());
        assertEquals(first, ledger.snapshot());
        assertEquals(3, dst.count("append"));
        assertEquals(3, dst.messages("INBOX").size());
    }

    @Test
    void rerunOnUnchangedSourceAppendsNothing() throws InterruptedException {
        src.addMessages("INBOX", 3);
        for (long uid = 1; uid <= 3; uid++) {
            ledger.recordTransfer(new TransferRecord("INBOX", String.valueOf(uid), "INBOX", null, null, Instant.EPOCH));
        }
        List<TransferRecord> before = ledger.snapshot();

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(3, result.getAlreadyMigrated());
        assertEquals(0, dst.count("append"));
        assertEquals(0, src.count("move"));
        assertEquals(before, ledger.snapshot());
    }

    @Test
    void interruptedRunResumes(@TempDir Path dir) throws InterruptedException {
        src.addMessages("INBOX", 5);
        Path file = dir.resolve("ledger.db");

        Sleeper interrupting = duration -> {
            if (duration.equals(options.getBatchDelay())) {
                throw new InterruptedException("stop");
            }
        };
        try (SqliteTransferLedger first = new SqliteTransferLedger(file)) {
            first.initialize();
            BatchTransferPipeline pipeline = pipeline(first, interrupting, ProgressListener.NONE);
            assertThrows(InterruptedException.class, () -> pipeline.migrate(SOURCE, DESTINATION, "INBOX", "INBOX"));
            assertEquals(2L, first.count());
        }
        assertTrue(connector.allClosed());

        try (SqliteTransferLedger second = new SqliteTransferLedger(file)) {
            second.initialize();
            MailboxResult result = pipeline(second, sleeper, ProgressListener.NONE)
                    .migrate(SOURCE, DESTINATION, "INBOX", "INBOX");

            assertEquals(3, result.getTransferred());
            assertEquals(5L, second.count());
        }
        assertEquals(5, dst.count("append"));
        assertEquals(5, dst.messages("INBOX").size());
        assertTrue(src.uids("INBOX").isEmpty());
    }

    @Test
    void dryRunChangesNothing() throws InterruptedException {
        src.addMessages("INBOX", 3);
        ledger.recordTransfer(new TransferRecord("INBOX", "1", "Projects", null, null, Instant.EPOCH));
        List<TransferRecord> before = ledger.snapshot();
        options.setDryRun(true);

        MailboxResult result = migrate("INBOX", "Projects");

        assertEquals(MailboxStatus.COMPLETED, result.getStatus());
        assertEquals(2, result.getWouldTransfer());
        assertEquals(1, result.getAlreadyMigrated());
        assertEquals(0, result.getTransferred());
        assertEquals(before, ledger.snapshot());
        assertEquals(List.of(1L, 2L, 3L), src.uids("INBOX"));
        assertFalse(src.hasMailbox("Migrated/INBOX"));
        assertFalse(dst.hasMailbox("Projects"));
        assertEquals(0, src.count("create") + src.count("move"));
        assertEquals(0, dst.count("create") + dst.count("append"));
        assertTrue(connector.allClosed());
    }

    @Test
    void unusableDestinationSkipsMailbox() throws InterruptedException {
        src.addMessages("INBOX", 2);
        dst.uncreatable("Forbidden");

        MailboxResult result = migrate("INBOX", "Forbidden");

        assertEquals(MailboxStatus.SKIPPED, result.getStatus());
        assertEquals(List.of("login", "logout"), src.calls);
        assertEquals(List.of(1L, 2L), src.uids("INBOX"));
        assertTrue(connector.allClosed());
    }

    @Test
    void destinationCreatedWhenMissing() throws InterruptedException {
        src.addMessages("Sent Items", 1);

        MailboxResult result = migrate("Sent Items", "Sent");

        assertEquals(1, result.getTransferred());
        assertEquals(1, dst.messages("Sent").size());
        assertEquals("Sent", ledger.find("Sent Items", "1").orElseThrow().getDestinationMailbox().orElseThrow());
        assertTrue(src.hasMailbox("Migrated/Sent Items"));
    }

    @Test
    void fetchExhaustionSkipsBatch() throws InterruptedException {
        src.addMessages("INBOX", 3);
        src.abortNext("fetch", 3);

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(MailboxStatus.COMPLETED, result.getStatus());
        assertEquals(1, result.getSkippedBatches());
        assertEquals(1, result.getTransferred());
        assertEquals(List.of("fetch [1, 2]", "fetch [1, 2]", "fetch [1, 2]", "fetch [3]"), src.calls("fetch"));
        assertEquals(List.of(1L, 2L), src.uids("INBOX"));
        assertFalse(ledger.isTransferred("INBOX", "1"));
        assertEquals(4, src.logins);
        assertTrue(connector.allClosed());
    }

    @Test
    void fetchRecoversAfterReconnect() throws InterruptedException {
        src.addMessages("INBOX", 2);
        src.abortNext("fetch", 1);

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(2, result.getTransferred());
        assertEquals(0, result.getSkippedBatches());
        assertEquals(2, src.logins);
        assertEquals(2, src.count("select INBOX"));
    }

    @Test
    void moveFailureIsNotRecorded() throws InterruptedException {
        src.addMessages("INBOX", 3);
        src.failMoveOf(2);

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(1, result.getFailed());
        assertEquals(2, result.getTransferred());
        assertFalse(ledger.isTransferred("INBOX", "2"));
        assertEquals(1, dst.count("append INBOX 2"));
        assertEquals(List.of(2L), src.uids("INBOX"));
    }

    @Test
    void archiveCreationFailureIsNotFatal() throws InterruptedException {
        src.addMessages("INBOX", 2);
        src.uncreatable("Migrated/INBOX");

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(MailboxStatus.COMPLETED, result.getStatus());
        assertEquals(2, result.getFailed());
        assertEquals(0L, ledger.count());
        assertEquals(List.of(1L, 2L), src.uids("INBOX"));
    }

    @Test
    void recordsMessageIdAndDestinationUid() throws InterruptedException {
        dst.addMessage("INBOX", "Existing");
        src.addMessages("INBOX", 1);

        migrate("INBOX", "INBOX");

        TransferRecord record = ledger.find("INBOX", "1").orElseThrow();
        assertEquals("<1.Message-1@example.com>", record.getMessageId().orElseThrow());
        assertEquals("2", record.getDestinationMessageKey().orElseThrow());
        assertEquals("INBOX", record.getDestinationMailbox().orElseThrow());
        assertEquals(1, ledger.findByMessageId("<1.Message-1@example.com>").size());
    }

    @Test
    void destinationUidAbsentWithoutUidPlus() throws InterruptedException {
        dst.withoutUidPlus();
        src.addMessages("INBOX", 1);

        migrate("INBOX", "INBOX");

        assertTrue(ledger.find("INBOX", "1").orElseThrow().getDestinationMessageKey().isEmpty());
    }

    @Test
    void expungedMessageIsMissing() throws InterruptedException {
        src.addMessages("INBOX", 3);
        src.expungeOnFetch(2);

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(1, result.getMissing());
        assertEquals(2, result.getTransferred());
        assertFalse(ledger.isTransferred("INBOX", "2"));
    }

    @Test
    void searchExhaustionAborts() throws InterruptedException {
        src.addMessages("INBOX", 2);
        src.abortNext("search", 5);

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(MailboxStatus.ABORTED, result.getStatus());
        assertEquals(5, src.count("search"));
        assertEquals(0, src.count("fetch"));
        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(15), Duration.ofSeconds(20)),
                sleeper.sleeps);
        assertTrue(connector.allClosed());
    }

    @Test
    void searchRecovers() throws InterruptedException {
        src.addMessages("INBOX", 1);
        src.abortNext("search", 2);

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(MailboxStatus.COMPLETED, result.getStatus());
        assertEquals(1, result.getTransferred());
    }

    @Test
    void sourceSelectFailureAborts() throws InterruptedException {
        src.addMessages("INBOX", 1);
        src.unselectable("INBOX");

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(MailboxStatus.ABORTED, result.getStatus());
        assertEquals(0, src.count("search"));
        assertTrue(connector.allClosed());
    }

    @Test
    void reconnectFailureAborts() throws InterruptedException {
        src.addMessages("INBOX", 3);
        src.abortNext("fetch", 1).failLoginsAfter(1);

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(MailboxStatus.ABORTED, result.getStatus());
        assertTrue(result.getReason().contains("Login refused"));
        assertEquals(0, dst.count("append"));
        assertTrue(connector.allClosed());
    }

    @Test
    void initialConnectionFailureAborts() throws InterruptedException {
        src.addMessages("INBOX", 1);
        dst.failLogins(1);

        MailboxResult result = migrate("INBOX", "INBOX");

        assertEquals(MailboxStatus.ABORTED, result.getStatus());
        assertEquals(List.of(1L), src.uids("INBOX"));
        assertTrue(connector.allClosed());
    }

    @Test
    void ledgerFailureAborts() throws InterruptedException {
        src.addMessages("INBOX", 2);
        TransferLedger failing = mock(TransferLedger.class);
        when(failing.isTransferred(anyString(), anyString())).thenThrow(new LedgerException("disk I/O error"));

        MailboxResult result = pipeline(failing, sleeper, ProgressListener.NONE).migrate(SOURCE, DESTINATION, "INBOX", "INBOX");

        assertEquals(MailboxStatus.ABORTED, result.getStatus());
        assertEquals(0, dst.count("append"));
        verify(failing, never()).recordTransfer(org.mockito.ArgumentMatchers.any());
        assertTrue(connector.allClosed());
    }

    @Test
    void emptyMailbox() throws InterruptedException {
        src.addMailbox("Empty");

        MailboxResult result = migrate("Empty", "Empty");

        assertEquals(MailboxStatus.COMPLETED, result.getStatus());
        assertEquals(0, result.getTotal());
        assertEquals(0, src.count("fetch"));
        assertTrue(sleeper.sleeps.isEmpty());
    }

    @Test
    void progressAndBatchDelay() throws InterruptedException {
        src.addMessages("INBOX", 3);
        List<String> events = new ArrayList<>();
        List<String> contexts = new ArrayList<>();
        ProgressListener listener = (mailbox, batchIndex, batchCount, processed, total) -> {
            events.add(mailbox + " " + batchIndex + "/" + batchCount + " " + processed + "/" + total);
            contexts.add(ThreadContext.get(BatchTransferPipeline.CONTEXT_MAILBOX));
        };

        pipeline(ledger, sleeper, listener).migrate(SOURCE, DESTINATION, "INBOX", "INBOX");

        assertEquals(List.of("INBOX 1/2 2/3", "INBOX 2/2 3/3"), events);
        assertEquals(List.of("INBOX", "INBOX"), contexts);
        assertNull(ThreadContext.get(BatchTransferPipeline.CONTEXT_MAILBOX));
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(2)), sleeper.sleeps);
    }
}
