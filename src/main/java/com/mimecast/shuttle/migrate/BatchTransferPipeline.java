package com.mimecast.shuttle.migrate;

import com.google.common.collect.Lists;
import com.mimecast.shuttle.config.EndpointConfig;
import com.mimecast.shuttle.imap.FetchedMessage;
import com.mimecast.shuttle.imap.ImapConnectionException;
import com.mimecast.shuttle.imap.ImapException;
import com.mimecast.shuttle.imap.ImapSession;
import com.mimecast.shuttle.imap.SessionAbortedException;
import com.mimecast.shuttle.imap.SessionManager;
import com.mimecast.shuttle.ledger.LedgerException;
import com.mimecast.shuttle.ledger.TransferLedger;
import com.mimecast.shuttle.ledger.TransferRecord;
import com.mimecast.shuttle.mime.MessageIds;
import com.mimecast.shuttle.retry.RetryPolicy;
import com.mimecast.shuttle.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Migrates one source mailbox to one destination mailbox.
 *
 * <p>Steps:
 * <ol>
 *     <li>Open both sessions and select (or create) the destination mailbox. Skip the mailbox if that fails.</li>
 *     <li>Create the archive mailbox at the source, failure is only logged.</li>
 *     <li>Select the source mailbox and search all UIDs.</li>
 *     <li>Fetch batch by batch, then for each message in search order:
 *     skip if already in the ledger, append to destination, move to archive, record in the ledger.</li>
 * </ol>
 *
 * <p>The ledger write is the commit point of a message.
 * <br>A message is moved only after a successful append and recorded only after a successful move.
 * <br>Any interruption therefore leaves the message eligible for the next run.
 *
 * <p>Dry run performs the read-only steps only and counts what would transfer.
 *
 * <p>Both sessions are always logged out before returning.
 */
public class BatchTransferPipeline {
    private static final Logger log = LogManager.getLogger(BatchTransferPipeline.class);

    /**
     * Logging context key holding the source mailbox name.
     */
    public static final String CONTEXT_MAILBOX = "mailbox";

    private final SessionManager sessionManager;
    private final TransferLedger ledger;
    private final MigrationOptions options;
    private final Sleeper sleeper;
    private final ProgressListener listener;
    private final RetryPolicy searchPolicy;
    private final RetryPolicy transferPolicy;

    /**
     * Constructs a new BatchTransferPipeline instance.
     *
     * @param sessionManager SessionManager instance.
     * @param ledger         TransferLedger instance, already initialized.
     * @param options        MigrationOptions instance.
     * @param sleeper        Sleeper instance.
     * @param listener       ProgressListener instance.
     */
    public BatchTransferPipeline(SessionManager sessionManager, TransferLedger ledger, MigrationOptions options,
                                 Sleeper sleeper, ProgressListener listener) {
        this.sessionManager = sessionManager;
        this.ledger = ledger;
        this.options = options;
        this.sleeper = sleeper;
        this.listener = listener != null ? listener : ProgressListener.NONE;
        this.searchPolicy = new RetryPolicy(options.getSearchMaxAttempts(), options.getSearchBaseDelay(), sleeper);
        this.transferPolicy = new RetryPolicy(options.getTransferAttempts(), Duration.ZERO, sleeper);
    }

    public MigrationOptions getOptions() {
        return options;
    }

    /**
     * Migrates a mailbox.
     * <p>Failures are reported in the result, never thrown.
     *
     * @param source             Source endpoint.
     * @param destination        Destination endpoint.
     * @param sourceMailbox      Source mailbox name.
     * @param destinationMailbox Destination mailbox name.
     * @return MailboxResult instance.
     * @throws InterruptedException Interrupted while waiting.
     */
    public MailboxResult migrate(EndpointConfig source, EndpointConfig destination,
                                 String sourceMailbox, String destinationMailbox) throws InterruptedException {
        ThreadContext.put(CONTEXT_MAILBOX, sourceMailbox);
        Run run = new Run(source, destination, sourceMailbox, destinationMailbox);
        try {
            log.info("Migrating {} to {}{}", sourceMailbox, destinationMailbox, options.isDryRun() ? " (dry run)" : "");
            run.execute();
        } catch (ImapException e) {
            log.error("Aborting mailbox {}: {}", sourceMailbox, e.getMessage());
            run.result.abort(e.getMessage());
        } catch (LedgerException e) {
            log.error("Aborting mailbox {} on ledger failure: {}", sourceMailbox, e.getMessage(), e);
            run.result.abort(e.getMessage());
        } finally {
            run.close();
            log.info("Finished {}", run.result);
            ThreadContext.remove(CONTEXT_MAILBOX);
        }
        return run.result;
    }

    /**
     * State of one mailbox migration.
     * <p>Holds the live sessions, replaced on reconnect.
     */
    private class Run {
        private final EndpointConfig sourceEndpoint;
        private final EndpointConfig destinationEndpoint;
        private final String sourceMailbox;
        private final String destinationMailbox;
        private final String archiveMailbox;
        private final MailboxResult result;

        private ImapSession source;
        private ImapSession destination;

        Run(EndpointConfig sourceEndpoint, EndpointConfig destinationEndpoint, String sourceMailbox, String destinationMailbox) {
            this.sourceEndpoint = sourceEndpoint;
            this.destinationEndpoint = destinationEndpoint;
            this.sourceMailbox = sourceMailbox;
            this.destinationMailbox = destinationMailbox;
            this.archiveMailbox = options.getArchiveMailbox(sourceMailbox);
            this.result = new MailboxResult(sourceMailbox, destinationMailbox);
        }

        void execute() throws ImapException, InterruptedException {
            source = sessionManager.open(sourceEndpoint);
            destination = sessionManager.open(destinationEndpoint);

            if (!prepareDestination()) {
                result.skip("Destination mailbox " + destinationMailbox + " unavailable");
                return;
            }

            if (!options.isDryRun()) {
                ensureArchive();
            }

            source.select(sourceMailbox);

            List<Long> uids = searchPolicy.execute("Search " + sourceMailbox, () -> source.searchAll());
            result.setTotal(uids.size());
            log.info("Found {} messages in {}", uids.size(), sourceMailbox);

            List<List<Long>> batches = uids.isEmpty() ? Collections.emptyList() : Lists.partition(uids, options.getBatchSize());
            for (int i = 0; i < batches.size(); i++) {
                processBatch(batches.get(i), i + 1, batches.size());
                listener.onBatch(sourceMailbox, i + 1, batches.size(), result.getProcessed(), result.getTotal());
                sleeper.sleep(options.getBatchDelay());
            }
        }

        /**
         * Selects or creates the destination mailbox.
         * <p>Dry run never creates it.
         */
        private boolean prepareDestination() {
            if (options.isDryRun()) {
                if (!sessionManager.trySelect(destination, destinationMailbox)) {
                    log.info("Destination mailbox {} would be created", destinationMailbox);
                }
                return true;
            }
            return sessionManager.ensureMailboxSelected(destination, destinationMailbox);
        }

        private boolean ensureArchive() {
            try {
                source.create(archiveMailbox);
                return true;
            } catch (ImapException e) {
                log.warn("Could not create archive mailbox {}: {}", archiveMailbox, e.getMessage());
                return false;
            }
        }

        private void processBatch(List<Long> batch, int index, int count) throws ImapException, InterruptedException {
            log.debug("Fetching batch {}/{} of {} messages", index, count, batch.size());

            Map<Long, FetchedMessage> fetched;
            try {
                fetched = transferPolicy.execute("Fetch batch " + index, () -> source.fetch(batch), this::reconnectSource);
            } catch (ImapConnectionException e) {
                throw e;
            } catch (ImapException e) {
                log.error("Skipping batch {}/{} after fetch failure: {}", index, count, e.getMessage());
                result.incrementSkippedBatches();
                if (e instanceof SessionAbortedException) {
                    reconnectSource();
                }
                return;
            }

            for (Long uid : batch) {
                processMessage(uid, fetched.get(uid));
            }
        }

        private void processMessage(long uid, FetchedMessage message) throws ImapException, InterruptedException {
            String key = String.valueOf(uid);
            if (ledger.isTransferred(sourceMailbox, key)) {
                log.debug("UID {} already migrated", key);
                result.incrementAlreadyMigrated();
                return;
            }

            if (message == null) {
                log.debug("UID {} no longer present", key);
                result.incrementMissing();
                return;
            }

            Optional<String> messageId = MessageIds.extract(message.getContent());

            if (options.isDryRun()) {
                log.info("Would transfer UID {} ({} bytes) Message-ID: {}", key, message.getSize(), messageId.orElse("none"));
                result.incrementWouldTransfer();
                return;
            }

            Optional<Long> destinationUid;
            try {
                destinationUid = transferPolicy.execute("Append UID " + key,
                        () -> destination.append(destinationMailbox, message), this::reconnectDestination);
            } catch (ImapConnectionException e) {
                throw e;
            } catch (ImapException e) {
                log.error("Append of UID {} to {} failed, leaving it in source: {}", key, destinationMailbox, e.getMessage());
                result.incrementFailed();
                if (e instanceof SessionAbortedException) {
                    reconnectDestination();
                }
                return;
            }

            try {
                source.move(Collections.singletonList(uid), archiveMailbox);
            } catch (ImapConnectionException e) {
                throw e;
            } catch (ImapException e) {
                log.error("Move of UID {} to {} failed, not recording it: {}", key, archiveMailbox, e.getMessage());
                result.incrementFailed();
                if (e instanceof SessionAbortedException) {
                    reconnectSource();
                }
                return;
            }

            ledger.recordTransfer(new TransferRecord(sourceMailbox, key, destinationMailbox,
                    destinationUid.map(String::valueOf).orElse(null), messageId.orElse(null), Instant.now()));
            result.incrementTransferred();
            log.debug("Transferred UID {} as {}", key, destinationUid.map(String::valueOf).orElse("unknown"));
        }

        private void reconnectSource() throws ImapException, InterruptedException {
            source = sessionManager.reopen(source, sourceEndpoint);
            source.select(sourceMailbox);
        }

        private void reconnectDestination() throws ImapException, InterruptedException {
            destination = sessionManager.reopen(destination, destinationEndpoint);
            if (!sessionManager.ensureMailboxSelected(destination, destinationMailbox)) {
                throw new ImapException("Destination mailbox " + destinationMailbox + " unavailable after reconnect");
            }
        }

        void close() {
            sessionManager.close(source);
            sessionManager.close(destination);
            source = null;
            destination = null;
        }
    }
}
