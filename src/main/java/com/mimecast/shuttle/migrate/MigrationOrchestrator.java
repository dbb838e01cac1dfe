package com.mimecast.shuttle.migrate;

import com.mimecast.shuttle.config.EndpointConfig;
import com.mimecast.shuttle.config.ExcludeList;
import com.mimecast.shuttle.config.MailboxMapping;
import com.mimecast.shuttle.imap.ImapException;
import com.mimecast.shuttle.imap.ImapSession;
import com.mimecast.shuttle.imap.SessionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Runs the pipeline for every source mailbox, one at a time.
 *
 * <p>Excluded mailboxes and the archive namespace are never migrated.
 * <br>Destination names come from the mapping, identical names otherwise.
 * <br>A failing mailbox never prevents the next one from being attempted.
 */
public class MigrationOrchestrator {
    private static final Logger log = LogManager.getLogger(MigrationOrchestrator.class);

    private final SessionManager sessionManager;
    private final BatchTransferPipeline pipeline;
    private final MailboxMapping mapping;
    private final ExcludeList excludeList;

    /**
     * Constructs a new MigrationOrchestrator instance.
     *
     * @param sessionManager SessionManager instance.
     * @param pipeline       BatchTransferPipeline instance.
     * @param mapping        MailboxMapping instance.
     * @param excludeList    ExcludeList instance.
     */
    public MigrationOrchestrator(SessionManager sessionManager, BatchTransferPipeline pipeline,
                                 MailboxMapping mapping, ExcludeList excludeList) {
        this.sessionManager = sessionManager;
        this.pipeline = pipeline;
        this.mapping = mapping;
        this.excludeList = excludeList;
    }

    /**
     * Lists source mailboxes and migrates them.
     *
     * @param source      Source endpoint.
     * @param destination Destination endpoint.
     * @return MigrationSummary instance.
     * @throws ImapException        Unable to connect or list mailboxes at the source.
     * @throws InterruptedException Interrupted while waiting.
     */
    public MigrationSummary run(EndpointConfig source, EndpointConfig destination) throws ImapException, InterruptedException {
        List<String> mailboxes;
        ImapSession session = sessionManager.open(source);
        try {
            mailboxes = sessionManager.listMailboxes(session);
        } finally {
            sessionManager.close(session);
        }

        log.info("Source has {} mailboxes", mailboxes.size());
        return migrate(mailboxes, source, destination);
    }

    /**
     * Migrates given mailboxes in order.
     *
     * @param mailboxes   Source mailbox names.
     * @param source      Source endpoint.
     * @param destination Destination endpoint.
     * @return MigrationSummary instance.
     * @throws InterruptedException Interrupted while waiting.
     */
    public MigrationSummary migrate(List<String> mailboxes, EndpointConfig source, EndpointConfig destination) throws InterruptedException {
        MigrationSummary summary = new MigrationSummary();
        String archivePrefix = pipeline.getOptions().getArchivePrefix();

        for (String mailbox : mailboxes) {
            if (excludeList.contains(mailbox)) {
                log.info("Skipping excluded mailbox: {}", mailbox);
                summary.addExcluded(mailbox);
                continue;
            }
            if (!archivePrefix.isEmpty() && mailbox.startsWith(archivePrefix)) {
                log.info("Skipping archive mailbox: {}", mailbox);
                summary.addExcluded(mailbox);
                continue;
            }

            String target = mapping.resolve(mailbox);
            try {
                summary.add(pipeline.migrate(source, destination, mailbox, target));
            } catch (RuntimeException e) {
                log.error("Unexpected failure migrating {}: {}", mailbox, e.getMessage(), e);
                summary.add(new MailboxResult(mailbox, target).abort(String.valueOf(e.getMessage())));
            }
        }

        log.info("Migration finished: {}", summary);
        return summary;
    }
}
