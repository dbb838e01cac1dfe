package com.mimecast.shuttle.main;

import com.mimecast.shuttle.config.EndpointConfig;
import com.mimecast.shuttle.config.ExcludeList;
import com.mimecast.shuttle.config.MailboxMapping;
import com.mimecast.shuttle.config.MigrationConfig;
import com.mimecast.shuttle.imap.ImapConnector;
import com.mimecast.shuttle.imap.ImapException;
import com.mimecast.shuttle.imap.SessionManager;
import com.mimecast.shuttle.ledger.SqliteTransferLedger;
import com.mimecast.shuttle.ledger.TransferLedger;
import com.mimecast.shuttle.migrate.BatchTransferPipeline;
import com.mimecast.shuttle.migrate.LoggingProgressListener;
import com.mimecast.shuttle.migrate.MigrationOptions;
import com.mimecast.shuttle.migrate.MigrationOrchestrator;
import com.mimecast.shuttle.migrate.MigrationSummary;
import com.mimecast.shuttle.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;

/**
 * Wires a migration run from its configuration.
 *
 * <p>Owns the ledger for the duration of the run and closes it afterward.
 */
public class Migrator {
    private static final Logger log = LogManager.getLogger(Migrator.class);

    private final MigrationConfig config;
    private final MailboxMapping mapping;
    private final ExcludeList excludeList;
    private final ImapConnector connector;
    private final Sleeper sleeper;

    /**
     * Constructs a new Migrator instance.
     *
     * @param config      MigrationConfig instance.
     * @param mapping     MailboxMapping instance.
     * @param excludeList ExcludeList instance.
     * @param connector   ImapConnector instance.
     * @param sleeper     Sleeper instance.
     */
    public Migrator(MigrationConfig config, MailboxMapping mapping, ExcludeList excludeList,
                    ImapConnector connector, Sleeper sleeper) {
        this.config = config;
        this.mapping = mapping;
        this.excludeList = excludeList;
        this.connector = connector;
        this.sleeper = sleeper;
    }

    /**
     * Runs the migration with a SQLite ledger at the configured path.
     *
     * @param dryRun Dry run flag.
     * @return MigrationSummary instance.
     * @throws ConfigurationException Invalid endpoint or migration options.
     * @throws ImapException          Unable to list source mailboxes.
     * @throws InterruptedException   Interrupted while waiting.
     */
    public MigrationSummary run(boolean dryRun) throws ConfigurationException, ImapException, InterruptedException {
        EndpointConfig source = config.getSource();
        EndpointConfig destination = config.getDestination();
        MigrationOptions options = config.getMigrationOptions(dryRun);

        try (TransferLedger ledger = new SqliteTransferLedger(config.getDatabasePath())) {
            ledger.initialize();
            return run(ledger, source, destination, options);
        }
    }

    /**
     * Runs the migration with the given ledger.
     *
     * @param ledger      TransferLedger instance, initialized.
     * @param source      Source endpoint.
     * @param destination Destination endpoint.
     * @param options     Migration options.
     * @return MigrationSummary instance.
     * @throws ImapException        Unable to list source mailboxes.
     * @throws InterruptedException Interrupted while waiting.
     */
    MigrationSummary run(TransferLedger ledger, EndpointConfig source, EndpointConfig destination,
                         MigrationOptions options) throws ImapException, InterruptedException {
        log.info("Source: {} Destination: {}", source, destination);
        log.debug("Options: {}", options);
        if (!excludeList.isEmpty()) {
            log.info("Excluding mailboxes: {}", excludeList.getNames());
        }

        SessionManager sessionManager = new SessionManager(connector, options.getReconnectDelay(), sleeper);
        BatchTransferPipeline pipeline = new BatchTransferPipeline(sessionManager, ledger, options, sleeper,
                new LoggingProgressListener());

        return new MigrationOrchestrator(sessionManager, pipeline, mapping, excludeList).run(source, destination);
    }
}
