package com.mimecast.shuttle.config;

import com.mimecast.shuttle.migrate.MigrationOptions;

import javax.naming.ConfigurationException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * Migration run configuration.
 *
 * <p>This class provides type safe access to the run configuration file (JSON or YAML).
 * <p>Example YAML:
 * <pre>
 * source:
 *   host: imap.old.example.com
 *   user: tony
 *   pass: secret
 * destination:
 *   host: imap.new.example.com
 *   user: tony
 *   pass: secret
 *   port: 993
 *   ssl: true
 * database:
 *   path: shuttle.db
 * migration:
 *   batchSize: 50
 *   batchDelaySeconds: 2
 *   archivePrefix: "Migrated/"
 * </pre>
 *
 * @see EndpointConfig
 * @see MigrationOptions
 */
public class MigrationConfig extends ConfigFoundation {

    /**
     * Constructs a new MigrationConfig instance from a configuration map.
     *
     * @param map Configuration map.
     */
    public MigrationConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new MigrationConfig instance from a file.
     *
     * @param path File path.
     * @throws ConfigurationException Unable to read or parse file.
     */
    public MigrationConfig(Path path) throws ConfigurationException {
        super(path);
    }

    /**
     * Gets source endpoint.
     *
     * @return EndpointConfig instance.
     * @throws ConfigurationException Source host missing.
     */
    public EndpointConfig getSource() throws ConfigurationException {
        return new EndpointConfig(getMapProperty("source")).validate("source");
    }

    /**
     * Gets destination endpoint.
     *
     * @return EndpointConfig instance.
     * @throws ConfigurationException Destination host missing.
     */
    public EndpointConfig getDestination() throws ConfigurationException {
        return new EndpointConfig(getMapProperty("destination")).validate("destination");
    }

    /**
     * Gets ledger database file path.
     *
     * @return Path instance.
     */
    public Path getDatabasePath() {
        return Paths.get(getStringProperty("database.path", "shuttle.db"));
    }

    /**
     * Builds migration options from the <i>migration</i> section.
     *
     * @param dryRun Dry run flag from the command line.
     * @return MigrationOptions instance.
     * @throws ConfigurationException Non-numeric or out of range value.
     */
    public MigrationOptions getMigrationOptions(boolean dryRun) throws ConfigurationException {
        return new MigrationOptions()
                .setBatchSize(getIntProperty("migration.batchSize", MigrationOptions.DEFAULT_BATCH_SIZE, 1, Integer.MAX_VALUE))
                .setBatchDelay(Duration.ofSeconds(getIntProperty("migration.batchDelaySeconds", 2, 0, Integer.MAX_VALUE)))
                .setArchivePrefix(getStringProperty("migration.archivePrefix", MigrationOptions.DEFAULT_ARCHIVE_PREFIX))
                .setReconnectDelay(Duration.ofSeconds(getIntProperty("migration.reconnectDelaySeconds", 3, 0, Integer.MAX_VALUE)))
                .setSearchMaxAttempts(getIntProperty("migration.search.maxAttempts", 5, 1, Integer.MAX_VALUE))
                .setSearchBaseDelay(Duration.ofSeconds(getIntProperty("migration.search.baseDelaySeconds", 5, 0, Integer.MAX_VALUE)))
                .setTransferAttempts(getIntProperty("migration.transferAttempts", 3, 1, Integer.MAX_VALUE))
                .setDryRun(dryRun);
    }
}
