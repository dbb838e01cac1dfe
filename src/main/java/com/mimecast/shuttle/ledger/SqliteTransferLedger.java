package com.mimecast.shuttle.ledger;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite transfer ledger.
 * <p>Single file embedded database with write-ahead logging and full synchronous commits,
 * <br>so a record is on disk before {@link #recordTransfer(TransferRecord)} returns.
 *
 * <p>Schema:
 * <ul>
 *   <li><b>transfers</b> - one row per (src_mailbox, src_uid), replaced on collision</li>
 *   <li><b>idx_transfers_message_id</b> - secondary lookup by Message-ID</li>
 * </ul>
 *
 * <p>Connections come from a single connection HikariCP pool; the ledger has one writer.
 */
public class SqliteTransferLedger implements TransferLedger {
    private static final Logger log = LogManager.getLogger(SqliteTransferLedger.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS transfers (
                id INTEGER PRIMARY KEY,
                src_mailbox TEXT NOT NULL,
                src_uid TEXT NOT NULL,
                dst_mailbox TEXT,
                dst_uid TEXT,
                message_id TEXT,
                transferred_at_ms INTEGER NOT NULL,
                UNIQUE(src_mailbox, src_uid)
            )
            """;

    private static final String CREATE_INDEX_SQL =
            "CREATE INDEX IF NOT EXISTS idx_transfers_message_id ON transfers(message_id)";

    private static final String SELECT_COLUMNS =
            "SELECT src_mailbox, src_uid, dst_mailbox, dst_uid, message_id, transferred_at_ms FROM transfers";

    private final Path file;
    private HikariDataSource dataSource;

    /**
     * Constructs a new SqliteTransferLedger instance.
     *
     * @param file Database file path.
     */
    public SqliteTransferLedger(Path file) {
        this.file = file;
    }

    /**
     * Open the pool, create the schema if missing and validate durability pragmas.
     */
    @Override
    public void initialize() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new LedgerException("Failed to create ledger directory for " + file, e);
        }

        if (dataSource == null) {
            HikariConfig cfg = new HikariConfig();
            cfg.setJdbcUrl("jdbc:sqlite:" + file.toAbsolutePath());
            cfg.setMaximumPoolSize(1);
            cfg.setPoolName("ShuttleLedgerPool");
            cfg.addDataSourceProperty("journal_mode", "WAL");
            cfg.addDataSourceProperty("synchronous", "FULL");
            cfg.addDataSourceProperty("busy_timeout", "5000");
            dataSource = new HikariDataSource(cfg);
        }

        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute(CREATE_TABLE_SQL);
            st.execute(CREATE_INDEX_SQL);

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "2");
            log.info("Transfer ledger initialized: file={}, records={}", file, countWith(st));
        } catch (SQLException | IllegalStateException e) {
            close();
            log.error("Failed to initialize transfer ledger {}: {}", file, e.getMessage(), e);
            throw new LedgerException("Failed to initialize transfer ledger " + file, e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException("PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual);
            }
        }
    }

    @Override
    public boolean isTransferred(String sourceMailbox, String sourceMessageKey) {
        String sql = "SELECT 1 FROM transfers WHERE src_mailbox = ? AND src_uid = ? LIMIT 1";

        try (Connection conn = connection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, sourceMailbox);
            ps.setString(2, sourceMessageKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.error("Failed to query ledger for {}/{}: {}", sourceMailbox, sourceMessageKey, e.getMessage(), e);
            throw new LedgerException("Failed to query ledger", e);
        }
    }

    @Override
    public void recordTransfer(TransferRecord record) {
        String sql = "INSERT OR REPLACE INTO transfers "
                + "(src_mailbox, src_uid, dst_mailbox, dst_uid, message_id, transferred_at_ms) VALUES (?, ?, ?, ?, ?, ?)";

        try (Connection conn = connection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, record.getSourceMailbox());
            ps.setString(2, record.getSourceMessageKey());
            setNullable(ps, 3, record.getDestinationMailbox().orElse(null));
            setNullable(ps, 4, record.getDestinationMessageKey().orElse(null));
            setNullable(ps, 5, record.getMessageId().orElse(null));
            ps.setLong(6, record.getTransferredAt().toEpochMilli());
            ps.executeUpdate();
            log.debug("Recorded transfer {}/{}", record.getSourceMailbox(), record.getSourceMessageKey());
        } catch (SQLException e) {
            log.error("Failed to record transfer {}/{}: {}", record.getSourceMailbox(), record.getSourceMessageKey(), e.getMessage(), e);
            throw new LedgerException("Failed to record transfer", e);
        }
    }

    @Override
    public Optional<TransferRecord> find(String sourceMailbox, String sourceMessageKey) {
        String sql = SELECT_COLUMNS + " WHERE src_mailbox = ? AND src_uid = ?";

        try (Connection conn = connection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, sourceMailbox);
            ps.setString(2, sourceMessageKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            log.error("Failed to find transfer {}/{}: {}", sourceMailbox, sourceMessageKey, e.getMessage(), e);
            throw new LedgerException("Failed to find transfer", e);
        }
    }

    @Override
    public List<TransferRecord> findByMessageId(String messageId) {
        String sql = SELECT_COLUMNS + " WHERE message_id = ? ORDER BY id";
        List<TransferRecord> records = new ArrayList<>();

        try (Connection conn = connection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(read(rs));
                }
            }
            return records;
        } catch (SQLException e) {
            log.error("Failed to find transfers by Message-ID {}: {}", messageId, e.getMessage(), e);
            throw new LedgerException("Failed to find transfers by Message-ID", e);
        }
    }

    @Override
    public long count() {
        try (Connection conn = connection(); Statement st = conn.createStatement()) {
            return countWith(st);
        } catch (SQLException e) {
            log.error("Failed to count ledger records: {}", e.getMessage(), e);
            throw new LedgerException("Failed to count ledger records", e);
        }
    }

    private long countWith(Statement st) throws SQLException {
        try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM transfers")) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    @Override
    public void close() {
        if (dataSource != null) {
            dataSource.close();
            dataSource = null;
            log.debug("Transfer ledger closed: {}", file);
        }
    }

    private Connection connection() throws SQLException {
        if (dataSource == null) {
            throw new LedgerException("Transfer ledger not initialized: " + file);
        }
        return dataSource.getConnection();
    }

    private static void setNullable(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    private static TransferRecord read(ResultSet rs) throws SQLException {
        return new TransferRecord(
                rs.getString("src_mailbox"),
                rs.getString("src_uid"),
                rs.getString("dst_mailbox"),
                rs.getString("dst_uid"),
                rs.getString("message_id"),
                Instant.ofEpochMilli(rs.getLong("transferred_at_ms"))
        );
    }
}
