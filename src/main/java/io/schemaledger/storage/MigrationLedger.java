package io.schemaledger.storage;

import io.schemaledger.error.ErrorClassifier;
import io.schemaledger.error.LedgerInitializationException;
import io.schemaledger.error.MigrationException;
import io.schemaledger.model.MigrationRecord;
import io.schemaledger.model.MigrationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable record of applied migrations. Rows are never deleted; a rollback flips the row to
 * {@code rolled_back} and keeps it as history. Only {@code applied} and {@code failed} rows count as
 * live, and a name may have at most one live row.
 */
public final class MigrationLedger {
    private static final Logger log = LoggerFactory.getLogger(MigrationLedger.class);
    private static final String COLUMNS = "id,name,batch,migration_time,seq,status";

    private final ExecutionClient client;
    private final String table;

    public MigrationLedger(ExecutionClient client, String table) {
        this.client = client;
        this.table = table;
    }

    public void initialize() {
        try {
            if (exists()) {
                return;
            }
        } catch (MigrationException e) {
            throw new LedgerInitializationException("Failed to probe ledger table " + table, e);
        }
        log.info("Creating ledger table {}", table);
        try {
            client.executeWithRetry(c -> {
                client.execSql(c, createTableSql());
                return null;
            });
        } catch (MigrationException e) {
            throw new LedgerInitializationException("Failed to create ledger table " + table, e);
        }
    }

    /**
     * Probes the ledger table with a one-row read. A "relation does not exist" error means absent; any
     * other failure propagates.
     */
    public boolean exists() {
        return client.executeWithRetry(c -> {
            try (Statement st = c.createStatement();
                 ResultSet ignored = st.executeQuery("SELECT id FROM " + table + " LIMIT 1")) {
                return true;
            } catch (SQLException e) {
                if (ErrorClassifier.isMissingRelation(e)) {
                    return false;
                }
                throw e;
            }
        });
    }

    public List<MigrationRecord> getApplied() {
        return query("SELECT " + COLUMNS + " FROM " + table + " ORDER BY migration_time ASC, seq ASC");
    }

    public int getLatestBatch() {
        return client.executeWithRetry(c -> maxBatch(c, "SELECT COALESCE(MAX(batch),0) FROM " + table));
    }

    /** Highest batch that still has {@code applied} rows, or 0. */
    public int getLatestAppliedBatch() {
        return client.executeWithRetry(c -> maxBatch(c,
                "SELECT COALESCE(MAX(batch),0) FROM " + table + " WHERE status='" + MigrationStatus.APPLIED.dbValue() + "'"));
    }

    /** Distinct batches that still have {@code applied} rows, highest first. */
    public List<Integer> getAppliedBatches() {
        return client.executeWithRetry(c -> {
            List<Integer> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT DISTINCT batch FROM " + table + " WHERE status=? ORDER BY batch DESC")) {
                ps.setString(1, MigrationStatus.APPLIED.dbValue());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(rs.getInt(1));
                    }
                }
            }
            return out;
        });
    }

    /** Rows of one batch with the given status, most recently inserted first. */
    public List<MigrationRecord> findByBatch(int batch, MigrationStatus status) {
        return client.executeWithRetry(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM " + table
                            + " WHERE batch=? AND status=? ORDER BY migration_time DESC, seq DESC")) {
                ps.setInt(1, batch);
                ps.setString(2, status.dbValue());
                return readRows(ps);
            }
        });
    }

    public Optional<MigrationRecord> findById(String id) {
        return client.executeWithRetry(c -> findById(c, id));
    }

    /** Names holding a live ({@code applied} or {@code failed}) row. */
    public Set<String> liveNames() {
        Set<String> out = new LinkedHashSet<>();
        for (MigrationRecord row : getApplied()) {
            if (row.status() != MigrationStatus.ROLLED_BACK) {
                out.add(row.name());
            }
        }
        return out;
    }

    public String insert(String name, int batch, MigrationStatus status) {
        return client.executeWithRetry(c -> insert(c, name, batch, status));
    }

    /** Inserts on the caller's connection so the row commits or rolls back with the caller's transaction. */
    public String insert(Connection c, String name, int batch, MigrationStatus status) throws SQLException {
        if (status != MigrationStatus.APPLIED && status != MigrationStatus.FAILED) {
            throw new IllegalArgumentException("new ledger rows must be applied or failed, got " + status);
        }
        String id = "mig_" + UUID.randomUUID();
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO " + table + "(" + COLUMNS + ")"
                        + " SELECT CAST(? AS TEXT),CAST(? AS TEXT),CAST(? AS INTEGER),CAST(? AS BIGINT),"
                        + "COALESCE(MAX(seq),0)+1,CAST(? AS TEXT) FROM " + table)) {
            ps.setString(1, id);
            ps.setString(2, name);
            ps.setInt(3, batch);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.setString(5, status.dbValue());
            ps.executeUpdate();
        }
        return id;
    }

    public void updateStatus(String id, MigrationStatus next) {
        client.executeWithRetry(c -> {
            updateStatus(c, id, next);
            return null;
        });
    }

    public void updateStatus(Connection c, String id, MigrationStatus next) throws SQLException {
        MigrationRecord current = findById(c, id)
                .orElseThrow(() -> new IllegalStateException("ledger row not found: " + id));
        if (!current.status().canTransitionTo(next)) {
            throw new IllegalStateException(
                    "invalid ledger transition for " + current.name() + ": " + current.status() + " -> " + next);
        }
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE " + table + " SET status=? WHERE id=? AND status=?")) {
            ps.setString(1, next.dbValue());
            ps.setString(2, id);
            ps.setString(3, current.status().dbValue());
            if (ps.executeUpdate() != 1) {
                throw new IllegalStateException("ledger row changed concurrently: " + id);
            }
        }
    }

    String createTableSql() {
        String prefix = table.replace('.', '_');
        return """
                CREATE TABLE IF NOT EXISTS %1$s (
                    id TEXT PRIMARY KEY,
                    name TEXT NOT NULL,
                    batch INTEGER NOT NULL,
                    migration_time BIGINT NOT NULL,
                    seq BIGINT NOT NULL,
                    status TEXT NOT NULL CHECK (status IN ('applied','failed','rolled_back'))
                );
                CREATE UNIQUE INDEX IF NOT EXISTS %2$s_name_live_idx ON %1$s(name) WHERE status <> 'rolled_back';
                CREATE INDEX IF NOT EXISTS %2$s_batch_idx ON %1$s(batch);
                """.formatted(table, prefix);
    }

    private List<MigrationRecord> query(String sql) {
        return client.executeWithRetry(c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                return readRows(ps);
            }
        });
    }

    private Optional<MigrationRecord> findById(Connection c, String id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM " + table + " WHERE id=?")) {
            ps.setString(1, id);
            List<MigrationRecord> rows = readRows(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    private static int maxBatch(Connection c, String sql) throws SQLException {
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static List<MigrationRecord> readRows(PreparedStatement ps) throws SQLException {
        List<MigrationRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new MigrationRecord(
                        rs.getString("id"),
                        rs.getString("name"),
                        rs.getInt("batch"),
                        rs.getLong("migration_time"),
                        rs.getLong("seq"),
                        MigrationStatus.fromDbValue(rs.getString("status"))
                ));
            }
        }
        return out;
    }
}
