package io.schemaledger.runner;

import io.schemaledger.error.ErrorClassifier;
import io.schemaledger.error.LogicalMigrationException;
import io.schemaledger.error.MissingMigrationException;
import io.schemaledger.error.TransientDataStoreException;
import io.schemaledger.migration.Migration;
import io.schemaledger.migration.MigrationRegistry;
import io.schemaledger.model.MigrationBatchResult;
import io.schemaledger.model.MigrationRecord;
import io.schemaledger.model.MigrationResult;
import io.schemaledger.model.MigrationStatus;
import io.schemaledger.model.MigrationStatusReport;
import io.schemaledger.observability.MigrationAuditLog;
import io.schemaledger.observability.MigrationAuditLog.AuditEvent;
import io.schemaledger.storage.ExecutionClient;
import io.schemaledger.storage.MigrationLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies and rolls back registered migrations against the ledger.
 *
 * <p>Each migration runs in its own transaction together with its ledger write. The first failure
 * halts the batch: the failing migration is recorded as {@code failed} outside the rolled-back
 * transaction, and later migrations get no ledger row, so they stay pending.
 *
 * <p>Migration failures, including connectivity retries exhausted inside a migration's unit of work,
 * are reported through {@link MigrationBatchResult} so earlier successes in the batch stay visible. A
 * unit that lost its connection gets no ledger row. Ledger bootstrap and bookkeeping failures outside
 * a unit propagate to the caller.
 *
 * <p>Instances are not thread-safe and take no lock on the ledger; run one runner per ledger.
 */
public final class MigrationRunner {
    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    private final ExecutionClient client;
    private final MigrationRegistry registry;
    private final MigrationLedger ledger;
    private final boolean useTransaction;
    private final MigrationAuditLog auditLog;

    public MigrationRunner(ExecutionClient client, MigrationRegistry registry, MigrationLedger ledger) {
        this(client, registry, ledger, true, null);
    }

    public MigrationRunner(
            ExecutionClient client,
            MigrationRegistry registry,
            MigrationLedger ledger,
            boolean useTransaction,
            MigrationAuditLog auditLog
    ) {
        this.client = client;
        this.registry = registry;
        this.ledger = ledger;
        this.useTransaction = useTransaction;
        this.auditLog = auditLog;
    }

    /** Registered migrations without a live ledger row, in registry order. */
    public List<Migration> pending() {
        Set<String> live = ledger.liveNames();
        List<Migration> out = new ArrayList<>();
        for (Migration migration : registry.getAll()) {
            if (!live.contains(migration.name())) {
                out.add(migration);
            }
        }
        return out;
    }

    public MigrationBatchResult up() {
        ledger.initialize();
        List<Migration> pending = pending();
        if (pending.isEmpty()) {
            log.info("No pending migrations to apply");
            return MigrationBatchResult.empty(ledger.getLatestBatch());
        }
        int batch = ledger.getLatestBatch() + 1;
        log.info("Applying {} pending migrations as batch {}", pending.size(), batch);

        List<MigrationResult> results = new ArrayList<>();
        int applied = 0;
        int failed = 0;
        for (Migration migration : pending) {
            log.info("Applying migration: {}", migration.name());
            try {
                runUnit(c -> {
                    migration.up(c);
                    ledger.insert(c, migration.name(), batch, MigrationStatus.APPLIED);
                });
            } catch (LogicalMigrationException e) {
                String error = ErrorClassifier.describe(e);
                log.error("Error applying migration {}: {}", migration.name(), error, e);
                ledger.insert(migration.name(), batch, MigrationStatus.FAILED);
                results.add(MigrationResult.failed(migration.name(), error));
                failed++;
                audit(AuditEvent.of("migration.apply", migration.name(), batch, "failed", error));
                break;
            } catch (TransientDataStoreException e) {
                // Outcome unknown after a lost connection, so no ledger row; the migration stays pending.
                String error = ErrorClassifier.describe(e);
                log.error("Data store unavailable while applying {}: {}", migration.name(), error, e);
                results.add(MigrationResult.failed(migration.name(), error));
                failed++;
                audit(AuditEvent.of("migration.apply", migration.name(), batch, "unavailable", error));
                break;
            }
            log.info("Migration applied successfully: {}", migration.name());
            results.add(MigrationResult.ok(migration.name(), MigrationStatus.APPLIED));
            applied++;
            audit(AuditEvent.of("migration.apply", migration.name(), batch, "applied", null));
        }
        audit(AuditEvent.of("batch.up", batch, failed == 0 ? "ok" : "halted",
                Map.of("applied", applied, "failed", failed, "pending", pending.size())));
        return new MigrationBatchResult(batch, applied, failed, results);
    }

    /** Rolls back the highest batch that still has {@code applied} rows, most recent row first. */
    public MigrationBatchResult down() {
        ledger.initialize();
        int batch = ledger.getLatestAppliedBatch();
        if (batch == 0) {
            log.info("No migrations to rollback");
            return MigrationBatchResult.empty(0);
        }
        List<MigrationRecord> rows = ledger.findByBatch(batch, MigrationStatus.APPLIED);
        log.info("Rolling back {} migrations from batch {}", rows.size(), batch);

        List<MigrationResult> results = new ArrayList<>();
        int rolledBack = 0;
        int failed = 0;
        for (MigrationRecord row : rows) {
            log.info("Rolling back migration: {}", row.name());
            try {
                Migration migration = registry.find(row.name())
                        .orElseThrow(() -> new MissingMigrationException(row.name()));
                runUnit(c -> {
                    migration.down(c);
                    ledger.updateStatus(c, row.id(), MigrationStatus.ROLLED_BACK);
                });
            } catch (MissingMigrationException e) {
                // The schema was not touched, so the row stays applied.
                log.error("Cannot roll back {}: {}", row.name(), e.getMessage());
                results.add(MigrationResult.failed(row.name(), e.getMessage()));
                failed++;
                audit(AuditEvent.of("migration.rollback", row.name(), batch, "missing", e.getMessage()));
                break;
            } catch (LogicalMigrationException e) {
                String error = ErrorClassifier.describe(e);
                log.error("Error rolling back migration {}: {}", row.name(), error, e);
                ledger.updateStatus(row.id(), MigrationStatus.FAILED);
                results.add(MigrationResult.failed(row.name(), error));
                failed++;
                audit(AuditEvent.of("migration.rollback", row.name(), batch, "failed", error));
                break;
            } catch (TransientDataStoreException e) {
                String error = ErrorClassifier.describe(e);
                log.error("Data store unavailable while rolling back {}: {}", row.name(), error, e);
                results.add(MigrationResult.failed(row.name(), error));
                failed++;
                audit(AuditEvent.of("migration.rollback", row.name(), batch, "unavailable", error));
                break;
            }
            log.info("Migration rolled back successfully: {}", row.name());
            results.add(MigrationResult.ok(row.name(), MigrationStatus.ROLLED_BACK));
            rolledBack++;
            audit(AuditEvent.of("migration.rollback", row.name(), batch, "rolled_back", null));
        }
        audit(AuditEvent.of("batch.down", batch, failed == 0 ? "ok" : "halted",
                Map.of("rolled_back", rolledBack, "failed", failed)));
        return new MigrationBatchResult(batch, rolledBack, failed, results);
    }

    /**
     * Rolls back every batch with {@code applied} rows, highest first. Stops at the first batch whose
     * rollback reports a failure; batches already rolled back stay rolled back.
     */
    public List<MigrationBatchResult> reset() {
        ledger.initialize();
        List<Integer> batches = ledger.getAppliedBatches();
        if (batches.isEmpty()) {
            log.info("No migrations to reset");
            return List.of();
        }
        log.info("Resetting {} batches of migrations", batches.size());
        List<MigrationBatchResult> results = new ArrayList<>();
        for (int ignored : batches) {
            MigrationBatchResult result = down();
            results.add(result);
            if (result.hasFailures()) {
                log.warn("Reset halted at batch {}", result.batch());
                break;
            }
        }
        return results;
    }

    /** {@link #reset()} then {@link #up()}. Not atomic; {@code up()} is skipped when the reset halted. */
    public RefreshResult refresh() {
        List<MigrationBatchResult> reset = reset();
        boolean resetFailed = reset.stream().anyMatch(MigrationBatchResult::hasFailures);
        if (resetFailed) {
            log.warn("Skipping re-apply because reset did not complete");
            return new RefreshResult(reset, null);
        }
        return new RefreshResult(reset, up());
    }

    /** Read-only view of registry and ledger; does not create the ledger table. */
    public MigrationStatusReport status() {
        List<Migration> migrations = registry.getAll();
        List<MigrationRecord> rows = ledger.exists() ? ledger.getApplied() : List.of();

        Set<String> registered = new HashSet<>();
        for (Migration migration : migrations) {
            registered.add(migration.name());
        }
        Set<String> live = new HashSet<>();
        int applied = 0;
        int failed = 0;
        int rolledBack = 0;
        List<MigrationRecord> drift = new ArrayList<>();
        for (MigrationRecord row : rows) {
            switch (row.status()) {
                case APPLIED -> applied++;
                case FAILED -> failed++;
                case ROLLED_BACK -> rolledBack++;
                default -> {
                }
            }
            if (row.status() != MigrationStatus.ROLLED_BACK) {
                live.add(row.name());
            }
            if (!registered.contains(row.name())) {
                drift.add(row);
            }
        }
        List<String> pendingNames = new ArrayList<>();
        for (Migration migration : migrations) {
            if (!live.contains(migration.name())) {
                pendingNames.add(migration.name());
            }
        }
        if (!drift.isEmpty()) {
            log.warn("{} ledger rows have no registered migration", drift.size());
        }
        return new MigrationStatusReport(
                migrations.size(),
                applied,
                failed,
                rolledBack,
                pendingNames.size(),
                pendingNames,
                rows,
                drift
        );
    }

    private void runUnit(UnitOfWork work) {
        if (!useTransaction) {
            // Without a transaction a retry could re-run half-applied statements.
            client.executeWithRetry(c -> {
                work.run(c);
                return null;
            }, 0);
            return;
        }
        client.executeWithRetry(c -> {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                work.run(c);
                c.commit();
            } catch (Exception e) {
                rollback(c, autoCommit, e);
                throw e;
            }
            c.setAutoCommit(autoCommit);
            return null;
        });
    }

    private static void rollback(Connection c, boolean autoCommit, Exception cause) {
        try {
            c.rollback();
            c.setAutoCommit(autoCommit);
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }

    private void audit(AuditEvent event) {
        if (auditLog != null) {
            auditLog.log(event);
        }
    }

    @FunctionalInterface
    private interface UnitOfWork {
        void run(Connection connection) throws Exception;
    }

    public record RefreshResult(List<MigrationBatchResult> reset, MigrationBatchResult up) {
        public RefreshResult {
            reset = List.copyOf(reset);
        }

        public boolean hasFailures() {
            return reset.stream().anyMatch(MigrationBatchResult::hasFailures) || up == null || up.hasFailures();
        }
    }
}
