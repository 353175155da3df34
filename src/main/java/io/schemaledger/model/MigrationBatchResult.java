package io.schemaledger.model;

import java.util.List;

/**
 * Outcome of one batch operation. For a rollback {@code migrationsApplied} counts the rows that were
 * rolled back successfully.
 */
public record MigrationBatchResult(
        int batch,
        int migrationsApplied,
        int migrationsFailed,
        List<MigrationResult> results
) {
    public MigrationBatchResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static MigrationBatchResult empty(int batch) {
        return new MigrationBatchResult(batch, 0, 0, List.of());
    }

    public boolean hasFailures() {
        return migrationsFailed > 0;
    }
}
