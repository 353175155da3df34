package io.schemaledger.model;

import java.util.List;

public record MigrationStatusReport(
        int totalMigrations,
        int appliedMigrations,
        int failedMigrations,
        int rolledBackMigrations,
        int pendingMigrations,
        List<String> pendingNames,
        List<MigrationRecord> ledger,
        List<MigrationRecord> drift
) {
    public MigrationStatusReport {
        pendingNames = List.copyOf(pendingNames);
        ledger = List.copyOf(ledger);
        drift = List.copyOf(drift);
    }

    public boolean hasDrift() {
        return !drift.isEmpty();
    }
}
