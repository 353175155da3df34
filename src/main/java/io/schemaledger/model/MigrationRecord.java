package io.schemaledger.model;

public record MigrationRecord(
        String id,
        String name,
        int batch,
        long appliedAtMs,
        long seq,
        MigrationStatus status
) {
}
