package io.schemaledger.model;

public record MigrationResult(
        String name,
        MigrationStatus status,
        String error
) {
    public static MigrationResult ok(String name, MigrationStatus status) {
        return new MigrationResult(name, status, null);
    }

    public static MigrationResult failed(String name, String error) {
        return new MigrationResult(name, MigrationStatus.FAILED, error);
    }
}
