package io.schemaledger.error;

public final class MissingMigrationException extends MigrationException {
    private final String migrationName;

    public MissingMigrationException(String migrationName) {
        super("Migration " + migrationName + " not found", null);
        this.migrationName = migrationName;
    }

    public String migrationName() {
        return migrationName;
    }

    @Override
    public Kind kind() {
        return Kind.MISSING_DEFINITION;
    }
}
