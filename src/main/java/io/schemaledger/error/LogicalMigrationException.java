package io.schemaledger.error;

public final class LogicalMigrationException extends MigrationException {
    public LogicalMigrationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Kind kind() {
        return Kind.LOGICAL;
    }
}
