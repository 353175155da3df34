package io.schemaledger.error;

public final class TransientDataStoreException extends MigrationException {
    private final int attempts;

    public TransientDataStoreException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }

    @Override
    public Kind kind() {
        return Kind.TRANSIENT;
    }
}
