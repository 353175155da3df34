package io.schemaledger.error;

public final class LedgerInitializationException extends MigrationException {
    public LedgerInitializationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Kind kind() {
        return Kind.LEDGER_INIT;
    }
}
