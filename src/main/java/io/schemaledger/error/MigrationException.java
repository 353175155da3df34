package io.schemaledger.error;

/**
 * Base of the closed set of engine failures. The constructor is package-private so the four
 * subclasses in this package are the only variants callers need to handle.
 */
public abstract class MigrationException extends RuntimeException {
    public enum Kind {
        TRANSIENT,
        LOGICAL,
        MISSING_DEFINITION,
        LEDGER_INIT
    }

    MigrationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract Kind kind();

    public boolean retryable() {
        return kind() == Kind.TRANSIENT;
    }
}
