package io.schemaledger.model;

import java.util.Locale;

public enum MigrationStatus {
    PENDING,
    APPLIED,
    FAILED,
    ROLLED_BACK;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MigrationStatus fromDbValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("migration status cannot be empty");
        }
        return MigrationStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Ledger rows move one way only: a fresh row is {@code applied} or {@code failed}, and an
     * {@code applied} row may become {@code rolled_back} or {@code failed}.
     */
    public boolean canTransitionTo(MigrationStatus next) {
        if (this == APPLIED) {
            return next == ROLLED_BACK || next == FAILED;
        }
        return false;
    }
}
