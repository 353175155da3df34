package io.schemaledger.error;

import java.io.IOException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a raw failure is worth retrying. Only connectivity-class failures are; a syntax
 * error or constraint violation fails the same way on every attempt.
 */
public final class ErrorClassifier {
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of("40001", "40P01", "57P01", "57P02", "57P03");
    // SQLITE_BUSY, SQLITE_LOCKED
    private static final Set<Integer> SQLITE_TRANSIENT_CODES = Set.of(5, 6);

    private ErrorClassifier() {
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        boolean fromDriver = false;
        int depth = 0;
        while (current != null && depth < 8) {
            if (current instanceof MigrationException me) {
                return me.retryable();
            }
            if (current instanceof SQLTransientException || current instanceof SQLRecoverableException) {
                return true;
            }
            // An I/O failure only means a broken connection when the driver reported it.
            if (current instanceof IOException && fromDriver) {
                return true;
            }
            if (current instanceof SQLException sql) {
                if (isTransientSql(sql)) {
                    return true;
                }
                fromDriver = true;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    public static boolean isMissingRelation(SQLException error) {
        String state = error.getSQLState();
        if ("42P01".equals(state) || "42S02".equals(state)) {
            return true;
        }
        String message = error.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("no such table");
    }

    public static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root && root instanceof MigrationException) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message == null || message.isBlank() ? root.getClass().getSimpleName() : message;
    }

    private static boolean isTransientSql(SQLException sql) {
        String state = sql.getSQLState();
        if (state != null && (state.startsWith("08") || TRANSIENT_SQL_STATES.contains(state))) {
            return true;
        }
        String message = sql.getMessage();
        if (message != null && (message.startsWith("[SQLITE_BUSY") || message.startsWith("[SQLITE_LOCKED"))) {
            return true;
        }
        return SQLITE_TRANSIENT_CODES.contains(sql.getErrorCode()) && message != null && message.startsWith("[SQLITE_");
    }
}
