package io.schemaledger.storage;

import io.schemaledger.model.ConnectionStatus;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Transactional data-store access used by the ledger and the runner. Implementations own one cached
 * connection and decide which failures are transient.
 *
 * <p>{@link #executeWithRetry(SqlOperation, int)} runs the operation up to {@code maxRetries + 1}
 * times. Transient failures are retried with exponential backoff and, once exhausted, surface as
 * {@link io.schemaledger.error.TransientDataStoreException}. Any other failure is rethrown at once as
 * {@link io.schemaledger.error.LogicalMigrationException} (or unchanged if it already is a
 * {@link io.schemaledger.error.MigrationException}).
 */
public interface ExecutionClient extends AutoCloseable {
    default <T> T executeWithRetry(SqlOperation<T> operation) {
        return executeWithRetry(operation, maxRetries());
    }

    <T> T executeWithRetry(SqlOperation<T> operation, int maxRetries);

    int maxRetries();

    Connection getClient();

    /** Runs an opaque SQL script on the given connection, statement by statement. */
    void execSql(Connection connection, String sql) throws SQLException;

    boolean healthCheck();

    void resetConnection();

    ConnectionStatus status();

    Throwable lastError();

    Long connectedAtMs();

    @Override
    void close();
}
