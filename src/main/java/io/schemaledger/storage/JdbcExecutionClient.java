package io.schemaledger.storage;

import io.schemaledger.config.ClientSettings;
import io.schemaledger.error.ErrorClassifier;
import io.schemaledger.error.LogicalMigrationException;
import io.schemaledger.error.MigrationException;
import io.schemaledger.error.TransientDataStoreException;
import io.schemaledger.model.ConnectionStatus;
import io.schemaledger.util.SqlScripts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.Properties;

public final class JdbcExecutionClient implements ExecutionClient {
    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionClient.class);

    private final ClientSettings settings;
    private final ConnectionFactory connectionFactory;
    private final Sleeper sleeper;
    private Connection connection;
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private Throwable lastError;
    private Long connectedAtMs;

    public JdbcExecutionClient(ClientSettings settings) {
        this(settings, driverManager(settings), Sleeper.THREAD);
    }

    public JdbcExecutionClient(ClientSettings settings, ConnectionFactory connectionFactory, Sleeper sleeper) {
        this.settings = settings;
        this.connectionFactory = connectionFactory;
        this.sleeper = sleeper;
    }

    @Override
    public <T> T executeWithRetry(SqlOperation<T> operation, int maxRetries) {
        int retries = Math.max(0, maxRetries);
        Exception last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return operation.apply(connection());
            } catch (Exception e) {
                last = e;
                if (!ErrorClassifier.isTransient(e)) {
                    throw asLogical(e);
                }
                markError(e);
                log.warn("Data store operation failed (attempt {}/{}): {}",
                        attempt + 1, retries + 1, ErrorClassifier.describe(e));
                if (attempt < retries) {
                    pause(backoffMs(attempt));
                    if (status() == ConnectionStatus.ERROR) {
                        resetConnection();
                    }
                }
            }
        }
        throw new TransientDataStoreException(
                "Data store operation failed after " + (retries + 1) + " attempts: " + ErrorClassifier.describe(last),
                retries + 1,
                last
        );
    }

    @Override
    public int maxRetries() {
        return settings.maxRetries();
    }

    @Override
    public Connection getClient() {
        try {
            return connection();
        } catch (SQLException e) {
            throw new TransientDataStoreException("Failed to connect: " + ErrorClassifier.describe(e), 1, e);
        }
    }

    @Override
    public void execSql(Connection c, String sql) throws SQLException {
        try (Statement st = c.createStatement()) {
            st.setQueryTimeout(settings.connectionTimeoutSeconds());
            for (String statement : SqlScripts.split(sql)) {
                st.execute(statement);
            }
        }
    }

    @Override
    public boolean healthCheck() {
        String probe = settings.healthCheckTable() == null
                ? "SELECT 1"
                : "SELECT 1 FROM " + settings.healthCheckTable() + " LIMIT 1";
        try {
            Connection c = connection();
            try (Statement st = c.createStatement()) {
                st.setQueryTimeout(settings.connectionTimeoutSeconds());
                try (ResultSet ignored = st.executeQuery(probe)) {
                    synchronized (this) {
                        status = ConnectionStatus.CONNECTED;
                    }
                    return true;
                }
            }
        } catch (SQLException e) {
            markError(e);
            log.warn("Health check failed: {}", ErrorClassifier.describe(e));
            return false;
        }
    }

    @Override
    public synchronized void resetConnection() {
        status = ConnectionStatus.CONNECTING;
        closeCurrent();
    }

    @Override
    public synchronized ConnectionStatus status() {
        return status;
    }

    @Override
    public synchronized Throwable lastError() {
        return lastError;
    }

    @Override
    public synchronized Long connectedAtMs() {
        return connectedAtMs;
    }

    @Override
    public synchronized void close() {
        closeCurrent();
        status = ConnectionStatus.DISCONNECTED;
    }

    long backoffMs(int attempt) {
        long backoff = settings.retryIntervalMs();
        for (int i = 0; i < attempt; i++) {
            if (backoff >= settings.maxBackoffMs() / 2L) {
                return settings.maxBackoffMs();
            }
            backoff *= 2L;
        }
        return Math.min(backoff, settings.maxBackoffMs());
    }

    private synchronized Connection connection() throws SQLException {
        if (connection != null && !connection.isClosed()) {
            return connection;
        }
        status = ConnectionStatus.CONNECTING;
        try {
            connection = connectionFactory.open();
        } catch (SQLException e) {
            status = ConnectionStatus.ERROR;
            lastError = e;
            throw e;
        }
        status = ConnectionStatus.CONNECTED;
        connectedAtMs = Instant.now().toEpochMilli();
        return connection;
    }

    private synchronized void markError(Throwable error) {
        status = ConnectionStatus.ERROR;
        lastError = error;
    }

    private void closeCurrent() {
        Connection current = connection;
        connection = null;
        connectedAtMs = null;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (SQLException e) {
            log.debug("Ignoring failure while discarding connection: {}", e.getMessage());
        }
    }

    private void pause(long millis) {
        if (millis <= 0L) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientDataStoreException("Interrupted while waiting to retry", 0, e);
        }
    }

    private static MigrationException asLogical(Exception e) {
        if (e instanceof MigrationException me) {
            return me;
        }
        return new LogicalMigrationException(ErrorClassifier.describe(e), e);
    }

    private static ConnectionFactory driverManager(ClientSettings settings) {
        return () -> {
            Properties props = new Properties();
            if (settings.username() != null) {
                props.setProperty("user", settings.username());
            }
            if (settings.password() != null) {
                props.setProperty("password", settings.password());
            }
            DriverManager.setLoginTimeout(settings.connectionTimeoutSeconds());
            return DriverManager.getConnection(settings.jdbcUrl(), props);
        };
    }
}
