package io.schemaledger.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class SchemaLedgerConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_LEDGER_TABLE = "migrations";
    public static final String SETTINGS_FILE_NAME = "schemaledger-settings.json";
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_INTERVAL_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_CONNECTION_TIMEOUT_MS = 10_000L;

    private final Path rootDir;

    public SchemaLedgerConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static SchemaLedgerConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root.trim());
        return new SchemaLedgerConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("schemaledger.db");
    }

    public String defaultJdbcUrl() {
        return "jdbc:sqlite:" + dbFile();
    }

    public Path migrationsDir() {
        return rootDir.resolve("migrations");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
