package io.schemaledger.runtime;

import io.schemaledger.config.ClientSettings;
import io.schemaledger.config.SchemaLedgerConfig;
import io.schemaledger.loader.DirectoryMigrationLoader;
import io.schemaledger.loader.MigrationLoader;
import io.schemaledger.migration.MigrationRegistry;
import io.schemaledger.observability.MigrationAuditLog;
import io.schemaledger.runner.MigrationRunner;
import io.schemaledger.storage.ExecutionClient;
import io.schemaledger.storage.JdbcExecutionClient;
import io.schemaledger.storage.MigrationLedger;

import java.io.IOException;
import java.nio.file.Files;

/**
 * Wires one execution client, registry, ledger and runner for a root directory. Each instance owns
 * its own connection; nothing is shared between instances.
 */
public final class SchemaLedgerRuntime implements AutoCloseable {
    private final ExecutionClient client;
    private final MigrationLedger ledger;
    private final MigrationRunner runner;

    public SchemaLedgerRuntime(SchemaLedgerConfig config, ClientSettings settings) {
        this(config, settings, new JdbcExecutionClient(settings));
    }

    public SchemaLedgerRuntime(SchemaLedgerConfig config, ClientSettings settings, ExecutionClient client) {
        this(config, settings, client, new DirectoryMigrationLoader(settings.migrationsDir(), client));
    }

    /** Takes ownership of {@code client}; it is closed here if wiring fails. */
    public SchemaLedgerRuntime(
            SchemaLedgerConfig config,
            ClientSettings settings,
            ExecutionClient client,
            MigrationLoader loader
    ) {
        this.client = client;
        MigrationRegistry registry;
        MigrationAuditLog auditLog;
        try {
            initDirectories(config);
            registry = new MigrationRegistry().registerMany(loader.load());
            auditLog = new MigrationAuditLog(config.auditFile(), System.getProperty("user.name"));
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
        this.ledger = new MigrationLedger(client, settings.ledgerTable());
        this.runner = new MigrationRunner(client, registry, ledger, settings.useTransaction(), auditLog);
    }

    public ExecutionClient client() {
        return client;
    }

    public MigrationLedger ledger() {
        return ledger;
    }

    public MigrationRunner runner() {
        return runner;
    }

    @Override
    public void close() {
        client.close();
    }

    private static void initDirectories(SchemaLedgerConfig config) {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }
}
