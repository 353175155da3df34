package io.schemaledger.runtime;

import io.schemaledger.config.ClientSettings;
import io.schemaledger.config.SchemaLedgerConfig;
import io.schemaledger.model.ConnectionStatus;
import io.schemaledger.model.MigrationBatchResult;
import io.schemaledger.storage.JdbcExecutionClient;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class SchemaLedgerRuntimeTest {

    @Test
    void wiresLoaderLedgerAndRunnerFromRoot() throws Exception {
        Path root = Files.createTempDirectory("schemaledger-test-runtime-");
        try {
            SchemaLedgerConfig config = SchemaLedgerConfig.fromRoot(root.toString());
            ClientSettings settings = ClientSettings.load(config);
            Files.createDirectories(settings.migrationsDir());
            Files.writeString(settings.migrationsDir().resolve("001_users.up.sql"), "CREATE TABLE users (id INTEGER);", StandardCharsets.UTF_8);
            Files.writeString(settings.migrationsDir().resolve("001_users.down.sql"), "DROP TABLE users;", StandardCharsets.UTF_8);

            try (SchemaLedgerRuntime runtime = new SchemaLedgerRuntime(config, settings)) {
                MigrationBatchResult result = runtime.runner().up();
                Assertions.assertEquals(1, result.migrationsApplied());
                Assertions.assertEquals(1, runtime.ledger().getApplied().size());
                Assertions.assertTrue(runtime.client().healthCheck());
            }
            Assertions.assertTrue(Files.size(config.auditFile()) > 0);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void closesClientWhenMigrationsCannotBeLoaded() throws Exception {
        Path root = Files.createTempDirectory("schemaledger-test-runtime-unpaired-");
        try {
            SchemaLedgerConfig config = SchemaLedgerConfig.fromRoot(root.toString());
            ClientSettings settings = ClientSettings.load(config);
            Files.createDirectories(settings.migrationsDir());
            Files.writeString(settings.migrationsDir().resolve("001_users.up.sql"), "CREATE TABLE users (id INTEGER);", StandardCharsets.UTF_8);

            JdbcExecutionClient client = new JdbcExecutionClient(settings);
            Assertions.assertTrue(client.healthCheck());
            Assertions.assertEquals(ConnectionStatus.CONNECTED, client.status());

            Assertions.assertThrows(IllegalStateException.class, () -> new SchemaLedgerRuntime(config, settings, client));

            Assertions.assertEquals(ConnectionStatus.DISCONNECTED, client.status());
            Assertions.assertNull(client.connectedAtMs());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
