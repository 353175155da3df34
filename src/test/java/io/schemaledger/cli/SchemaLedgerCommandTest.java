package io.schemaledger.cli;

import io.schemaledger.config.ClientSettings;
import io.schemaledger.config.SchemaLedgerConfig;
import io.schemaledger.model.MigrationRecord;
import io.schemaledger.model.MigrationStatus;
import io.schemaledger.storage.JdbcExecutionClient;
import io.schemaledger.storage.MigrationLedger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class SchemaLedgerCommandTest {

    @Test
    void createUpStatusDownRoundTrip() throws Exception {
        Path root = Files.createTempDirectory("schemaledger-test-cli-");
        try {
            String rootArg = root.toString();
            Assertions.assertEquals(0, run("--root", rootArg, "create", "create users"));
            SchemaLedgerConfig config = SchemaLedgerConfig.fromRoot(rootArg);
            Path up = single(config.migrationsDir(), ".up.sql");
            Path down = single(config.migrationsDir(), ".down.sql");
            Files.writeString(up, "CREATE TABLE users (id INTEGER PRIMARY KEY, email TEXT NOT NULL);", StandardCharsets.UTF_8);
            Files.writeString(down, "DROP TABLE users;", StandardCharsets.UTF_8);

            Assertions.assertEquals(0, run("--root", rootArg, "up"));
            Assertions.assertEquals(0, run("--root", rootArg, "status"));
            Assertions.assertEquals(0, run("--root", rootArg, "history", "--limit", "5"));
            Assertions.assertEquals(List.of(MigrationStatus.APPLIED), statuses(config));

            Assertions.assertEquals(0, run("--root", rootArg, "down"));
            Assertions.assertEquals(List.of(MigrationStatus.ROLLED_BACK), statuses(config));

            Assertions.assertEquals(0, run("--root", rootArg, "refresh"));
            Assertions.assertEquals(0, run("--root", rootArg, "reset"));
            Assertions.assertEquals(0, run("--root", rootArg, "health"));
            Assertions.assertEquals(0, run("--root", rootArg, "settings"));
            Assertions.assertEquals(0, run("--root", rootArg, "audit-verify"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedMigrationExitsNonZero() throws Exception {
        Path root = Files.createTempDirectory("schemaledger-test-cli-fail-");
        try {
            String rootArg = root.toString();
            SchemaLedgerConfig config = SchemaLedgerConfig.fromRoot(rootArg);
            Files.createDirectories(config.migrationsDir());
            Files.writeString(config.migrationsDir().resolve("001_broken.up.sql"), "CREAT TABLE nope (id INTEGER);", StandardCharsets.UTF_8);
            Files.writeString(config.migrationsDir().resolve("001_broken.down.sql"), "DROP TABLE nope;", StandardCharsets.UTF_8);

            Assertions.assertEquals(1, run("--root", rootArg, "up"));
            Assertions.assertEquals(List.of(MigrationStatus.FAILED), statuses(config));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreachableDatabaseFailsHealthCheck() throws Exception {
        Path root = Files.createTempDirectory("schemaledger-test-cli-health-");
        try {
            Assertions.assertEquals(1, run("--root", root.toString(), "--jdbc-url", "jdbc:nosuchdriver://nowhere", "health"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static int run(String... args) {
        return new CommandLine(new SchemaLedgerCommand()).execute(args);
    }

    private static List<MigrationStatus> statuses(SchemaLedgerConfig config) {
        try (JdbcExecutionClient client = new JdbcExecutionClient(ClientSettings.defaults(config))) {
            return new MigrationLedger(client, "migrations").getApplied().stream()
                    .map(MigrationRecord::status)
                    .toList();
        }
    }

    private static Path single(Path dir, String suffix) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            List<Path> matches = files.filter(p -> p.getFileName().toString().endsWith(suffix)).toList();
            Assertions.assertEquals(1, matches.size());
            return matches.get(0);
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
