package io.schemaledger.loader;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;

final class MigrationScaffolderTest {

    @Test
    void createsTimestampedUpDownPair() throws Exception {
        Path root = Files.createTempDirectory("schemaledger-test-scaffold-");
        try {
            Path dir = root.resolve("migrations");
            Clock clock = Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC);

            MigrationScaffolder.ScaffoldResult result = new MigrationScaffolder(dir, clock).create("Create Users");

            Assertions.assertEquals("20240102030405_create_users", result.name());
            Path up = dir.resolve("20240102030405_create_users.up.sql");
            Path down = dir.resolve("20240102030405_create_users.down.sql");
            Assertions.assertEquals(up.toString(), result.upFile());
            Assertions.assertTrue(Files.readString(up, StandardCharsets.UTF_8).startsWith("-- Migration: Create Users"));
            Assertions.assertTrue(Files.readString(down, StandardCharsets.UTF_8).contains("Your rollback SQL here"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void refusesToOverwriteAnExistingPair() throws Exception {
        Path root = Files.createTempDirectory("schemaledger-test-scaffold-twice-");
        try {
            Clock clock = Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC);
            MigrationScaffolder scaffolder = new MigrationScaffolder(root, clock);
            MigrationScaffolder.ScaffoldResult first = scaffolder.create("create users");
            Path up = Path.of(first.upFile());
            Files.writeString(up, "CREATE TABLE users (id INTEGER);", StandardCharsets.UTF_8);

            IllegalStateException error = Assertions.assertThrows(IllegalStateException.class,
                    () -> scaffolder.create("create users"));

            Assertions.assertTrue(error.getMessage().contains("20240102030405_create_users"));
            Assertions.assertEquals("CREATE TABLE users (id INTEGER);", Files.readString(up, StandardCharsets.UTF_8));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sanitizesDescription() {
        Assertions.assertEquals("add_email_to_users", MigrationScaffolder.sanitize(" Add email-to users "));
        Assertions.assertEquals("v2___drop_x", MigrationScaffolder.sanitize("v2 & drop x"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new MigrationScaffolder(Path.of("unused")).create("  "));
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
