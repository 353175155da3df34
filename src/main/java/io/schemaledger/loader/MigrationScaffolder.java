package io.schemaledger.loader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class MigrationScaffolder {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final Path directory;
    private final Clock clock;

    public MigrationScaffolder(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public MigrationScaffolder(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    public ScaffoldResult create(String description) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Migration name is required");
        }
        String name = STAMP.format(clock.instant()) + "_" + sanitize(description);
        Path up = directory.resolve(name + DirectoryMigrationLoader.UP_SUFFIX);
        Path down = directory.resolve(name + DirectoryMigrationLoader.DOWN_SUFFIX);
        try {
            Files.createDirectories(directory);
            if (Files.exists(down)) {
                throw new IllegalStateException("Migration " + name + " already exists in " + directory);
            }
            Files.writeString(up, template(description, "Your SQL here"), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            Files.writeString(down, template(description, "Your rollback SQL here"), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            throw new IllegalStateException("Migration " + name + " already exists in " + directory, e);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create migration " + name + " in " + directory, e);
        }
        return new ScaffoldResult(name, up.toString(), down.toString());
    }

    static String sanitize(String description) {
        return description.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_");
    }

    private static String template(String description, String hint) {
        return """
                -- Migration: %s
                -- %s
                """.formatted(description.trim(), hint);
    }

    public record ScaffoldResult(String name, String upFile, String downFile) {
    }
}
