package io.schemaledger.loader;

import io.schemaledger.migration.Migration;
import io.schemaledger.migration.Migrations;
import io.schemaledger.storage.ExecutionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Discovers {@code <name>.up.sql} / {@code <name>.down.sql} pairs in one directory. Names are sorted
 * lexically, which is chronological for timestamp-prefixed names.
 */
public final class DirectoryMigrationLoader implements MigrationLoader {
    static final String UP_SUFFIX = ".up.sql";
    static final String DOWN_SUFFIX = ".down.sql";
    private static final Logger log = LoggerFactory.getLogger(DirectoryMigrationLoader.class);

    private final Path directory;
    private final ExecutionClient client;

    public DirectoryMigrationLoader(Path directory, ExecutionClient client) {
        this.directory = directory;
        this.client = client;
    }

    @Override
    public List<Migration> load() {
        if (!Files.isDirectory(directory)) {
            log.info("Migrations directory {} does not exist, nothing to load", directory);
            return List.of();
        }
        Map<String, Path[]> pairs = new TreeMap<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(Files::isRegularFile).toList()) {
                String fileName = file.getFileName().toString();
                if (fileName.endsWith(UP_SUFFIX)) {
                    pairs.computeIfAbsent(strip(fileName, UP_SUFFIX), k -> new Path[2])[0] = file;
                } else if (fileName.endsWith(DOWN_SUFFIX)) {
                    pairs.computeIfAbsent(strip(fileName, DOWN_SUFFIX), k -> new Path[2])[1] = file;
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list migrations directory: " + directory, e);
        }
        List<Migration> out = new ArrayList<>();
        for (Map.Entry<String, Path[]> entry : pairs.entrySet()) {
            Path up = entry.getValue()[0];
            Path down = entry.getValue()[1];
            if (up == null || down == null) {
                throw new IllegalStateException("Migration " + entry.getKey() + " is missing its "
                        + (up == null ? UP_SUFFIX : DOWN_SUFFIX) + " file in " + directory);
            }
            out.add(Migrations.file(entry.getKey(), up, down, client));
        }
        log.info("Found {} migrations in {}", out.size(), directory);
        return out;
    }

    private static String strip(String fileName, String suffix) {
        return fileName.substring(0, fileName.length() - suffix.length());
    }
}
