package io.schemaledger.migration;

import io.schemaledger.error.LogicalMigrationException;
import io.schemaledger.storage.ExecutionClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;

/**
 * Factory for the three migration shapes. None of them validates SQL; errors surface when the
 * execution client runs the statements.
 */
public final class Migrations {
    private Migrations() {
    }

    public static Migration of(String name, MigrationStep up, MigrationStep down) {
        return new Defined(name, up, down);
    }

    public static Migration sql(String name, String upSql, String downSql, ExecutionClient client) {
        requireNonNull(upSql, "upSql");
        requireNonNull(downSql, "downSql");
        return new Defined(
                name,
                connection -> client.execSql(connection, upSql),
                connection -> client.execSql(connection, downSql)
        );
    }

    /** SQL files are read on every invocation so the current on-disk content is what runs. */
    public static Migration file(String name, Path upFile, Path downFile, ExecutionClient client) {
        requireNonNull(upFile, "upFile");
        requireNonNull(downFile, "downFile");
        return new Defined(
                name,
                connection -> client.execSql(connection, read(name, upFile)),
                connection -> client.execSql(connection, read(name, downFile))
        );
    }

    private static String read(String name, Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LogicalMigrationException("Failed to read SQL for " + name + ": " + file, e);
        }
    }

    private static void requireNonNull(Object value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " cannot be null");
        }
    }

    private record Defined(String name, MigrationStep upStep, MigrationStep downStep) implements Migration {
        Defined {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("migration name cannot be empty");
            }
            requireNonNull(upStep, "up");
            requireNonNull(downStep, "down");
            name = name.trim();
        }

        @Override
        public void up(Connection connection) throws Exception {
            upStep.apply(connection);
        }

        @Override
        public void down(Connection connection) throws Exception {
            downStep.apply(connection);
        }
    }
}
