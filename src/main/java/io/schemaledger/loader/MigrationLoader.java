package io.schemaledger.loader;

import io.schemaledger.migration.Migration;

import java.util.List;

/** Produces migrations in the order they must be applied. */
@FunctionalInterface
public interface MigrationLoader {
    List<Migration> load();
}
