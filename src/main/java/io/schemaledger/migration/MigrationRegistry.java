package io.schemaledger.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Migrations in registration order, which is the apply order. Names are not re-sorted here; the
 * loader is responsible for handing them over chronologically.
 */
public final class MigrationRegistry {
    private final List<Migration> migrations = new ArrayList<>();

    public MigrationRegistry register(Migration migration) {
        if (migration == null) {
            throw new IllegalArgumentException("migration cannot be null");
        }
        if (find(migration.name()).isPresent()) {
            throw new IllegalArgumentException("migration already registered: " + migration.name());
        }
        migrations.add(migration);
        return this;
    }

    public MigrationRegistry registerMany(List<? extends Migration> list) {
        if (list != null) {
            for (Migration migration : list) {
                register(migration);
            }
        }
        return this;
    }

    public List<Migration> getAll() {
        return new ArrayList<>(migrations);
    }

    public Optional<Migration> find(String name) {
        for (Migration migration : migrations) {
            if (migration.name().equals(name)) {
                return Optional.of(migration);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return migrations.size();
    }
}
