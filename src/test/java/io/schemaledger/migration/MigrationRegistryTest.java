package io.schemaledger.migration;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class MigrationRegistryTest {

    @Test
    void keepsRegistrationOrderAndRejectsDuplicates() {
        MigrationRegistry registry = new MigrationRegistry()
                .register(noop("20240102000000_b"))
                .register(noop("20240101000000_a"));

        Assertions.assertEquals(
                List.of("20240102000000_b", "20240101000000_a"),
                registry.getAll().stream().map(Migration::name).toList()
        );
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register(noop("20240101000000_a")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register(null));
        Assertions.assertEquals(2, registry.size());
    }

    @Test
    void getAllReturnsACopy() {
        MigrationRegistry registry = new MigrationRegistry().registerMany(List.of(noop("a"), noop("b")));
        registry.getAll().clear();
        Assertions.assertEquals(2, registry.size());
        Assertions.assertTrue(registry.find("b").isPresent());
        Assertions.assertTrue(registry.find("c").isEmpty());
    }

    @Test
    void definitionsRequireNameAndSteps() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> Migrations.of(" ", c -> {
        }, c -> {
        }));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Migrations.of("a", null, c -> {
        }));
        Assertions.assertEquals("a", Migrations.of("  a ", c -> {
        }, c -> {
        }).name());
    }

    private static Migration noop(String name) {
        return Migrations.of(name, c -> {
        }, c -> {
        });
    }
}
