package io.schemaledger.migration;

import java.sql.Connection;

@FunctionalInterface
public interface MigrationStep {
    void apply(Connection connection) throws Exception;
}
