package io.schemaledger.migration;

import java.sql.Connection;

/**
 * A named, reversible unit of schema change. The name is the identity; by convention it starts with
 * a sortable timestamp, e.g. {@code 20250419000000_add_inventory_item_tags}.
 */
public interface Migration {
    String name();

    void up(Connection connection) throws Exception;

    void down(Connection connection) throws Exception;
}
