package io.schemaledger.storage;

import java.sql.Connection;

@FunctionalInterface
public interface SqlOperation<T> {
    T apply(Connection connection) throws Exception;
}
