package com.attribute.resolution.store;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only access to the relational data store holding the pooled SEND domains.
 * Abstracts the underlying database driver.
 */
public interface DataStoreConnection extends AutoCloseable {

    /**
     * Executes a SQL query and returns results.
     *
     * @param sql    the query, with {@code ?} placeholders
     * @param params positional parameter values
     * @return list of result records as maps keyed by upper-case column label
     * @throws DataStoreException if the query fails
     */
    List<Map<String, Object>> query(String sql, List<Object> params);

    /**
     * Executes a SQL query without parameters and returns results.
     */
    default List<Map<String, Object>> query(String sql) {
        return query(sql, List.of());
    }

    /**
     * Returns the upper-case column names of a table, or an empty set if the table does not exist.
     *
     * @param table the table name
     */
    Set<String> getColumnNames(String table);

    /**
     * Checks whether a table exists.
     */
    default boolean tableExists(String table) {
        return !getColumnNames(table).isEmpty();
    }

    /**
     * Checks if the connection is alive.
     *
     * @return true if connected
     */
    boolean isConnected();

    /**
     * Releases the underlying resources.
     */
    @Override
    void close();
}
