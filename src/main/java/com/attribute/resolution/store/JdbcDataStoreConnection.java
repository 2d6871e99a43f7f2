package com.attribute.resolution.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * JDBC implementation. Opens a connection per query, so the store is never held open
 * between invocations.
 */
public class JdbcDataStoreConnection implements DataStoreConnection {
    private static final Logger log = LoggerFactory.getLogger(JdbcDataStoreConnection.class);
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final ConnectionFactory connectionFactory;
    private final String description;

    public JdbcDataStoreConnection(DataSource dataSource) {
        this(dataSource::getConnection, dataSource.getClass().getSimpleName());
    }

    public JdbcDataStoreConnection(String url, String user, String password) {
        this(() -> DriverManager.getConnection(url, user, password), url);
    }

    private JdbcDataStoreConnection(ConnectionFactory connectionFactory, String description) {
        this.connectionFactory = connectionFactory;
        this.description = description;
        log.info("JDBC data store connection initialized: {}", description);
    }

    @Override
    public List<Map<String, Object>> query(String sql, List<Object> params) {
        log.debug("Querying: {} params={}", sql, params);
        try (Connection connection = connectionFactory.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, params.get(i));
            }
            List<Map<String, Object>> results = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                ResultSetMetaData metaData = resultSet.getMetaData();
                int columnCount = metaData.getColumnCount();
                while (resultSet.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columnCount; i++) {
                        row.put(metaData.getColumnLabel(i).toUpperCase(Locale.ROOT), resultSet.getObject(i));
                    }
                    results.add(row);
                }
            }
            log.debug("Query returned {} results", results.size());
            return results;
        } catch (SQLException e) {
            throw new DataStoreException("Query failed against " + description + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Set<String> getColumnNames(String table) {
        try (Connection connection = connectionFactory.open()) {
            DatabaseMetaData metaData = connection.getMetaData();
            Set<String> columns = new LinkedHashSet<>();
            for (String candidate : new LinkedHashSet<>(List.of(table,
                    table.toUpperCase(Locale.ROOT), table.toLowerCase(Locale.ROOT)))) {
                try (ResultSet resultSet = metaData.getColumns(null, null, candidate, null)) {
                    while (resultSet.next()) {
                        columns.add(resultSet.getString("COLUMN_NAME").toUpperCase(Locale.ROOT));
                    }
                }
                if (!columns.isEmpty()) {
                    break;
                }
            }
            return columns;
        } catch (SQLException e) {
            throw new DataStoreException("Cannot read metadata of table " + table + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isConnected() {
        try (Connection connection = connectionFactory.open()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public void close() {
        log.info("JDBC data store connection closed: {}", description);
    }

    @FunctionalInterface
    private interface ConnectionFactory {
        Connection open() throws SQLException;
    }
}
