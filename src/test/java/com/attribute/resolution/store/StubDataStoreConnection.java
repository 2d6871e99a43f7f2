package com.attribute.resolution.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Records queries and returns canned results keyed by a fragment of the SQL text.
 */
class StubDataStoreConnection implements DataStoreConnection {

    final List<String> executedQueries = new ArrayList<>();
    final List<List<Object>> executedParams = new ArrayList<>();
    final Map<String, List<Map<String, Object>>> resultsByFragment = new HashMap<>();
    final Map<String, Set<String>> columnsByTable = new HashMap<>();
    boolean closed;

    @Override
    public List<Map<String, Object>> query(String sql, List<Object> params) {
        executedQueries.add(sql);
        executedParams.add(params);
        return resultsByFragment.entrySet().stream()
                .filter(e -> sql.contains(e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(List.of());
    }

    @Override
    public Set<String> getColumnNames(String table) {
        return columnsByTable.getOrDefault(table, Set.of());
    }

    @Override
    public boolean isConnected() {
        return !closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
