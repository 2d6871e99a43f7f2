package com.attribute.resolution.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, column-ordered table of rows exchanged with callers.
 * Caller tables carry identity columns (STUDYID, USUBJID) plus any extra columns,
 * which are preserved through resolution.
 */
public final class DataTable {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private DataTable(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static DataTable empty(List<String> columns) {
        return builder(columns).build();
    }

    public static Builder builder(String... columns) {
        return new Builder(List.of(columns));
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Returns the value of a column in a row as a string, or {@code null} if absent.
     */
    public static String getString(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value != null ? value.toString() : null;
    }

    /**
     * Returns the values of a column, one per row.
     */
    public List<Object> column(String column) {
        if (!hasColumn(column)) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * Returns the distinct non-null string values of a column, in first-seen order.
     */
    public Set<String> distinctValues(String column) {
        Set<String> values = new LinkedHashSet<>();
        for (Object value : column(column)) {
            if (value != null) {
                values.add(value.toString());
            }
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DataTable that = (DataTable) o;
        return columns.equals(that.columns) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "DataTable{columns=" + columns + ", rows=" + rows.size() + '}';
    }

    public static class Builder {
        private final List<String> columns;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            Objects.requireNonNull(columns, "columns are required");
            Set<String> unique = new LinkedHashSet<>(columns);
            if (unique.size() != columns.size()) {
                throw new IllegalArgumentException("Duplicate column names: " + columns);
            }
            this.columns = List.copyOf(columns);
        }

        /**
         * Adds a row with values given in column order.
         */
        public Builder row(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException(
                        "Expected " + columns.size() + " values but got " + values.length);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < values.length; i++) {
                row.put(columns.get(i), values[i]);
            }
            rows.add(row);
            return this;
        }

        /**
         * Adds a row from a map. Keys outside the table's columns are ignored,
         * missing columns are set to {@code null}.
         */
        public Builder row(Map<String, ?> values) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : columns) {
                row.put(column, values.get(column));
            }
            rows.add(row);
            return this;
        }

        public Builder rows(List<? extends Map<String, ?>> values) {
            values.forEach(this::row);
            return this;
        }

        public DataTable build() {
            List<Map<String, Object>> frozen = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                frozen.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            }
            return new DataTable(columns, Collections.unmodifiableList(frozen));
        }
    }
}
