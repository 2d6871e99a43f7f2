package com.attribute.resolution.merge;

import com.attribute.resolution.core.model.ColumnNames;
import com.attribute.resolution.core.model.DataTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders columns as: caller columns, attribute columns, message columns.
 * Working columns outside these are dropped, as are exact duplicate rows.
 */
public class DefaultResultShaper implements ResultShaper {

    @Override
    public DataTable shape(DataTable merged, List<String> inputColumns, List<String> attributeColumns) {
        Set<String> ordered = new LinkedHashSet<>();
        for (String column : inputColumns) {
            if (!ColumnNames.isMessageColumn(column)) {
                ordered.add(column);
            }
        }
        ordered.addAll(attributeColumns);
        for (String column : List.of(ColumnNames.UNCERTAIN_MSG, ColumnNames.NOT_VALID_MSG)) {
            if (merged.hasColumn(column)) {
                ordered.add(column);
            }
        }
        ordered.retainAll(merged.getColumns());

        List<String> columns = new ArrayList<>(ordered);
        Set<Map<String, Object>> seen = new LinkedHashSet<>();
        for (Map<String, Object> row : merged.getRows()) {
            Map<String, Object> projected = new LinkedHashMap<>();
            for (String column : columns) {
                projected.put(column, row.get(column));
            }
            seen.add(projected);
        }
        return DataTable.builder(columns).rows(new ArrayList<>(seen)).build();
    }
}
