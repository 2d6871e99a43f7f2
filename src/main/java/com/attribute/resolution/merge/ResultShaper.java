package com.attribute.resolution.merge;

import com.attribute.resolution.core.model.DataTable;

import java.util.List;

/**
 * Final preparation of a result table: column order and naming.
 */
public interface ResultShaper {

    /**
     * @param merged           the merged table
     * @param inputColumns     the caller's original columns, in order
     * @param attributeColumns the columns added by resolution, in order
     * @return the table handed back to the caller
     */
    DataTable shape(DataTable merged, List<String> inputColumns, List<String> attributeColumns);
}
