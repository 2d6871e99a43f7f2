package com.attribute.resolution.merge;

import com.attribute.resolution.core.model.ColumnNames;
import com.attribute.resolution.core.model.DataTable;
import com.attribute.resolution.core.model.EntityId;
import com.attribute.resolution.core.model.ResolvedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins resolved records back onto the caller's table.
 *
 * <p>The join is an inner join on STUDYID and USUBJID, or on STUDYID alone for group-level
 * tables. Every extra caller column is kept. When the caller's table already carries the
 * message column, new messages are appended to existing ones with {@code |}.</p>
 */
public class ResultMerger {
    private static final Logger log = LoggerFactory.getLogger(ResultMerger.class);

    /**
     * @param input          the caller's table
     * @param records        resolved (and possibly filtered) records, at most one per entity
     * @param groupLevel     join on STUDYID only
     * @param resolvedColumn column receiving the resolved value
     * @param messageColumn  column receiving the reason, or {@code null} for none
     */
    public DataTable merge(DataTable input, List<ResolvedRecord> records, boolean groupLevel,
                           String resolvedColumn, String messageColumn) {
        Map<EntityId, ResolvedRecord> byId = new HashMap<>();
        for (ResolvedRecord record : records) {
            byId.putIfAbsent(record.id(), record);
        }

        List<String> columns = new ArrayList<>(input.getColumns());
        if (!columns.contains(resolvedColumn)) {
            columns.add(resolvedColumn);
        }
        if (messageColumn != null && !columns.contains(messageColumn)) {
            columns.add(messageColumn);
        }

        DataTable.Builder builder = DataTable.builder(columns);
        int dropped = 0;
        for (Map<String, Object> row : input.getRows()) {
            EntityId id = idOf(row, groupLevel);
            ResolvedRecord record = id != null ? byId.get(id) : null;
            if (record == null) {
                dropped++;
                continue;
            }
            Map<String, Object> merged = new LinkedHashMap<>(row);
            merged.put(resolvedColumn, record.value());
            if (messageColumn != null) {
                merged.put(messageColumn,
                        mergeMessages(DataTable.getString(row, messageColumn), record.reason()));
            }
            builder.row(merged);
        }

        log.debug("Merged {} records onto {} input rows, {} rows not selected",
                byId.size(), input.size(), dropped);
        return builder.build();
    }

    /**
     * Appends a new message to an existing one. Absent plus absent stays absent.
     */
    static String mergeMessages(String existing, String message) {
        boolean hasExisting = existing != null && !existing.isBlank();
        boolean hasMessage = message != null && !message.isBlank();
        if (hasExisting && hasMessage) {
            return existing + ColumnNames.MESSAGE_SEPARATOR + message;
        }
        if (hasExisting) {
            return existing;
        }
        return hasMessage ? message : null;
    }

    private EntityId idOf(Map<String, Object> row, boolean groupLevel) {
        String studyId = DataTable.getString(row, ColumnNames.STUDYID);
        if (studyId == null) {
            return null;
        }
        if (groupLevel) {
            return EntityId.ofGroup(studyId);
        }
        String subjectId = DataTable.getString(row, ColumnNames.USUBJID);
        return subjectId != null ? EntityId.of(studyId, subjectId) : null;
    }
}
