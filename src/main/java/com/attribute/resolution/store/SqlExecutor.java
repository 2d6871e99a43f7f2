package com.attribute.resolution.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Executes the SQL queries against the pooled SEND data store.
 * Domain and variable names are interpolated and must be validated identifiers;
 * every value is bound as a parameter.
 */
public class SqlExecutor {
    private static final Logger log = LoggerFactory.getLogger(SqlExecutor.class);

    static final String POOL_TABLE = "POOLDEF";
    static final String POOL_COLUMN = "POOLID";

    private final DataStoreConnection connection;

    public SqlExecutor(DataStoreConnection connection) {
        this.connection = connection;
    }

    // ========== Entity-level values ==========

    /**
     * Distinct non-empty values of a domain variable per animal for the given studies.
     * When {@code includePools} is set, values recorded per pool are expanded to each
     * animal of the pool through POOLDEF.
     * Returns rows with STUDYID, USUBJID and VAL.
     */
    public List<Map<String, Object>> findFineValues(String domain, String variable,
                                                    Collection<String> studyIds, boolean includePools) {
        if (studyIds.isEmpty()) {
            return List.of();
        }
        String in = placeholders(studyIds.size());
        StringBuilder sql = new StringBuilder("""
                select distinct STUDYID,
                       USUBJID,
                       %2$s as VAL
                  from %1$s
                 where STUDYID in (%3$s)
                   and %2$s is not null
                   and %2$s <> ''
                """.formatted(domain, variable, in));
        List<Object> params = new ArrayList<>(studyIds);

        if (includePools) {
            sql.append("""
                    union
                    select POOLDEF.STUDYID,
                           POOLDEF.USUBJID,
                           %1$s.%2$s as VAL
                      from POOLDEF
                      join %1$s
                        on %1$s.STUDYID = POOLDEF.STUDYID
                       and %1$s.POOLID = POOLDEF.POOLID
                       and %1$s.%2$s is not null
                       and %1$s.%2$s <> ''
                     where POOLDEF.STUDYID in (%3$s)
                    """.formatted(domain, variable, in));
            params.addAll(studyIds);
        }
        return connection.query(sql.toString(), params);
    }

    /**
     * Checks whether values of the domain can be recorded per pool:
     * POOLDEF exists and the domain has a POOLID column.
     */
    public boolean supportsPooledValues(String domain) {
        boolean supported = connection.tableExists(POOL_TABLE)
                && connection.getColumnNames(domain).contains(POOL_COLUMN);
        log.debug("Pool-level {} values supported: {}", domain, supported);
        return supported;
    }

    // ========== Study-level values ==========

    /**
     * Distinct non-empty values of a TS parameter for the given studies.
     * Returns rows with STUDYID and VAL.
     */
    public List<Map<String, Object>> findTrialSummaryValues(String parameter, Collection<String> studyIds) {
        if (studyIds.isEmpty()) {
            return List.of();
        }
        String sql = """
                select distinct STUDYID,
                       TSVAL as VAL
                  from TS
                 where TSPARMCD = ?
                   and TSVAL is not null
                   and TSVAL <> ''
                   and STUDYID in (%s)
                """.formatted(placeholders(studyIds.size()));
        List<Object> params = new ArrayList<>();
        params.add(parameter);
        params.addAll(studyIds);
        return connection.query(sql, params);
    }

    /**
     * Every study present in TS.
     */
    public List<Map<String, Object>> findAllStudyIds() {
        return connection.query("""
                select distinct STUDYID
                  from TS
                 order by STUDYID
                """);
    }

    // ========== Controlled terminology ==========

    /**
     * Submission values of a controlled terminology codelist.
     * Returns rows with VAL.
     */
    public List<Map<String, Object>> findCodelistValues(String table, String codelistColumn,
                                                        String valueColumn, String codelist) {
        String sql = """
                select distinct %3$s as VAL
                  from %1$s
                 where %2$s = ?
                """.formatted(table, codelistColumn, valueColumn);
        return connection.query(sql, List.of(codelist));
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
