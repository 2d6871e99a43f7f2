package com.attribute.resolution.store;

import com.attribute.resolution.core.model.AttributeDescriptor;
import com.attribute.resolution.core.model.CoarseObservation;
import com.attribute.resolution.core.model.FineObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fetches raw candidate rows for an attribute.
 * Empty values are excluded at the source.
 */
public class ObservationRepository {
    private static final Logger log = LoggerFactory.getLogger(ObservationRepository.class);

    private final SqlExecutor executor;

    public ObservationRepository(SqlExecutor executor) {
        this.executor = executor;
    }

    public ObservationRepository(DataStoreConnection connection) {
        this(new SqlExecutor(connection));
    }

    /**
     * Entity-level rows of every animal in the given studies.
     * Returns nothing for an attribute recorded at study level only.
     */
    public List<FineObservation> fetchFineObservations(AttributeDescriptor descriptor,
                                                       Collection<String> groupKeys) {
        if (!descriptor.getMode().hasEntityLevelSource() || groupKeys.isEmpty()) {
            return List.of();
        }
        boolean includePools = executor.supportsPooledValues(descriptor.getFineDomain());
        List<Map<String, Object>> rows = executor.findFineValues(
                descriptor.getFineDomain(), descriptor.getFineVariable(), groupKeys, includePools);
        log.debug("Fetched {} {} rows for {} studies", rows.size(), descriptor.getFineVariable(), groupKeys.size());
        // pool-level rows without USUBJID reach the animals through the POOLDEF union
        return rows.stream()
                .filter(row -> row.get("STUDYID") != null && row.get("USUBJID") != null)
                .map(row -> new FineObservation(
                        row.get("STUDYID").toString(),
                        row.get("USUBJID").toString(),
                        Objects.toString(row.get("VAL"), null)))
                .toList();
    }

    /**
     * Study-level rows of the given studies.
     */
    public List<CoarseObservation> fetchCoarseObservations(AttributeDescriptor descriptor,
                                                           Collection<String> groupKeys) {
        if (groupKeys.isEmpty()) {
            return List.of();
        }
        List<Map<String, Object>> rows = executor.findTrialSummaryValues(descriptor.getCoarseParameter(), groupKeys);
        log.debug("Fetched {} TS {} rows for {} studies", rows.size(), descriptor.getCoarseParameter(), groupKeys.size());
        return rows.stream()
                .filter(row -> row.get("STUDYID") != null)
                .map(row -> new CoarseObservation(
                        row.get("STUDYID").toString(),
                        Objects.toString(row.get("VAL"), null)))
                .toList();
    }

    /**
     * Every study known to the data store.
     */
    public List<String> fetchAllGroupKeys() {
        return executor.findAllStudyIds().stream()
                .map(row -> Objects.toString(row.get("STUDYID"), null))
                .filter(Objects::nonNull)
                .toList();
    }
}
