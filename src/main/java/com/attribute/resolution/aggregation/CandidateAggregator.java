package com.attribute.resolution.aggregation;

import com.attribute.resolution.core.model.AttributeValues;
import com.attribute.resolution.core.model.CoarseObservation;
import com.attribute.resolution.core.model.EntityId;
import com.attribute.resolution.core.model.FineObservation;
import com.attribute.resolution.core.model.ResolutionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups raw candidate rows per entity.
 *
 * <p>Fine values are collected per animal, coarse values per study and broadcast to every
 * entity of that study. Values are made distinct case-insensitively, keeping the first
 * spelling seen. Blank values are dropped before counting.</p>
 */
public class CandidateAggregator {
    private static final Logger log = LoggerFactory.getLogger(CandidateAggregator.class);

    /**
     * Aggregates candidates for the given entities.
     *
     * @param entities the entities to aggregate for; order is kept in the result
     * @param fine     entity-level rows (ignored in group-level only mode)
     * @param coarse   group-level rows
     * @param mode     granularity of the attribute
     * @return one candidate set per distinct entity
     */
    public Map<EntityId, CandidateSet> aggregate(Collection<EntityId> entities,
                                                 Collection<FineObservation> fine,
                                                 Collection<CoarseObservation> coarse,
                                                 ResolutionMode mode) {
        Map<String, Map<String, String>> coarseByGroup = new HashMap<>();
        for (CoarseObservation observation : coarse) {
            if (observation.hasValue()) {
                addDistinct(coarseByGroup.computeIfAbsent(observation.groupKey(), k -> new LinkedHashMap<>()),
                        observation.value());
            }
        }

        Map<EntityId, Map<String, String>> fineByEntity = new HashMap<>();
        if (mode.hasEntityLevelSource()) {
            for (FineObservation observation : fine) {
                if (observation.hasValue()) {
                    addDistinct(fineByEntity.computeIfAbsent(observation.entityId(), k -> new LinkedHashMap<>()),
                            observation.value());
                }
            }
        } else if (!fine.isEmpty()) {
            log.debug("Ignoring {} entity-level rows for a group-level only attribute", fine.size());
        }

        Map<EntityId, CandidateSet> result = new LinkedHashMap<>();
        for (EntityId id : entities) {
            if (result.containsKey(id)) {
                continue;
            }
            List<String> fineValues = mode.hasEntityLevelSource()
                    ? values(fineByEntity.get(id)) : List.of();
            List<String> coarseValues = values(coarseByGroup.get(id.groupKey()));
            result.put(id, new CandidateSet(id, fineValues, coarseValues));
        }

        log.debug("Aggregated candidates for {} entities ({} fine rows, {} coarse rows)",
                result.size(), fine.size(), coarse.size());
        return result;
    }

    private void addDistinct(Map<String, String> valuesByKey, String value) {
        valuesByKey.putIfAbsent(AttributeValues.key(value), value.trim());
    }

    private List<String> values(Map<String, String> valuesByKey) {
        return valuesByKey == null ? List.of() : new ArrayList<>(valuesByKey.values());
    }
}
