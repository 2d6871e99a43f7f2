package com.attribute.resolution.filter;

import com.attribute.resolution.core.model.AttributeValues;
import com.attribute.resolution.core.model.EntityId;
import com.attribute.resolution.core.model.ResolvedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Filters resolved entities by a target value set.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>match: entities whose resolved value is a target value. Without exclusivity, an
 *   unresolved entity also matches when one of its alternative values is a target value</li>
 *   <li>exclusively: drop the matches of every study whose entities resolve to a value
 *   outside the target set (unresolved entities do not count)</li>
 *   <li>match all: with more than one target value, keep only studies whose matches cover
 *   every target value</li>
 *   <li>include uncertain: add every entity carrying a reason; these bypass steps 2 and 3
 *   and replace a matched row of the same entity</li>
 * </ol>
 */
public class SetFilterEngine {
    private static final Logger log = LoggerFactory.getLogger(SetFilterEngine.class);

    /**
     * Applies the criteria to the complete set of resolved records of an invocation.
     *
     * @return the selected records, in input order, one per entity
     */
    public List<ResolvedRecord> filter(List<ResolvedRecord> records, FilterCriteria criteria) {
        return filter(records, criteria, Map.of());
    }

    /**
     * Applies the criteria, letting unresolved entities match on their alternative values.
     *
     * @param alternatives candidate values of unresolved entities, e.g. the several SDESIGN
     *                     values of a study; ignored when the criteria are exclusive
     * @return the selected records, in input order, one per entity
     */
    public List<ResolvedRecord> filter(List<ResolvedRecord> records, FilterCriteria criteria,
                                       Map<EntityId, List<String>> alternatives) {
        if (!criteria.isActive()) {
            return List.copyOf(records);
        }
        Set<String> targets = criteria.targetKeys();

        Map<EntityId, Set<String>> matchedKeys = new HashMap<>();
        Map<EntityId, ResolvedRecord> matched = new LinkedHashMap<>();
        for (ResolvedRecord record : records) {
            Set<String> keys = matchingKeys(record, targets,
                    criteria.exclusively() ? List.of() : alternatives.getOrDefault(record.id(), List.of()));
            if (!keys.isEmpty()) {
                matched.putIfAbsent(record.id(), record);
                matchedKeys.putIfAbsent(record.id(), keys);
            }
        }
        log.debug("Matched {} of {} entities on {}", matched.size(), records.size(), targets);

        if (criteria.exclusively()) {
            Set<String> disqualified = groupsWithOtherValues(records, targets);
            matched.values().removeIf(r -> disqualified.contains(r.id().groupKey()));
            log.debug("Exclusive filter disqualified studies {}", disqualified);
        }

        if (criteria.matchAll() && targets.size() > 1) {
            Map<String, Set<String>> coverage = new HashMap<>();
            for (ResolvedRecord record : matched.values()) {
                coverage.computeIfAbsent(record.id().groupKey(), k -> new LinkedHashSet<>())
                        .addAll(matchedKeys.get(record.id()));
            }
            matched.values().removeIf(r -> coverage.get(r.id().groupKey()).size() != targets.size());
            log.debug("Match-all filter kept {} entities", matched.size());
        }

        Map<EntityId, ResolvedRecord> selected = new HashMap<>(matched);
        if (criteria.includeUncertain()) {
            for (ResolvedRecord record : records) {
                if (record.hasReason()) {
                    selected.put(record.id(), record);
                }
            }
        }

        List<ResolvedRecord> result = new ArrayList<>(selected.size());
        Set<EntityId> emitted = new LinkedHashSet<>();
        for (ResolvedRecord record : records) {
            if (selected.containsKey(record.id()) && emitted.add(record.id())) {
                result.add(selected.get(record.id()));
            }
        }
        return result;
    }

    private Set<String> matchingKeys(ResolvedRecord record, Set<String> targets, List<String> alternatives) {
        Set<String> keys = new LinkedHashSet<>();
        if (record.isResolved()) {
            String key = AttributeValues.key(record.value());
            if (targets.contains(key)) {
                keys.add(key);
            }
            return keys;
        }
        for (String value : alternatives) {
            String key = AttributeValues.key(value);
            if (targets.contains(key)) {
                keys.add(key);
            }
        }
        return keys;
    }

    /**
     * Studies in which some entity resolves to a value outside the target set.
     */
    private Set<String> groupsWithOtherValues(List<ResolvedRecord> records, Set<String> targets) {
        Set<String> groups = new LinkedHashSet<>();
        for (ResolvedRecord record : records) {
            if (record.isResolved() && !targets.contains(AttributeValues.key(record.value()))) {
                groups.add(record.id().groupKey());
            }
        }
        return groups;
    }
}
