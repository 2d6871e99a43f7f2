package com.attribute.resolution.aggregation;

import com.attribute.resolution.core.model.EntityId;

import java.util.List;
import java.util.Objects;

/**
 * Distinct candidate values collected for one entity.
 *
 * @param id           the entity
 * @param fineValues   distinct entity-level values, in first-seen order
 * @param coarseValues distinct group-level values of the entity's study, in first-seen order
 */
public record CandidateSet(EntityId id, List<String> fineValues, List<String> coarseValues) {

    public CandidateSet {
        Objects.requireNonNull(id, "id is required");
        fineValues = fineValues != null ? List.copyOf(fineValues) : List.of();
        coarseValues = coarseValues != null ? List.copyOf(coarseValues) : List.of();
    }

    public int fineCount() {
        return fineValues.size();
    }

    public int coarseCount() {
        return coarseValues.size();
    }

    public boolean hasFineValues() {
        return !fineValues.isEmpty();
    }

    public boolean hasCoarseValues() {
        return !coarseValues.isEmpty();
    }
}
