package com.attribute.resolution.api;

import com.attribute.resolution.core.model.ResolvedRecord;

import java.util.List;

/**
 * Records produced by one engine run.
 *
 * @param resolved every entity's record, before filtering
 * @param selected the records kept by filtering (equal to {@code resolved} without a filter)
 */
public record ResolutionOutcome(List<ResolvedRecord> resolved, List<ResolvedRecord> selected) {

    public ResolutionOutcome {
        resolved = List.copyOf(resolved);
        selected = List.copyOf(selected);
    }

    public int resolvedCount() {
        return (int) resolved.stream().filter(ResolvedRecord::isResolved).count();
    }

    public int unresolvedCount() {
        return resolved.size() - resolvedCount();
    }

    public int uncertainCount() {
        return (int) resolved.stream().filter(ResolvedRecord::hasReason).count();
    }
}
