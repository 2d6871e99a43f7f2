package com.attribute.resolution.decision;

import com.attribute.resolution.aggregation.CandidateSet;
import com.attribute.resolution.core.model.ResolutionMode;
import com.attribute.resolution.core.model.ResolvedRecord;
import com.attribute.resolution.core.model.ValueSource;

/**
 * Picks a single value per entity from its candidates.
 *
 * <p>Precedence, first match wins:</p>
 * <ol>
 *   <li>exactly one entity-level value: that value</li>
 *   <li>no entity-level value and exactly one group-level value: that value</li>
 *   <li>otherwise unresolved</li>
 * </ol>
 * <p>Ambiguity or absence is never guessed.</p>
 */
public class AttributeResolver {

    private final ResolutionMode mode;

    public AttributeResolver(ResolutionMode mode) {
        this.mode = mode;
    }

    public ResolvedRecord resolve(CandidateSet candidates) {
        if (mode.hasEntityLevelSource()) {
            if (candidates.fineCount() == 1) {
                return ResolvedRecord.resolved(candidates.id(), candidates.fineValues().get(0), ValueSource.FINE);
            }
            if (candidates.fineCount() > 1) {
                return ResolvedRecord.unresolved(candidates.id());
            }
        }
        if (candidates.coarseCount() == 1) {
            return ResolvedRecord.resolved(candidates.id(), candidates.coarseValues().get(0), ValueSource.COARSE);
        }
        return ResolvedRecord.unresolved(candidates.id());
    }

    public ResolutionMode getMode() {
        return mode;
    }
}
