package com.attribute.resolution.api;

import com.attribute.resolution.aggregation.CandidateAggregator;
import com.attribute.resolution.aggregation.CandidateSet;
import com.attribute.resolution.core.model.AttributeDescriptor;
import com.attribute.resolution.core.model.CoarseObservation;
import com.attribute.resolution.core.model.EntityId;
import com.attribute.resolution.core.model.FineObservation;
import com.attribute.resolution.core.model.ReferenceVocabulary;
import com.attribute.resolution.core.model.ResolutionMode;
import com.attribute.resolution.core.model.ResolvedRecord;
import com.attribute.resolution.decision.AttributeResolver;
import com.attribute.resolution.decision.UncertaintyClassifier;
import com.attribute.resolution.filter.FilterCriteria;
import com.attribute.resolution.filter.SetFilterEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory resolution pipeline: aggregate, resolve, classify (optional), filter (optional).
 *
 * <p>A pure function of its inputs: nothing is read from or written to the data store,
 * and identical inputs give identical outcomes.</p>
 */
public class AttributeResolutionEngine {
    private static final Logger log = LoggerFactory.getLogger(AttributeResolutionEngine.class);

    private final CandidateAggregator aggregator;
    private final SetFilterEngine filterEngine;

    public AttributeResolutionEngine() {
        this(new CandidateAggregator(), new SetFilterEngine());
    }

    public AttributeResolutionEngine(CandidateAggregator aggregator, SetFilterEngine filterEngine) {
        this.aggregator = aggregator;
        this.filterEngine = filterEngine;
    }

    /**
     * Runs the pipeline.
     *
     * @param descriptor the attribute
     * @param mode       granularity to resolve at
     * @param entities   entities to resolve, one record each
     * @param fine       entity-level rows
     * @param coarse     group-level rows
     * @param vocabulary reference values; {@code null} skips classification
     * @param criteria   filter criteria; an inactive criteria keeps every record
     */
    public ResolutionOutcome run(AttributeDescriptor descriptor, ResolutionMode mode,
                                 Collection<EntityId> entities,
                                 Collection<FineObservation> fine,
                                 Collection<CoarseObservation> coarse,
                                 ReferenceVocabulary vocabulary,
                                 FilterCriteria criteria) {
        if (criteria.isActive() && criteria.includeUncertain() && vocabulary == null) {
            throw new IllegalArgumentException("Including uncertain entities requires a reference vocabulary");
        }

        Map<EntityId, CandidateSet> candidates = aggregator.aggregate(entities, fine, coarse, mode);
        AttributeResolver resolver = new AttributeResolver(mode);
        UncertaintyClassifier classifier = vocabulary != null
                ? new UncertaintyClassifier(descriptor, vocabulary) : null;

        List<ResolvedRecord> records = new ArrayList<>(candidates.size());
        Map<EntityId, List<String>> alternatives = new HashMap<>();
        for (CandidateSet candidateSet : candidates.values()) {
            ResolvedRecord record = resolver.resolve(candidateSet);
            if (classifier != null) {
                record = classifier.annotate(candidateSet, record);
            }
            records.add(record);
            // a study with several values matches any of them unless filtering exclusively
            if (mode == ResolutionMode.GROUP_LEVEL_ONLY && !record.isResolved()) {
                alternatives.put(candidateSet.id(), candidateSet.coarseValues());
            }
        }

        List<ResolvedRecord> selected = filterEngine.filter(records, criteria, alternatives);
        log.debug("{} resolution: {} entities, {} selected", descriptor.getName(), records.size(), selected.size());
        return new ResolutionOutcome(records, selected);
    }
}
