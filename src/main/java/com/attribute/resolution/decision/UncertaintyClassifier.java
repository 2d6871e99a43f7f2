package com.attribute.resolution.decision;

import com.attribute.resolution.aggregation.CandidateSet;
import com.attribute.resolution.core.model.AttributeDescriptor;
import com.attribute.resolution.core.model.AttributeValues;
import com.attribute.resolution.core.model.ReferenceVocabulary;
import com.attribute.resolution.core.model.ResolvedRecord;
import com.attribute.resolution.core.model.UncertaintyCondition;
import com.attribute.resolution.core.model.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Explains why a resolved value is absent or not trustworthy.
 *
 * <p>The reference vocabulary is bound per invocation, so classification depends only on
 * its arguments. Missing data never raises an error; it is itself a reported condition.</p>
 */
public class UncertaintyClassifier {

    static final String CONDITION_SEPARATOR = " & ";

    private final AttributeDescriptor descriptor;
    private final ReferenceVocabulary vocabulary;

    public UncertaintyClassifier(AttributeDescriptor descriptor, ReferenceVocabulary vocabulary) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor is required");
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary is required");
    }

    /**
     * Returns every applicable condition, in reporting order.
     */
    public List<UncertaintyCondition> classify(CandidateSet candidates, ResolvedRecord record) {
        List<UncertaintyCondition> conditions = new ArrayList<>();

        if (!record.isResolved()) {
            if (candidates.fineCount() > 1) {
                conditions.add(UncertaintyCondition.MULTIPLE_FINE_VALUES);
            } else if (candidates.coarseCount() > 1) {
                conditions.add(UncertaintyCondition.MULTIPLE_COARSE_VALUES);
            } else {
                conditions.add(UncertaintyCondition.NO_VALUES);
            }
        } else if (!vocabulary.contains(record.value())) {
            conditions.add(record.source() == ValueSource.FINE
                    ? UncertaintyCondition.INVALID_FINE_VALUE
                    : UncertaintyCondition.INVALID_COARSE_VALUE);
        }

        if (candidates.hasFineValues() && candidates.hasCoarseValues()
                && !AttributeValues.keys(candidates.coarseValues())
                        .containsAll(AttributeValues.keys(candidates.fineValues()))) {
            conditions.add(UncertaintyCondition.SOURCE_MISMATCH);
        }
        return conditions;
    }

    /**
     * Classifies the record and renders the reason, e.g.
     * {@code "ROUTE: Multiple values for EXROUTE found"}.
     *
     * @return the record carrying its reason, or without a reason when no condition applies
     */
    public ResolvedRecord annotate(CandidateSet candidates, ResolvedRecord record) {
        List<UncertaintyCondition> conditions = classify(candidates, record);
        if (conditions.isEmpty()) {
            return record.withoutReason();
        }
        return record.withReason(render(conditions));
    }

    String render(List<UncertaintyCondition> conditions) {
        return descriptor.getName() + ": " + conditions.stream()
                .map(descriptor::describe)
                .collect(Collectors.joining(CONDITION_SEPARATOR));
    }

    public ReferenceVocabulary getVocabulary() {
        return vocabulary;
    }
}
