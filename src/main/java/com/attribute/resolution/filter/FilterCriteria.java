package com.attribute.resolution.filter;

import com.attribute.resolution.core.model.AttributeValues;

import java.util.List;
import java.util.Set;

/**
 * Target value set and filtering modes.
 *
 * @param targetValues     requested values; blank entries are ignored, comparison is case-insensitive
 * @param exclusively      drop every study that exhibits a resolved value outside the target set
 * @param matchAll         keep only studies exhibiting every target value (when more than one is requested)
 * @param includeUncertain add every entity carrying an uncertainty reason, matched or not
 */
public record FilterCriteria(List<String> targetValues, boolean exclusively, boolean matchAll,
                             boolean includeUncertain) {

    public FilterCriteria {
        targetValues = targetValues != null
                ? targetValues.stream().filter(v -> !AttributeValues.isAbsent(v)).map(String::trim).toList()
                : List.of();
    }

    public static FilterCriteria none() {
        return new FilterCriteria(List.of(), false, false, false);
    }

    /**
     * Comparison keys of the target values.
     */
    public Set<String> targetKeys() {
        return AttributeValues.keys(targetValues);
    }

    /**
     * Whether any target value was requested. Without one no filtering takes place.
     */
    public boolean isActive() {
        return !targetValues.isEmpty();
    }
}
