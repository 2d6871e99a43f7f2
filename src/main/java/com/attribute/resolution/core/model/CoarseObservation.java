package com.attribute.resolution.core.model;

import java.util.Objects;

/**
 * A candidate attribute value recorded for a whole study, e.g. a TS parameter value.
 * Applies to every animal of the study. An empty or blank value is treated as absent.
 */
public record CoarseObservation(String groupKey, String value) {

    public CoarseObservation {
        Objects.requireNonNull(groupKey, "groupKey is required");
    }

    public boolean hasValue() {
        return value != null && !value.isBlank();
    }
}
