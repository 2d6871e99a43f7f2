package com.attribute.resolution.core.model;

import java.util.Objects;

/**
 * A candidate attribute value recorded for a single animal, e.g. an EXROUTE value.
 * An empty or blank value is treated as absent.
 */
public record FineObservation(String groupKey, String entityKey, String value) {

    public FineObservation {
        Objects.requireNonNull(groupKey, "groupKey is required");
        Objects.requireNonNull(entityKey, "entityKey is required");
    }

    public EntityId entityId() {
        return EntityId.of(groupKey, entityKey);
    }

    public boolean hasValue() {
        return value != null && !value.isBlank();
    }
}
