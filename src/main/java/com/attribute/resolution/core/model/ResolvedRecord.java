package com.attribute.resolution.core.model;

import java.util.Objects;

/**
 * Outcome of resolving an attribute for one entity.
 * Created per invocation and never persisted.
 *
 * @param id     the entity the record belongs to
 * @param value  the resolved value, or {@code null} when unresolved
 * @param source granularity the value was taken from, {@code null} when unresolved
 * @param reason uncertainty reason, or {@code null} when none was classified
 */
public record ResolvedRecord(EntityId id, String value, ValueSource source, String reason) {

    public ResolvedRecord {
        Objects.requireNonNull(id, "id is required");
        if ((value == null) != (source == null)) {
            throw new IllegalArgumentException("value and source must both be set or both be absent");
        }
    }

    public static ResolvedRecord resolved(EntityId id, String value, ValueSource source) {
        return new ResolvedRecord(id, value, source, null);
    }

    public static ResolvedRecord unresolved(EntityId id) {
        return new ResolvedRecord(id, null, null, null);
    }

    public boolean isResolved() {
        return value != null;
    }

    public boolean hasReason() {
        return reason != null && !reason.isEmpty();
    }

    public ResolvedRecord withReason(String newReason) {
        return new ResolvedRecord(id, value, source, newReason);
    }

    public ResolvedRecord withoutReason() {
        return reason == null ? this : new ResolvedRecord(id, value, source, null);
    }
}
