package com.attribute.resolution.core.model;

import java.util.Objects;

/**
 * Identity of a resolution target: an animal within a study, or a study on its own
 * when the attribute is resolved at group level only.
 *
 * @param groupKey  the study identifier (STUDYID)
 * @param entityKey the animal identifier (USUBJID), {@code null} for group-level targets
 */
public record EntityId(String groupKey, String entityKey) {

    public EntityId {
        Objects.requireNonNull(groupKey, "groupKey is required");
    }

    public static EntityId of(String groupKey, String entityKey) {
        Objects.requireNonNull(entityKey, "entityKey is required");
        return new EntityId(groupKey, entityKey);
    }

    public static EntityId ofGroup(String groupKey) {
        return new EntityId(groupKey, null);
    }

    public boolean isGroupOnly() {
        return entityKey == null;
    }

    @Override
    public String toString() {
        return entityKey == null ? groupKey : groupKey + "/" + entityKey;
    }
}
