package com.attribute.resolution.core.model;

/**
 * Describes which granularities an attribute is recorded at.
 * Selects the reachable branches of the resolution precedence.
 */
public enum ResolutionMode {
    /**
     * Attribute recorded per animal and per study (e.g. route of administration).
     * Entity-level evidence takes precedence over study-level evidence.
     */
    ENTITY_AND_GROUP_LEVEL(true),

    /**
     * Attribute recorded per study only (e.g. study design).
     * Each study is its own resolution target.
     */
    GROUP_LEVEL_ONLY(false);

    private final boolean entityLevelSource;

    ResolutionMode(boolean entityLevelSource) {
        this.entityLevelSource = entityLevelSource;
    }

    public boolean hasEntityLevelSource() {
        return entityLevelSource;
    }
}
