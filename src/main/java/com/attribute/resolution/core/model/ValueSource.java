package com.attribute.resolution.core.model;

/**
 * Granularity a resolved value was taken from.
 */
public enum ValueSource {
    /**
     * Entity-level evidence (one value recorded for the animal).
     */
    FINE,

    /**
     * Group-level evidence (one value recorded for the study).
     */
    COARSE
}
