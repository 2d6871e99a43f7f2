package com.attribute.resolution.core.model;

/**
 * Conditions under which a resolved value is absent or not trustworthy.
 * Declared in the order they are reported.
 */
public enum UncertaintyCondition {
    /**
     * More than one distinct entity-level value.
     */
    MULTIPLE_FINE_VALUES("multiple fine values found"),

    /**
     * No entity-level value and more than one distinct group-level value.
     */
    MULTIPLE_COARSE_VALUES("multiple group-level values found and no entity-level value"),

    /**
     * Neither an entity-level nor a group-level value.
     */
    NO_VALUES("both entity-level and group-level values are missing"),

    /**
     * Resolved from an entity-level value outside the reference vocabulary.
     */
    INVALID_FINE_VALUE("entity-level value does not contain a valid reference-vocabulary value"),

    /**
     * Resolved from a group-level value outside the reference vocabulary.
     */
    INVALID_COARSE_VALUE("group-level value does not contain a valid reference-vocabulary value"),

    /**
     * Entity-level values are not all among the group-level values.
     */
    SOURCE_MISMATCH("mismatch between entity-level and group-level values");

    private final String defaultMessage;

    UncertaintyCondition(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
