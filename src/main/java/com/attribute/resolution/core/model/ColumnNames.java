package com.attribute.resolution.core.model;

/**
 * Column names of the pooled SEND data store and of the result tables.
 */
public final class ColumnNames {

    public static final String STUDYID = "STUDYID";
    public static final String USUBJID = "USUBJID";

    /** Message column used when filtering with uncertain rows included. */
    public static final String UNCERTAIN_MSG = "UNCERTAIN_MSG";

    /** Message column used when no filter is applied. */
    public static final String NOT_VALID_MSG = "NOT_VALID_MSG";

    /** Separator between messages merged from consecutive pipeline stages. */
    public static final String MESSAGE_SEPARATOR = "|";

    private ColumnNames() {
    }

    public static boolean isMessageColumn(String column) {
        return UNCERTAIN_MSG.equals(column) || NOT_VALID_MSG.equals(column);
    }
}
