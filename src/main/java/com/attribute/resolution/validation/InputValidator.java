package com.attribute.resolution.validation;

import com.attribute.resolution.core.model.DataTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Input validation for resolution requests.
 * Rejects tables lacking identity columns and identifiers unsafe for SQL text.
 */
public final class InputValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9_]+$");

    private InputValidator() {
        // utility class
    }

    /**
     * Validates that a caller table is present and carries the given columns.
     *
     * @param table       the caller's table
     * @param tableName   parameter name used in the error message
     * @param columnNames columns that must be present
     * @throws InvalidInputException if the table is null or a column is missing
     */
    public static void requireColumns(DataTable table, String tableName, String... columnNames) {
        if (table == null) {
            throw new InvalidInputException("Input parameter " + tableName + " must have assigned a data table");
        }
        List<String> missing = new ArrayList<>();
        for (String column : columnNames) {
            if (!table.hasColumn(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new InvalidInputException(
                    "Input parameter " + tableName + " must include column(s) " + String.join(", ", missing));
        }
    }

    /**
     * Validates that every row carries a non-blank value in the given identity columns.
     *
     * @throws InvalidInputException naming the first row and column without a value
     */
    public static void requireValues(DataTable table, String tableName, String... columnNames) {
        int index = 0;
        for (Map<String, Object> row : table.getRows()) {
            index++;
            for (String column : columnNames) {
                String value = DataTable.getString(row, column);
                if (value == null || value.isBlank()) {
                    throw new InvalidInputException(
                            "Input parameter " + tableName + " has no " + column + " value in row " + index);
                }
            }
        }
    }

    /**
     * Validates a table, column or parameter name that is embedded in SQL text.
     * Only alphanumeric characters and underscores are allowed.
     *
     * @throws InvalidInputException if the identifier is invalid
     */
    public static String validateIdentifier(String identifier, String what) {
        if (identifier == null || identifier.isBlank()) {
            throw new InvalidInputException(what + " must not be null or blank");
        }
        if (!IDENTIFIER.matcher(identifier).matches()) {
            throw new InvalidInputException(
                    what + " must contain only alphanumeric characters and underscores, got: '" + identifier + "'");
        }
        return identifier;
    }
}
