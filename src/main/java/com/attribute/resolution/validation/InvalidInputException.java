package com.attribute.resolution.validation;

/**
 * Thrown when a caller-supplied table, option or descriptor is unusable.
 * Always raised before any query is sent to the data store.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
