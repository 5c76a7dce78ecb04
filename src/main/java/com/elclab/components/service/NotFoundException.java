package com.elclab.components.service;

/**
 * Thrown when an operation references a component or category that does
 * not exist.
 */
public class NotFoundException extends ValidationException {

    /**
     * @param fieldName the key that failed to resolve (e.g., "identifier")
     * @param value     the value that was looked up
     */
    public NotFoundException(String fieldName, Object value) {
        super(fieldName, "No record found for " + fieldName + " '" + value + "'.");
    }
}
