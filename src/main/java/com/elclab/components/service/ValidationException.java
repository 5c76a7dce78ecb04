package com.elclab.components.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ValidationException - Service Layer Checked Exception
 *
 * <p>Carries every field-level error found in one validation pass as a
 * {@code field -> message} map, so the caller can report all problems at
 * once instead of one per attempt.
 *
 * <p>Checked because a rule violation is recoverable: the caller corrects
 * its input and retries. {@link NotFoundException} and
 * {@link DuplicateNameException} specialise it for the two lookup-based
 * failures.
 *
 * <p>FIELD KEY CONVENTION:
 * Keys match the domain property names ("identifier", "price", "name",
 * "componentId", ...).
 */
public class ValidationException extends Exception {

    /** Insertion-ordered so errors are reported in detection order. */
    private final Map<String, String> fieldErrors;

    /**
     * @param fieldErrors field name to error message; must not be null
     */
    public ValidationException(Map<String, String> fieldErrors) {
        super(buildMessage(fieldErrors));
        this.fieldErrors = Collections.unmodifiableMap(
                new LinkedHashMap<>(fieldErrors));
    }

    /**
     * Single-field failure.
     *
     * @param fieldName    the invalid field
     * @param errorMessage human-readable description
     */
    public ValidationException(String fieldName, String errorMessage) {
        super(fieldName + ": " + errorMessage);
        Map<String, String> map = new LinkedHashMap<>();
        map.put(fieldName, errorMessage);
        this.fieldErrors = Collections.unmodifiableMap(map);
    }

    /** @return unmodifiable map of field name to error message */
    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    public boolean hasError(String fieldName) {
        return fieldErrors.containsKey(fieldName);
    }

    /**
     * @param fieldName field to look up
     * @return the error message, or null if that field has none
     */
    public String getError(String fieldName) {
        return fieldErrors.get(fieldName);
    }

    private static String buildMessage(Map<String, String> errors) {
        if (errors == null || errors.isEmpty()) {
            return "Validation failed with no specific field errors.";
        }
        StringBuilder sb = new StringBuilder("Validation failed: ");
        errors.forEach((field, msg) ->
                sb.append(field).append(": ").append(msg).append("; "));
        sb.setLength(sb.length() - 2);
        return sb.toString();
    }
}
