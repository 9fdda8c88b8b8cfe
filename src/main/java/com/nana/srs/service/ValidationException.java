package com.nana.srs.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ValidationException - Service Layer Checked Exception
 *
 * <p>Carries every field-level error found in one pass as a
 * {@code Map<String, String>} of field name to message, so the CLI can print
 * all problems with an entry at once.
 *
 * <p>Checked, because it is a recoverable input problem: the user fixes the
 * value and tries again.
 *
 * <p>FIELD KEY CONVENTION:
 * Keys match the {@link com.nana.srs.domain.StudentRecord} property names
 * ({@code "id"}, {@code "name"}, {@code "grade"}, {@code "email"}).
 */
public class ValidationException extends Exception {

    /** Field name to error message, in the order the errors were detected. */
    private final Map<String, String> fieldErrors;

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    /**
     * @param fieldErrors map of field name to error message; must not be null
     */
    public ValidationException(Map<String, String> fieldErrors) {
        super(buildMessage(fieldErrors));
        this.fieldErrors = Collections.unmodifiableMap(
                new LinkedHashMap<>(fieldErrors));
    }

    /**
     * Convenience constructor for a single-field failure.
     */
    public ValidationException(String fieldName, String errorMessage) {
        super(fieldName + ": " + errorMessage);
        Map<String, String> map = new LinkedHashMap<>();
        map.put(fieldName, errorMessage);
        this.fieldErrors = Collections.unmodifiableMap(map);
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /** @return an unmodifiable map of field name to error message */
    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    public boolean hasError(String fieldName) {
        return fieldErrors.containsKey(fieldName);
    }

    /** @return the message for that field, or null if it has none */
    public String getError(String fieldName) {
        return fieldErrors.get(fieldName);
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    /**
     * Builds the summary used as {@link Exception#getMessage()},
     * e.g. "Validation failed: name: must not be blank; email: must not be null".
     */
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
