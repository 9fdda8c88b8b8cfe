package com.nana.srs.service;

/**
 * Raised when text supplied as a student id is not a well-formed positive
 * integer. Reported against the {@code "id"} field.
 *
 * <p>The CLI recovers from it by asking for the id again.
 */
public class InvalidIdException extends ValidationException {

    public static final String FIELD_ID = "id";

    /** The raw text that failed to parse, as the user typed it. */
    private final String rawInput;

    public InvalidIdException(String rawInput, String errorMessage) {
        super(FIELD_ID, errorMessage);
        this.rawInput = rawInput;
    }

    public String getRawInput() {
        return rawInput;
    }
}
