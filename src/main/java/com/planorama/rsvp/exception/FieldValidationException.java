package com.planorama.rsvp.exception;

/**
 * Exception thrown when a request is well-formed but breaks a business rule on one field.
 * Rendered like bean validation failures, with a field error entry.
 *
 * @author Planorama Team
 */
public class FieldValidationException extends RuntimeException {

    private final String field;

    public FieldValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
