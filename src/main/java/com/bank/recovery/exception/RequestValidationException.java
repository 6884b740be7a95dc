package com.bank.recovery.exception;

/**
 * Malformed or inapplicable caller input. Raised before any state is mutated.
 */
public class RequestValidationException extends RuntimeException {

    private final boolean notFound;
    private final String field;

    private RequestValidationException(String message, String field, boolean notFound) {
        super(message);
        this.field = field;
        this.notFound = notFound;
    }

    public static RequestValidationException invalid(String field, String message) {
        return new RequestValidationException(message, field, false);
    }

    public static RequestValidationException notFound(String what, String id) {
        return new RequestValidationException(what + " not found: " + id, null, true);
    }

    public boolean isNotFound() {
        return notFound;
    }

    public String getField() {
        return field;
    }
}
