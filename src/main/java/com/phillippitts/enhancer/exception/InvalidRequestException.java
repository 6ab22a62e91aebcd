package com.phillippitts.enhancer.exception;

/**
 * Thrown at the REST boundary when request parameters cannot be turned into an
 * enhancement request (unknown operation, unsupported format, missing source).
 */
public class InvalidRequestException extends ImageEnhancerException {

    private final String field;

    public InvalidRequestException(String field, String reason) {
        super("Invalid request field '" + field + "': " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public String stage() {
        return "request";
    }
}
