package com.liftlog.contract;

/**
 * A payload was rejected before anything was appended. Carries the offending
 * field and the violated constraint so a caller can reformulate the request.
 */
public class ValidationException extends RuntimeException {

    private final String field;
    private final String constraint;

    public ValidationException(String field, String constraint) {
        super("payload." + field + " " + constraint);
        this.field = field;
        this.constraint = constraint;
    }

    public String getField() {
        return field;
    }

    public String getConstraint() {
        return constraint;
    }
}
