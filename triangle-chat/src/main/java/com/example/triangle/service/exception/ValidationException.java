package com.example.triangle.service.exception;

/**
 * Rejected input. {@link #getField()} names the offending attribute.
 */
public class ValidationException extends ServiceException {

    private final String field;
    private final String reason;

    public ValidationException(String field, String reason) {
        super(ChatErrorCode.VALIDATION_ERROR, "%s %s".formatted(field, reason));
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
