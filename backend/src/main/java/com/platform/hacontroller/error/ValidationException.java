package com.platform.hacontroller.error;

/**
 * Rejected input: malformed telemetry, an observation from an observer outside the
 * quorum, or an operator request that names an ineligible node.
 */
public class ValidationException extends ControlPlaneException {

    private final String field;
    private final Object rejectedValue;

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }

    public ValidationException(String field, Object rejectedValue, String message) {
        this(ErrorCode.INVALID_FIELD_VALUE, field, rejectedValue, message);
    }

    private ValidationException(ErrorCode errorCode, String field, Object rejectedValue, String message) {
        super(errorCode, String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public static ValidationException unknownObserver(String observerId) {
        return new ValidationException(ErrorCode.UNKNOWN_OBSERVER, "observerId", observerId,
            "observer is not part of the configured quorum");
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
