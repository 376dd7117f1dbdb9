package com.platform.hacontroller.error;

/**
 * Standardized error codes for the HA controller.
 * Each error has a unique code that clients can use to take specific actions.
 *
 * Format: HA-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: External system errors (collaborator, probes, event backbone)
 * - 5xx: Failover and routing errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {

    // ==================== Validation Errors (1xx) ====================

    VALIDATION_ERROR("HA-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("HA-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("HA-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("HA-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    UNKNOWN_OBSERVER("HA-104", "Observer is not part of the configured quorum", ErrorCategory.RECOVERABLE),
    CONSTRAINT_VIOLATION("HA-105", "Constraint violation", ErrorCategory.RECOVERABLE),

    // ==================== Resource Errors (3xx) ====================

    RESOURCE_NOT_FOUND("HA-300", "Resource not found", ErrorCategory.RECOVERABLE),
    NODE_NOT_FOUND("HA-301", "Node not found", ErrorCategory.RECOVERABLE),
    DUPLICATE_NODE("HA-311", "Node already registered", ErrorCategory.RECOVERABLE),
    PROMOTION_IN_PROGRESS("HA-312", "A promotion is already in progress", ErrorCategory.RECOVERABLE),

    // ==================== External System Errors (4xx) ====================

    TRANSIENT_PROBE_ERROR("HA-400", "Probe failed or timed out", ErrorCategory.RECOVERABLE),
    COLLABORATOR_ERROR("HA-410", "Topology collaborator error", ErrorCategory.RECOVERABLE),
    COLLABORATOR_UNAVAILABLE("HA-411", "Topology collaborator unavailable", ErrorCategory.RECOVERABLE),
    KAFKA_UNAVAILABLE("HA-420", "Kafka unavailable", ErrorCategory.RECOVERABLE),

    // ==================== Failover and Routing Errors (5xx) ====================

    PROMOTION_TIMEOUT("HA-500", "Candidate did not report primary role in time", ErrorCategory.RECOVERABLE),
    NO_VIABLE_PRIMARY("HA-501", "No viable primary candidate remains", ErrorCategory.FATAL),
    FENCING_FAILED("HA-502", "Old primary could not be fenced", ErrorCategory.FATAL),
    NO_PRIMARY("HA-510", "No primary is currently available", ErrorCategory.RECOVERABLE),
    STALE_MAPPING_REJECTED("HA-511", "Endpoint mapping generation regressed", ErrorCategory.FATAL),
    TOPOLOGY_INVARIANT_VIOLATION("HA-520", "Topology invariant violated", ErrorCategory.FATAL),

    // ==================== Internal Errors (9xx) ====================

    INTERNAL_ERROR("HA-900", "Internal server error", ErrorCategory.FATAL),
    UNEXPECTED_ERROR("HA-901", "Unexpected error", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("HA-902", "Configuration error", ErrorCategory.FATAL);

    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;

    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }

    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }

    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - retried automatically or fixable by the caller.
         */
        RECOVERABLE,

        /**
         * Fatal errors - automatic remediation stops, operator action required.
         */
        FATAL
    }
}
