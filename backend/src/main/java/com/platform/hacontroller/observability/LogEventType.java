package com.platform.hacontroller.observability;

/**
 * Event types written by {@link StructuredLogger}.
 */
public enum LogEventType {
    // Failover
    PRIMARY_DOWN_CONFIRMED,
    NODE_FENCED,
    FENCING_FAILED,
    PROMOTION_STARTED,
    PROMOTION_COMPLETED,
    PROMOTION_FAILED,
    AUTOMATION_HALTED,
    AUTOMATION_RESUMED,

    // Scaling
    SCALING_DECISION,
    SCALING_DEFERRED,

    // Routing
    MAPPING_PUBLISHED,
    MAPPING_REJECTED,

    // Lifecycle
    APPLICATION_STARTED,
    SHUTDOWN_STARTED,
    SHUTDOWN_COMPLETED
}
