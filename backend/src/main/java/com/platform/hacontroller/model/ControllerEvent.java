package com.platform.hacontroller.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Represents a failover, routing or scaling event emitted by the controller.
 */
public record ControllerEvent(
    String eventId,
    EventType eventType,
    Severity severity,
    String nodeId,
    Instant timestamp,
    String message,
    Map<String, Object> metadata
) {
    public enum EventType {
        // Detection
        NODE_SUSPECT,
        NODE_DOWN_OBSERVED,
        NODE_RECOVERED,
        QUORUM_NOT_REACHED,
        PRIMARY_DOWN,

        // Promotion
        NODE_FENCED,
        FENCING_FAILED,
        PROMOTION_STARTED,
        PROMOTION_TIMEOUT,
        PRIMARY_PROMOTED,
        NO_VIABLE_PRIMARY,
        PRIMARY_ABSENT,
        MANUAL_FAILOVER,
        AUTOMATIC_PROMOTION_RESUMED,

        // Routing
        ENDPOINT_MAPPING_PUBLISHED,
        READ_DEGRADED,
        STALE_MAPPING_REJECTED,

        // Scaling and membership
        SCALING_DECISION,
        NODE_REGISTERED,
        NODE_DEREGISTERED
    }

    public enum Severity {
        INFO,
        WARNING,
        CRITICAL
    }

    public static ControllerEvent create(EventType type, Severity severity, String nodeId, String message) {
        return new ControllerEvent(
            UUID.randomUUID().toString(),
            type,
            severity,
            nodeId,
            Instant.now(),
            message,
            Map.of()
        );
    }

    public static ControllerEvent create(EventType type, Severity severity, String nodeId, String message,
            Map<String, Object> metadata) {
        return new ControllerEvent(
            UUID.randomUUID().toString(),
            type,
            severity,
            nodeId,
            Instant.now(),
            message,
            metadata
        );
    }

    public static ControllerEvent info(EventType type, String nodeId, String message) {
        return create(type, Severity.INFO, nodeId, message);
    }

    public static ControllerEvent warning(EventType type, String nodeId, String message) {
        return create(type, Severity.WARNING, nodeId, message);
    }

    public static ControllerEvent critical(EventType type, String nodeId, String message) {
        return create(type, Severity.CRITICAL, nodeId, message);
    }

    /**
     * Alerts require operator attention.
     */
    public boolean isAlert() {
        return severity == Severity.CRITICAL;
    }
}
