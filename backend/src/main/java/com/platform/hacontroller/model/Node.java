package com.platform.hacontroller.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable view of one store node.
 * lastSeen and lag are null until the first successful probe.
 */
public record Node(
    String id,
    NodeRole role,
    String address,
    Instant lastSeen,
    Duration lag,
    HealthStatus health
) {

    public static Node registered(NodeSpec spec) {
        return new Node(spec.id(), spec.role(), spec.address(), null, null, HealthStatus.HEALTHY);
    }

    public Node withRole(NodeRole newRole) {
        return new Node(id, newRole, address, lastSeen, lag, health);
    }

    public Node withHealth(HealthStatus newHealth) {
        return new Node(id, role, address, lastSeen, lag, newHealth);
    }

    /**
     * Records a successful probe. A null lag keeps the last known value.
     */
    public Node withProbeSuccess(Instant seenAt, Duration observedLag) {
        return new Node(id, role, address, seenAt, observedLag != null ? observedLag : lag, HealthStatus.HEALTHY);
    }

    public Node withLag(Duration observedLag) {
        return new Node(id, role, address, lastSeen, observedLag, health);
    }

    public boolean isPrimary() {
        return role == NodeRole.PRIMARY;
    }

    public boolean isReplica() {
        return role == NodeRole.REPLICA;
    }

    public boolean isFenced() {
        return role == NodeRole.FENCED;
    }
}
