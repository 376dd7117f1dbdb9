package com.platform.hacontroller.model;

import java.time.Instant;

/**
 * Desired replica count handed to the topology collaborator.
 */
public record ScalingDecision(
    int currentReplicas,
    int desiredReplicas,
    Direction direction,
    String reason,
    Instant timestamp
) {

    public enum Direction {
        SCALE_UP,
        SCALE_DOWN
    }

    public static ScalingDecision of(int current, int desired, String reason, Instant at) {
        Direction direction = desired > current ? Direction.SCALE_UP : Direction.SCALE_DOWN;
        return new ScalingDecision(current, desired, direction, reason, at);
    }
}
