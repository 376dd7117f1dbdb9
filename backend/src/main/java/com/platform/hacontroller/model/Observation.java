package com.platform.hacontroller.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * A single failure-detector instance's verdict about a node at a point in time.
 */
public record Observation(
    @NotBlank String observerId,
    @NotBlank String nodeId,
    @NotNull Verdict verdict,
    @NotNull Instant timestamp
) {

    public static Observation down(String observerId, String nodeId, Instant at) {
        return new Observation(observerId, nodeId, Verdict.DOWN, at);
    }

    public static Observation up(String observerId, String nodeId, Instant at) {
        return new Observation(observerId, nodeId, Verdict.UP, at);
    }

    public boolean isDown() {
        return verdict == Verdict.DOWN;
    }
}
