package com.platform.hacontroller.autoscale;

import com.platform.hacontroller.model.AggregateMetrics;
import com.platform.hacontroller.model.ScalingDecision;

import java.time.Instant;

/**
 * Autoscaler state for the scaling endpoint.
 *
 * @param belowCurrentSince start of the current run of recommendations below the replica count, or null
 */
public record AutoscaleStatus(
    boolean enabled,
    int currentReplicas,
    int minReplicas,
    int maxReplicas,
    Integer lastRecommendation,
    Instant belowCurrentSince,
    AggregateMetrics lastMetrics,
    ScalingDecision lastDecision,
    Instant lastTickAt
) {
}
