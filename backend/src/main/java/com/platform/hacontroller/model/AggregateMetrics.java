package com.platform.hacontroller.model;

import java.time.Instant;
import java.util.Set;

/**
 * Windowed aggregate over a set of nodes.
 *
 * @param statistic   name of the statistic applied to cpu and memory
 * @param partial     true when at least one requested node had no sample in the window
 * @param missingNodes nodes excluded for lack of data
 */
public record AggregateMetrics(
    double cpuPercent,
    double memPercent,
    double maxLagSeconds,
    String statistic,
    int sampleCount,
    boolean partial,
    Set<String> missingNodes,
    Instant computedAt
) {

    public static AggregateMetrics empty(String statistic, Set<String> missingNodes, Instant at) {
        return new AggregateMetrics(0.0, 0.0, 0.0, statistic, 0, !missingNodes.isEmpty(), missingNodes, at);
    }

    public boolean hasData() {
        return sampleCount > 0;
    }
}
