package com.platform.hacontroller.detection;

import java.time.Instant;
import java.util.Set;

/**
 * Read-only view of the detector's bookkeeping for one node.
 */
public record NodeDetectionStatus(
    String nodeId,
    DetectorState state,
    Set<String> downObservers,
    Set<String> upObservers,
    int quorumSize,
    Instant windowStartedAt,
    Instant confirmedAt
) {
}
