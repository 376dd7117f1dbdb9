package com.platform.hacontroller.promotion;

import java.time.Instant;

/**
 * Snapshot of the coordinator for the status endpoint.
 */
public record PromotionStatus(
    boolean inProgress,
    boolean automaticPromotionHalted,
    String currentPromotionId,
    PromotionResult lastResult,
    Instant primaryAbsentSince
) {
}
