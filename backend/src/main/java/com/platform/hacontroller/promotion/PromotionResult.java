package com.platform.hacontroller.promotion;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one promotion run.
 *
 * @param generation mapping generation published for the new primary, null unless promoted
 */
public record PromotionResult(
    String promotionId,
    Outcome outcome,
    String trigger,
    String oldPrimaryId,
    String newPrimaryId,
    List<String> attemptedCandidates,
    Long generation,
    Instant startedAt,
    long durationMs,
    String message
) {

    public enum Outcome {
        PROMOTED,
        NO_VIABLE_PRIMARY,
        FENCING_FAILED,
        ABORTED,
        DISCARDED_STALE
    }

    public boolean isSuccess() {
        return outcome == Outcome.PROMOTED;
    }
}
