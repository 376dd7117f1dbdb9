package com.platform.hacontroller.error;

/**
 * A consumer received an endpoint mapping older than one it already applied.
 * Generations only ever increase, so this indicates a bug.
 */
public class StaleMappingRejectedException extends ControlPlaneException {

    private final long lastAppliedGeneration;
    private final long rejectedGeneration;

    public StaleMappingRejectedException(long lastAppliedGeneration, long rejectedGeneration) {
        super(ErrorCode.STALE_MAPPING_REJECTED,
            String.format("Rejected mapping generation %d, already applied %d",
                rejectedGeneration, lastAppliedGeneration));
        this.lastAppliedGeneration = lastAppliedGeneration;
        this.rejectedGeneration = rejectedGeneration;
    }

    public long getLastAppliedGeneration() {
        return lastAppliedGeneration;
    }

    public long getRejectedGeneration() {
        return rejectedGeneration;
    }
}
