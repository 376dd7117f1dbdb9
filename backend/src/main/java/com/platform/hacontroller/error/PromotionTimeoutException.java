package com.platform.hacontroller.error;

import java.time.Duration;

/**
 * The promotion candidate did not report the primary role within the promotion timeout.
 */
public class PromotionTimeoutException extends ControlPlaneException {

    private final String candidateId;
    private final Duration timeout;

    public PromotionTimeoutException(String candidateId, Duration timeout) {
        super(ErrorCode.PROMOTION_TIMEOUT,
            String.format("Candidate %s did not report PRIMARY within %dms", candidateId, timeout.toMillis()));
        this.candidateId = candidateId;
        this.timeout = timeout;
    }

    public String getCandidateId() {
        return candidateId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
