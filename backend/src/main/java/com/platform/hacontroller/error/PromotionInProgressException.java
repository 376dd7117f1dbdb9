package com.platform.hacontroller.error;

/**
 * Raised when a manual failover is requested while another promotion is running
 * and the caller did not ask to abort it.
 */
public class PromotionInProgressException extends ControlPlaneException {

    public PromotionInProgressException() {
        super(ErrorCode.PROMOTION_IN_PROGRESS);
    }
}
