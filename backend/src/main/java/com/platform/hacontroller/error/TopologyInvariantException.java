package com.platform.hacontroller.error;

/**
 * A topology mutation would have broken an invariant, typically a second PRIMARY.
 * The mutation is rejected and the previous snapshot stays in place.
 */
public class TopologyInvariantException extends ControlPlaneException {

    public TopologyInvariantException(String message) {
        super(ErrorCode.TOPOLOGY_INVARIANT_VIOLATION, message);
    }
}
