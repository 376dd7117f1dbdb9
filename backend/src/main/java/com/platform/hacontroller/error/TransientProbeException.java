package com.platform.hacontroller.error;

/**
 * A probe failed to reach a node or timed out. Absorbed by the health probe and
 * retried on the next cycle; never escalated on its own.
 */
public class TransientProbeException extends ControlPlaneException {

    private final String nodeId;

    public TransientProbeException(String nodeId, String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_PROBE_ERROR, message, cause);
        this.nodeId = nodeId;
    }

    public TransientProbeException(String nodeId, String message) {
        super(ErrorCode.TRANSIENT_PROBE_ERROR, message);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
