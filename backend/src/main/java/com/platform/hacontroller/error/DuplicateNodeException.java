package com.platform.hacontroller.error;

/**
 * Raised when an operator registers a node id the topology already holds.
 */
public class DuplicateNodeException extends ControlPlaneException {

    private final String nodeId;

    public DuplicateNodeException(String nodeId) {
        super(ErrorCode.DUPLICATE_NODE, "Node already registered: " + nodeId);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
