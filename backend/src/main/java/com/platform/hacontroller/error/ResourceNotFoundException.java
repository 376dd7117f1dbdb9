package com.platform.hacontroller.error;

/**
 * A node (or other named resource) is not part of the current topology.
 */
public class ResourceNotFoundException extends ControlPlaneException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException node(String nodeId) {
        return new ResourceNotFoundException(ErrorCode.NODE_NOT_FOUND, "Node", nodeId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
