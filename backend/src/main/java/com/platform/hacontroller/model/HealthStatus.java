package com.platform.hacontroller.model;

/**
 * Local health judgment of a node as seen by this controller's probe.
 */
public enum HealthStatus {
    HEALTHY,
    SUSPECT,
    DOWN;

    public boolean isRoutable() {
        return this == HEALTHY;
    }
}
