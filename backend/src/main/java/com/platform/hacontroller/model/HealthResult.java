package com.platform.hacontroller.model;

import java.time.Duration;

/**
 * Outcome of one probe. A probe never reports DOWN on its own: a single probe path
 * cannot tell a dead node from a partition, so failures are SUSPECT.
 */
public record HealthResult(
    HealthStatus status,
    Duration lag,
    String error,
    long latencyMs
) {

    public static HealthResult healthy(Duration lag, long latencyMs) {
        return new HealthResult(HealthStatus.HEALTHY, lag, null, latencyMs);
    }

    public static HealthResult suspect(String error) {
        return new HealthResult(HealthStatus.SUSPECT, null, error, -1);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
