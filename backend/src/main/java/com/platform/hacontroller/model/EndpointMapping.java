package com.platform.hacontroller.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Logical role to physical address mapping, versioned by a strictly increasing generation.
 * Consumers must ignore any mapping whose generation is not newer than the last one applied.
 *
 * @param degraded true when reads fell back to the primary because no healthy replica exists
 */
public record EndpointMapping(
    long generation,
    String writeEndpoint,
    String primaryNodeId,
    List<String> readEndpoints,
    boolean degraded,
    Instant publishedAt
) {

    /**
     * Same routing content, ignoring generation and publication time.
     */
    public boolean routesSameAs(EndpointMapping other) {
        return other != null
            && Objects.equals(writeEndpoint, other.writeEndpoint)
            && Objects.equals(primaryNodeId, other.primaryNodeId)
            && readEndpoints.equals(other.readEndpoints)
            && degraded == other.degraded;
    }
}
