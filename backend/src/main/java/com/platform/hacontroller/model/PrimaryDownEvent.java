package com.platform.hacontroller.model;

import java.time.Instant;
import java.util.Set;

/**
 * Quorum-backed confirmation that the current primary has failed.
 */
public record PrimaryDownEvent(
    String nodeId,
    Set<String> confirmingObservers,
    Instant confirmedAt
) {
}
