package com.platform.hacontroller.routing;

import com.platform.hacontroller.error.StaleMappingRejectedException;
import com.platform.hacontroller.model.EndpointMapping;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Consumer-side guard for endpoint mappings: only strictly newer generations are applied.
 * A redelivery of the generation already applied is ignored; an older one is a bug.
 */
@Slf4j
public class EndpointMappingTracker {

    private final String consumerName;
    private EndpointMapping applied;

    public EndpointMappingTracker(String consumerName) {
        this.consumerName = consumerName;
    }

    /**
     * @return true if the mapping was applied, false for a duplicate of the current generation
     * @throws StaleMappingRejectedException if the generation went backwards
     */
    public synchronized boolean accept(EndpointMapping mapping) {
        if (applied != null) {
            if (mapping.generation() == applied.generation()) {
                log.debug("[{}] Ignoring redelivered mapping generation {}", consumerName, mapping.generation());
                return false;
            }
            if (mapping.generation() < applied.generation()) {
                throw new StaleMappingRejectedException(applied.generation(), mapping.generation());
            }
        }
        applied = mapping;
        return true;
    }

    /**
     * Like {@link #accept} but reports a stale mapping instead of throwing.
     */
    public boolean offer(EndpointMapping mapping) {
        try {
            return accept(mapping);
        } catch (StaleMappingRejectedException e) {
            log.error("[{}] {}", consumerName, e.getMessage());
            return false;
        }
    }

    public synchronized Optional<EndpointMapping> current() {
        return Optional.ofNullable(applied);
    }

    public String getConsumerName() {
        return consumerName;
    }
}
