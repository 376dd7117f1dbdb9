package com.platform.hacontroller.routing;

import com.platform.hacontroller.collaborator.TopologyCollaborator;
import com.platform.hacontroller.error.NoPrimaryException;
import com.platform.hacontroller.events.ControllerEventPublisher;
import com.platform.hacontroller.model.ControllerEvent;
import com.platform.hacontroller.model.EndpointMapping;
import com.platform.hacontroller.model.Node;
import com.platform.hacontroller.observability.MetricsRegistry;
import com.platform.hacontroller.observability.StructuredLogger;
import com.platform.hacontroller.topology.TopologySnapshot;
import com.platform.hacontroller.topology.TopologyStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Maps logical write/read roles to physical addresses and publishes a new,
 * strictly higher generation whenever the routed content changes.
 *
 * Reads go to healthy replicas; with none left they fall back to the primary
 * (degraded mode). While a promotion runs nothing is published: the coordinator
 * publishes once the new primary is in place.
 */
@Slf4j
@Component
public class EndpointRouter {

    private final TopologyStore topologyStore;
    private final TopologyCollaborator collaborator;
    private final List<EndpointMappingListener> listeners;
    private final ControllerEventPublisher eventPublisher;
    private final StructuredLogger structuredLogger;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;

    private final AtomicLong generation = new AtomicLong(0);
    private final AtomicReference<EndpointMapping> latest = new AtomicReference<>();

    public EndpointRouter(TopologyStore topologyStore,
                          TopologyCollaborator collaborator,
                          List<EndpointMappingListener> listeners,
                          ControllerEventPublisher eventPublisher,
                          StructuredLogger structuredLogger,
                          MetricsRegistry metricsRegistry,
                          Clock clock) {
        this.topologyStore = topologyStore;
        this.collaborator = collaborator;
        this.listeners = listeners;
        this.eventPublisher = eventPublisher;
        this.structuredLogger = structuredLogger;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void registerWithTopology() {
        topologyStore.addListener((previous, current) -> {
            if (current.promotionInProgress()) {
                log.debug("Promotion in progress, holding back mapping publication");
                return;
            }
            publishIfChanged();
        });
    }

    /**
     * Address of the current primary.
     *
     * @throws NoPrimaryException if no node is PRIMARY
     */
    public String writeEndpoint() {
        return topologyStore.snapshot().primary()
            .map(Node::address)
            .orElseThrow(NoPrimaryException::new);
    }

    /**
     * Healthy replica addresses, or the primary's address when there are none.
     */
    public List<String> readEndpoints() {
        return readRoute(topologyStore.snapshot()).addresses();
    }

    public Optional<EndpointMapping> latestMapping() {
        return Optional.ofNullable(latest.get());
    }

    public long currentGeneration() {
        return generation.get();
    }

    /**
     * Publish the current routing unconditionally under the next generation.
     */
    public synchronized EndpointMapping publish() {
        EndpointMapping mapping = compute(topologyStore.snapshot(), generation.incrementAndGet());
        latest.set(mapping);
        deliver(mapping);
        return mapping;
    }

    /**
     * Publish only if the routed content differs from the last published mapping.
     */
    public synchronized Optional<EndpointMapping> publishIfChanged() {
        EndpointMapping candidate = compute(topologyStore.snapshot(), generation.get() + 1);
        if (candidate.routesSameAs(latest.get())) {
            return Optional.empty();
        }
        generation.set(candidate.generation());
        latest.set(candidate);
        deliver(candidate);
        return Optional.of(candidate);
    }

    EndpointMapping compute(TopologySnapshot snapshot, long nextGeneration) {
        Optional<Node> primary = snapshot.primary();
        ReadRoute reads = readRoute(snapshot);
        return new EndpointMapping(
            nextGeneration,
            primary.map(Node::address).orElse(null),
            primary.map(Node::id).orElse(null),
            reads.addresses(),
            reads.degraded(),
            clock.instant());
    }

    private ReadRoute readRoute(TopologySnapshot snapshot) {
        List<String> healthy = snapshot.healthyReplicas().stream()
            .map(Node::address)
            .collect(Collectors.toList());
        if (!healthy.isEmpty()) {
            return new ReadRoute(List.copyOf(healthy), false);
        }
        return new ReadRoute(snapshot.primary().map(p -> List.of(p.address())).orElse(List.of()), true);
    }

    private void deliver(EndpointMapping mapping) {
        structuredLogger.routing().mappingPublished(mapping.generation(),
            String.valueOf(mapping.writeEndpoint()), mapping.readEndpoints().size(), mapping.degraded());
        metricsRegistry.recordEndpointPublished(mapping.generation(), mapping.degraded());

        if (mapping.degraded()) {
            log.warn("Read routing degraded: no healthy replica, reads go to {}", mapping.readEndpoints());
            eventPublisher.publish(ControllerEvent.warning(ControllerEvent.EventType.READ_DEGRADED,
                mapping.primaryNodeId(), "No healthy replica, reads fall back to the primary"));
        }

        try {
            collaborator.onEndpointMapping(mapping);
        } catch (RuntimeException e) {
            log.warn("Collaborator did not take mapping generation {}: {}", mapping.generation(), e.getMessage());
        }
        for (EndpointMappingListener listener : listeners) {
            try {
                listener.onEndpointMapping(mapping);
            } catch (RuntimeException e) {
                log.warn("Mapping listener {} failed on generation {}: {}",
                    listener.getClass().getSimpleName(), mapping.generation(), e.getMessage());
            }
        }

        eventPublisher.publish(ControllerEvent.create(ControllerEvent.EventType.ENDPOINT_MAPPING_PUBLISHED,
            ControllerEvent.Severity.INFO, mapping.primaryNodeId(),
            "Endpoint mapping generation " + mapping.generation(),
            Map.of("generation", mapping.generation(),
                "readEndpoints", mapping.readEndpoints(),
                "degraded", mapping.degraded())));
    }

    private record ReadRoute(List<String> addresses, boolean degraded) {
    }
}
