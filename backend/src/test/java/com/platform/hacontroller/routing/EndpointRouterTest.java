package com.platform.hacontroller.routing;

import com.platform.hacontroller.collaborator.TopologyCollaborator;
import com.platform.hacontroller.error.NoPrimaryException;
import com.platform.hacontroller.events.ControllerEventPublisher;
import com.platform.hacontroller.model.EndpointMapping;
import com.platform.hacontroller.model.HealthStatus;
import com.platform.hacontroller.model.NodeRole;
import com.platform.hacontroller.model.NodeSpec;
import com.platform.hacontroller.observability.MetricsRegistry;
import com.platform.hacontroller.observability.StructuredLogger;
import com.platform.hacontroller.support.MutableClock;
import com.platform.hacontroller.topology.TopologyStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class EndpointRouterTest {

    private TopologyStore store;
    private TopologyCollaborator collaborator;
    private List<EndpointMapping> received;
    private EndpointRouter router;

    @BeforeEach
    void setUp() {
        MetricsRegistry metrics = new MetricsRegistry(new SimpleMeterRegistry());
        store = new TopologyStore(metrics);
        collaborator = mock(TopologyCollaborator.class);
        received = new ArrayList<>();
        EndpointMappingListener listener = received::add;
        router = new EndpointRouter(store, collaborator, List.of(listener), mock(ControllerEventPublisher.class),
            new StructuredLogger(), metrics, MutableClock.startingAt("2026-03-01T10:00:00Z"));
        router.registerWithTopology();

        store.register(NodeSpec.primary("primary-1", "primary-1:3306"));
        store.register(NodeSpec.replica("replica-1", "replica-1:3306"));
        store.register(NodeSpec.replica("replica-2", "replica-2:3306"));
    }

    @Test
    void routesWritesToPrimaryAndReadsToHealthyReplicas() {
        assertThat(router.writeEndpoint()).isEqualTo("primary-1:3306");
        assertThat(router.readEndpoints()).containsExactly("replica-1:3306", "replica-2:3306");

        EndpointMapping latest = router.latestMapping().orElseThrow();
        assertThat(latest.writeEndpoint()).isEqualTo("primary-1:3306");
        assertThat(latest.primaryNodeId()).isEqualTo("primary-1");
        assertThat(latest.degraded()).isFalse();
    }

    @Test
    void suspectReplicaIsNotRoutedTo() {
        store.update("replica-2", n -> n.withHealth(HealthStatus.SUSPECT));

        assertThat(router.readEndpoints()).containsExactly("replica-1:3306");
        assertThat(router.latestMapping().orElseThrow().readEndpoints()).containsExactly("replica-1:3306");
    }

    @Test
    void readsFallBackToPrimaryInDegradedMode() {
        store.update("replica-1", n -> n.withHealth(HealthStatus.DOWN));
        store.update("replica-2", n -> n.withHealth(HealthStatus.DOWN));

        EndpointMapping latest = router.latestMapping().orElseThrow();
        assertThat(latest.readEndpoints()).containsExactly("primary-1:3306");
        assertThat(latest.degraded()).isTrue();
    }

    @Test
    void writeEndpointWithoutPrimaryFails() {
        store.setRole("primary-1", NodeRole.FENCED);

        assertThatThrownBy(() -> router.writeEndpoint()).isInstanceOf(NoPrimaryException.class);
        assertThat(router.latestMapping().orElseThrow().writeEndpoint()).isNull();
    }

    @Test
    void generationsStrictlyIncrease() {
        store.update("replica-1", n -> n.withHealth(HealthStatus.SUSPECT));
        store.update("replica-1", n -> n.withHealth(HealthStatus.HEALTHY));
        router.publish();
        router.publish();

        assertThat(received).extracting(EndpointMapping::generation)
            .isSorted()
            .doesNotHaveDuplicates();
        assertThat(router.currentGeneration()).isEqualTo(received.get(received.size() - 1).generation());
    }

    @Test
    void unchangedRoutingIsNotRepublished() {
        long generation = router.currentGeneration();

        store.update("replica-1", n -> n.withRole(NodeRole.REPLICA));
        assertThat(router.publishIfChanged()).isEmpty();

        assertThat(router.currentGeneration()).isEqualTo(generation);
    }

    @Test
    void noPublicationWhilePromotionInProgress() {
        long generation = router.currentGeneration();
        store.tryBeginPromotion();

        store.setRole("primary-1", NodeRole.FENCED);
        assertThat(router.currentGeneration()).isEqualTo(generation);

        store.endPromotion();
        assertThat(router.currentGeneration()).isEqualTo(generation + 1);
        assertThat(router.latestMapping().orElseThrow().writeEndpoint()).isNull();
    }

    @Test
    void failingConsumerDoesNotStopPublication() {
        doThrow(new IllegalStateException("down")).when(collaborator).onEndpointMapping(any());

        EndpointMapping mapping = router.publish();

        assertThat(received).last().isEqualTo(mapping);
    }
}
