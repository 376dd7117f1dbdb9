package com.platform.hacontroller.topology;

import com.platform.hacontroller.error.ResourceNotFoundException;
import com.platform.hacontroller.error.TopologyInvariantException;
import com.platform.hacontroller.model.HealthStatus;
import com.platform.hacontroller.model.Node;
import com.platform.hacontroller.model.NodeRole;
import com.platform.hacontroller.model.NodeSpec;
import com.platform.hacontroller.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopologyStoreTest {

    private SimpleMeterRegistry meterRegistry;
    private TopologyStore store;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        store = new TopologyStore(new MetricsRegistry(meterRegistry));
        store.register(NodeSpec.primary("primary-1", "primary-1:3306"));
        store.register(NodeSpec.replica("replica-1", "replica-1:3306"));
        store.register(NodeSpec.replica("replica-2", "replica-2:3306"));
    }

    @Test
    void registerIsIdempotent() {
        long version = store.snapshot().version();

        Node again = store.register(NodeSpec.replica("replica-1", "elsewhere:3306"));

        assertThat(again.address()).isEqualTo("replica-1:3306");
        assertThat(store.snapshot().version()).isEqualTo(version);
    }

    @Test
    void secondPrimaryIsRejectedAndTopologyUnchanged() {
        assertThatThrownBy(() -> store.setRole("replica-1", NodeRole.PRIMARY))
            .isInstanceOf(TopologyInvariantException.class)
            .hasMessageContaining("primary-1");

        assertThat(store.snapshot().primaryId()).contains("primary-1");
        assertThat(store.node("replica-1").orElseThrow().role()).isEqualTo(NodeRole.REPLICA);
    }

    @Test
    void registeringAnotherPrimaryIsRejected() {
        assertThatThrownBy(() -> store.register(NodeSpec.primary("primary-2", "primary-2:3306")))
            .isInstanceOf(TopologyInvariantException.class);
        assertThat(store.snapshot().contains("primary-2")).isFalse();
    }

    @Test
    void primaryCanMoveOnceTheOldOneIsFenced() {
        store.setRole("primary-1", NodeRole.FENCED);
        store.setRole("replica-2", NodeRole.PRIMARY);

        TopologySnapshot snapshot = store.snapshot();
        assertThat(snapshot.primaryId()).contains("replica-2");
        assertThat(snapshot.nodes().values().stream().filter(Node::isPrimary)).hasSize(1);
        assertThat(snapshot.replicas()).extracting(Node::id).containsExactly("replica-1");
    }

    @Test
    void updateOfUnknownNodeFails() {
        assertThatThrownBy(() -> store.setRole("ghost", NodeRole.REPLICA))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void listenersReceivePreviousAndCurrentSnapshots() {
        List<TopologySnapshot[]> calls = new ArrayList<>();
        store.addListener((previous, current) -> calls.add(new TopologySnapshot[]{previous, current}));

        store.update("replica-1", n -> n.withProbeSuccess(Instant.parse("2026-01-01T00:00:00Z"), Duration.ofSeconds(4)));

        assertThat(calls).hasSize(1);
        assertThat(calls.get(0)[0].node("replica-1").orElseThrow().lag()).isNull();
        assertThat(calls.get(0)[1].node("replica-1").orElseThrow().lag()).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void noOpUpdateDoesNotNotify() {
        List<TopologySnapshot> seen = new ArrayList<>();
        store.addListener((previous, current) -> seen.add(current));

        store.update("replica-1", n -> n.withHealth(HealthStatus.HEALTHY));

        assertThat(seen).isEmpty();
    }

    @Test
    void failingListenerDoesNotBreakTheUpdate() {
        store.addListener((previous, current) -> {
            throw new IllegalStateException("boom");
        });

        store.setRole("replica-1", NodeRole.FENCED);

        assertThat(store.node("replica-1").orElseThrow().isFenced()).isTrue();
    }

    @Test
    void promotionFlagIsExclusive() {
        assertThat(store.tryBeginPromotion()).isTrue();
        assertThat(store.tryBeginPromotion()).isFalse();
        assertThat(store.isPromotionInProgress()).isTrue();
        assertThat(meterRegistry.get("hacontroller.promotion.in_progress").gauge().value()).isEqualTo(1.0);

        store.endPromotion();

        assertThat(store.isPromotionInProgress()).isFalse();
        assertThat(store.tryBeginPromotion()).isTrue();
    }

    @Test
    void deregisterRemovesNode() {
        assertThat(store.deregister("replica-2")).isTrue();
        assertThat(store.deregister("replica-2")).isFalse();
        assertThat(store.snapshot().replicas()).extracting(Node::id).containsExactly("replica-1");
    }

    @Test
    void nodeCountGaugesFollowTheTopology() {
        store.setRole("replica-1", NodeRole.FENCED);

        assertThat(meterRegistry.get("hacontroller.topology.nodes").tag("role", "REPLICA").gauge().value())
            .isEqualTo(1.0);
        assertThat(meterRegistry.get("hacontroller.topology.nodes").tag("role", "FENCED").gauge().value())
            .isEqualTo(1.0);
    }
}
