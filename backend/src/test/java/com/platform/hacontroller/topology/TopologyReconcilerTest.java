package com.platform.hacontroller.topology;

import com.platform.hacontroller.collaborator.InMemoryTopologyCollaborator;
import com.platform.hacontroller.collaborator.TopologyCollaborator;
import com.platform.hacontroller.config.HaControllerProperties;
import com.platform.hacontroller.detection.QuorumFailureDetector;
import com.platform.hacontroller.error.SystemUnavailableException;
import com.platform.hacontroller.events.ControllerEventPublisher;
import com.platform.hacontroller.model.NodeRole;
import com.platform.hacontroller.model.NodeSpec;
import com.platform.hacontroller.observability.MetricsRegistry;
import com.platform.hacontroller.probe.HealthProbeService;
import com.platform.hacontroller.telemetry.MetricAggregator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TopologyReconcilerTest {

    private TopologyStore store;
    private InMemoryTopologyCollaborator platform;
    private HealthProbeService probes;
    private MetricAggregator aggregator;
    private QuorumFailureDetector detector;
    private TopologyReconciler reconciler;

    @BeforeEach
    void setUp() {
        HaControllerProperties properties = new HaControllerProperties();
        properties.getCollaborator().setNodes(List.of(
            NodeSpec.primary("primary-1", "primary-1:3306"),
            NodeSpec.replica("replica-1", "replica-1:3306")));
        platform = new InMemoryTopologyCollaborator(properties);

        store = new TopologyStore(new MetricsRegistry(new SimpleMeterRegistry()));
        probes = mock(HealthProbeService.class);
        aggregator = mock(MetricAggregator.class);
        detector = mock(QuorumFailureDetector.class);
        reconciler = new TopologyReconciler(platform, store, probes, aggregator, detector,
            mock(ControllerEventPublisher.class), new MetricsRegistry(new SimpleMeterRegistry()));
    }

    @Test
    void firstPassAdmitsReportedNodes() {
        assertThat(reconciler.isFirstReconcileSucceeded()).isFalse();

        assertThat(reconciler.reconcile()).isEqualTo(2);

        assertThat(store.snapshot().primaryId()).contains("primary-1");
        assertThat(store.snapshot().replicas()).hasSize(1);
        verify(probes).enroll("primary-1");
        verify(probes).enroll("replica-1");
        assertThat(reconciler.isFirstReconcileSucceeded()).isTrue();
    }

    @Test
    void secondPassWithoutChangesIsQuiet() {
        reconciler.reconcile();

        assertThat(reconciler.reconcile()).isZero();
    }

    @Test
    void vanishedReplicaIsForgottenEverywhere() {
        reconciler.reconcile();
        platform.deregisterNode("replica-1");

        assertThat(reconciler.reconcile()).isEqualTo(1);

        assertThat(store.snapshot().contains("replica-1")).isFalse();
        verify(probes).withdraw("replica-1");
        verify(aggregator).forget("replica-1");
        verify(detector).forget("replica-1");
    }

    @Test
    void vanishedPrimaryIsLeftToFailureDetection() {
        reconciler.reconcile();
        platform.deregisterNode("primary-1");

        reconciler.reconcile();

        assertThat(store.snapshot().primaryId()).contains("primary-1");
        verify(probes, never()).withdraw("primary-1");
    }

    @Test
    void noRemovalsWhilePromoting() {
        reconciler.reconcile();
        platform.deregisterNode("replica-1");
        store.tryBeginPromotion();

        assertThat(reconciler.reconcile()).isZero();
        assertThat(store.snapshot().contains("replica-1")).isTrue();
    }

    @Test
    void secondReportedPrimaryIsAdmittedAsReplica() {
        reconciler.reconcile();
        platform.registerNode(NodeSpec.primary("primary-2", "primary-2:3306"));

        reconciler.reconcile();

        assertThat(store.node("primary-2").orElseThrow().role()).isEqualTo(NodeRole.REPLICA);
        assertThat(store.snapshot().primaryId()).contains("primary-1");
    }

    @Test
    void unavailableCollaboratorRemovesNothing() {
        TopologyCollaborator collaborator = mock(TopologyCollaborator.class);
        when(collaborator.listNodes())
            .thenReturn(List.of(NodeSpec.primary("primary-1", "primary-1:3306")))
            .thenThrow(SystemUnavailableException.collaborator("Listing nodes failed: circuit open", null));
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        TopologyReconciler failing = new TopologyReconciler(collaborator, store, probes, aggregator, detector,
            mock(ControllerEventPublisher.class), new MetricsRegistry(meterRegistry));
        failing.reconcile();
        store.register(NodeSpec.replica("replica-7", "replica-7:3306"));

        failing.scheduledReconcile();

        assertThat(store.snapshot().contains("replica-7")).isTrue();
        verify(aggregator, never()).forget(anyString());
        verify(detector, never()).forget(anyString());
        assertThat(meterRegistry.get("hacontroller.reconciler.runs").tag("success", "false").counter().count())
            .isEqualTo(1.0);
    }
}
