package com.platform.hacontroller.topology;

import com.platform.hacontroller.collaborator.TopologyCollaborator;
import com.platform.hacontroller.detection.QuorumFailureDetector;
import com.platform.hacontroller.events.ControllerEventPublisher;
import com.platform.hacontroller.model.ControllerEvent;
import com.platform.hacontroller.model.Node;
import com.platform.hacontroller.model.NodeRole;
import com.platform.hacontroller.model.NodeSpec;
import com.platform.hacontroller.observability.LoggingConfig;
import com.platform.hacontroller.observability.MetricsRegistry;
import com.platform.hacontroller.probe.HealthProbeService;
import com.platform.hacontroller.telemetry.MetricAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Converges the controller's membership toward what the collaborator reports.
 *
 * Unseen nodes are registered and enrolled for probing; nodes the collaborator no
 * longer reports are removed from the store, the probe schedule, the aggregator and
 * the detector. Roles of known nodes are owned by the controller and not overwritten.
 */
@Slf4j
@Component
public class TopologyReconciler {

    private final TopologyCollaborator collaborator;
    private final TopologyStore topologyStore;
    private final HealthProbeService healthProbeService;
    private final MetricAggregator metricAggregator;
    private final QuorumFailureDetector failureDetector;
    private final ControllerEventPublisher eventPublisher;
    private final MetricsRegistry metricsRegistry;

    private final AtomicBoolean firstReconcileSucceeded = new AtomicBoolean(false);

    public TopologyReconciler(TopologyCollaborator collaborator,
                              TopologyStore topologyStore,
                              HealthProbeService healthProbeService,
                              MetricAggregator metricAggregator,
                              QuorumFailureDetector failureDetector,
                              ControllerEventPublisher eventPublisher,
                              MetricsRegistry metricsRegistry) {
        this.collaborator = collaborator;
        this.topologyStore = topologyStore;
        this.healthProbeService = healthProbeService;
        this.metricAggregator = metricAggregator;
        this.failureDetector = failureDetector;
        this.eventPublisher = eventPublisher;
        this.metricsRegistry = metricsRegistry;
    }

    @Scheduled(fixedDelayString = "${hacontroller.reconciler.interval-ms:15000}",
               initialDelayString = "${hacontroller.reconciler.interval-ms:15000}")
    public void scheduledReconcile() {
        try {
            reconcile();
        } catch (RuntimeException e) {
            log.error("Topology reconciliation failed: {}", e.getMessage(), e);
            metricsRegistry.incrementCounter("hacontroller.reconciler.runs", "success", "false");
        }
    }

    /**
     * One reconciliation pass.
     *
     * @return number of nodes added plus nodes removed
     */
    public synchronized int reconcile() {
        List<NodeSpec> reported = collaborator.listNodes();
        Set<String> reportedIds = reported.stream().map(NodeSpec::id).collect(Collectors.toSet());
        int changes = 0;

        for (NodeSpec spec : reported) {
            if (!topologyStore.snapshot().contains(spec.id())) {
                admit(spec);
                changes++;
            } else {
                healthProbeService.enroll(spec.id());
            }
        }

        if (topologyStore.isPromotionInProgress()) {
            log.debug("Promotion in progress, not removing vanished nodes this pass");
        } else {
            Set<String> known = new HashSet<>(topologyStore.snapshot().nodes().keySet());
            known.removeAll(reportedIds);
            for (String vanished : known) {
                if (topologyStore.snapshot().primaryId().filter(vanished::equals).isPresent()) {
                    log.warn("Primary {} is no longer reported by the collaborator; leaving it to failure detection",
                        vanished);
                    continue;
                }
                remove(vanished);
                changes++;
            }
        }

        if (firstReconcileSucceeded.compareAndSet(false, true)) {
            log.info("Initial reconciliation complete: {} nodes", topologyStore.snapshot().nodes().size());
        }
        metricsRegistry.incrementCounter("hacontroller.reconciler.runs", "success", "true");
        return changes;
    }

    /**
     * Register a node the collaborator reports and start probing it. A second reported
     * primary is admitted as a replica.
     */
    public Node admit(NodeSpec spec) {
        NodeSpec effective = spec;
        if (spec.role() == NodeRole.PRIMARY) {
            String primaryId = topologyStore.snapshot().primaryId().orElse(null);
            if (primaryId != null && !primaryId.equals(spec.id())) {
                log.warn("Collaborator reports {} as PRIMARY but {} is primary; admitting it as REPLICA",
                    spec.id(), primaryId);
                effective = new NodeSpec(spec.id(), spec.address(), NodeRole.REPLICA);
            }
        }

        LoggingConfig.setNodeContext(spec.id());
        try {
            Node node = topologyStore.register(effective);
            healthProbeService.enroll(node.id());
            eventPublisher.publish(ControllerEvent.info(ControllerEvent.EventType.NODE_REGISTERED, node.id(),
                "Node " + node.id() + " joined as " + node.role() + " at " + node.address()));
            return node;
        } finally {
            LoggingConfig.clearNodeContext();
        }
    }

    /**
     * Forget a node everywhere the controller tracks it.
     *
     * @return false if the node was not known
     */
    public boolean remove(String nodeId) {
        healthProbeService.withdraw(nodeId);
        metricAggregator.forget(nodeId);
        failureDetector.forget(nodeId);
        boolean removed = topologyStore.deregister(nodeId);
        if (removed) {
            eventPublisher.publish(ControllerEvent.info(ControllerEvent.EventType.NODE_DEREGISTERED, nodeId,
                "Node " + nodeId + " left the topology"));
        }
        return removed;
    }

    public boolean isFirstReconcileSucceeded() {
        return firstReconcileSucceeded.get();
    }
}
