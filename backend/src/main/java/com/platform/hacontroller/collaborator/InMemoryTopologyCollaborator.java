package com.platform.hacontroller.collaborator;

import com.platform.hacontroller.config.HaControllerProperties;
import com.platform.hacontroller.error.ErrorCode;
import com.platform.hacontroller.error.ResourceNotFoundException;
import com.platform.hacontroller.error.SystemUnavailableException;
import com.platform.hacontroller.model.EndpointMapping;
import com.platform.hacontroller.model.NodeRole;
import com.platform.hacontroller.model.NodeSpec;
import com.platform.hacontroller.model.ScalingDecision;
import com.platform.hacontroller.routing.EndpointMappingTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Self-contained platform simulation, seeded from {@code hacontroller.collaborator.nodes}.
 *
 * Role changes take effect immediately unless a node was marked unresponsive, in which
 * case promote commands are accepted but never completed. Fencing can be made to fail
 * the same way.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "hacontroller.collaborator.type", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryTopologyCollaborator implements TopologyCollaborator {

    private static final Pattern REPLICA_ORDINAL = Pattern.compile("^replica-(\\d+)$");

    private final Map<String, NodeSpec> nodes = new ConcurrentHashMap<>();
    private final Set<String> unresponsive = ConcurrentHashMap.newKeySet();
    private final Set<String> fencingRejected = ConcurrentHashMap.newKeySet();
    private final AtomicReference<ScalingDecision> lastDecision = new AtomicReference<>();
    private final EndpointMappingTracker mappingTracker = new EndpointMappingTracker("in-memory-collaborator");
    private final String replicaAddressTemplate;

    public InMemoryTopologyCollaborator(HaControllerProperties properties) {
        HaControllerProperties.Collaborator config = properties.getCollaborator();
        this.replicaAddressTemplate = config.getReplicaAddressTemplate();
        for (NodeSpec spec : config.getNodes()) {
            nodes.put(spec.id(), spec);
        }
        log.info("In-memory collaborator seeded with {} nodes", nodes.size());
    }

    @Override
    public List<NodeSpec> listNodes() {
        return nodes.values().stream()
            .sorted(Comparator.comparing(NodeSpec::id))
            .collect(Collectors.toList());
    }

    @Override
    public void registerNode(NodeSpec spec) {
        nodes.put(spec.id(), spec);
        log.info("Node {} registered at {} as {}", spec.id(), spec.address(), spec.role());
    }

    @Override
    public void deregisterNode(String nodeId) {
        if (nodes.remove(nodeId) == null) {
            throw ResourceNotFoundException.node(nodeId);
        }
        unresponsive.remove(nodeId);
        fencingRejected.remove(nodeId);
        log.info("Node {} deregistered", nodeId);
    }

    @Override
    public void setNodeRole(String nodeId, NodeRole role) {
        NodeSpec spec = Optional.ofNullable(nodes.get(nodeId))
            .orElseThrow(() -> ResourceNotFoundException.node(nodeId));

        if (role == NodeRole.FENCED && fencingRejected.contains(nodeId)) {
            throw new SystemUnavailableException(
                ErrorCode.COLLABORATOR_ERROR,
                getType(), "Fencing rejected for node " + nodeId);
        }
        if (role == NodeRole.PRIMARY && unresponsive.contains(nodeId)) {
            log.warn("Node {} accepted promote command but is unresponsive", nodeId);
            return;
        }
        nodes.put(nodeId, new NodeSpec(nodeId, spec.address(), role));
        log.info("Node {} now reports role {}", nodeId, role);
    }

    @Override
    public synchronized void setReplicaCount(int replicas) {
        List<NodeSpec> current = listNodes().stream()
            .filter(n -> n.role() == NodeRole.REPLICA)
            .collect(Collectors.toList());

        if (replicas > current.size()) {
            int ordinal = nextReplicaOrdinal();
            for (int i = current.size(); i < replicas; i++) {
                String id = "replica-" + ordinal;
                NodeSpec spec = NodeSpec.replica(id, String.format(replicaAddressTemplate, ordinal));
                nodes.put(id, spec);
                log.info("Provisioned replica {} at {}", id, spec.address());
                ordinal++;
            }
        } else if (replicas < current.size()) {
            List<NodeSpec> removable = new ArrayList<>(current);
            removable.sort(Comparator.comparing(NodeSpec::id).reversed());
            for (NodeSpec spec : removable.subList(0, current.size() - replicas)) {
                nodes.remove(spec.id());
                log.info("Decommissioned replica {}", spec.id());
            }
        }
    }

    @Override
    public void onScalingDecision(ScalingDecision decision) {
        lastDecision.set(decision);
        log.info("Scaling decision received: {} -> {} ({})",
            decision.currentReplicas(), decision.desiredReplicas(), decision.reason());
    }

    @Override
    public void onEndpointMapping(EndpointMapping mapping) {
        mappingTracker.offer(mapping);
    }

    @Override
    public String getType() {
        return "in-memory";
    }

    /**
     * Promote commands for this node will be accepted but never take effect.
     */
    public void simulateUnresponsive(String nodeId) {
        unresponsive.add(nodeId);
    }

    /**
     * Fence commands for this node will be rejected.
     */
    public void simulateFencingRejected(String nodeId) {
        fencingRejected.add(nodeId);
    }

    public Optional<ScalingDecision> getLastDecision() {
        return Optional.ofNullable(lastDecision.get());
    }

    public Optional<EndpointMapping> getAppliedMapping() {
        return mappingTracker.current();
    }

    private int nextReplicaOrdinal() {
        int max = 0;
        for (String id : nodes.keySet()) {
            Matcher matcher = REPLICA_ORDINAL.matcher(id);
            if (matcher.matches()) {
                max = Math.max(max, Integer.parseInt(matcher.group(1)));
            }
        }
        return max + 1;
    }
}
