package com.platform.hacontroller.topology;

import com.platform.hacontroller.error.TopologyInvariantException;
import com.platform.hacontroller.model.HealthStatus;
import com.platform.hacontroller.model.Node;
import com.platform.hacontroller.model.NodeRole;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Immutable, internally consistent view of the whole topology.
 * Every mutation produces a new snapshot; at most one node is ever PRIMARY.
 *
 * @param version              incremented on every accepted mutation
 * @param promotionInProgress  topology-level guard for the only multi-tick operation
 */
public record TopologySnapshot(
    Map<String, Node> nodes,
    boolean promotionInProgress,
    long version
) {

    public TopologySnapshot {
        nodes = Collections.unmodifiableMap(new TreeMap<>(nodes));
    }

    public static TopologySnapshot empty() {
        return new TopologySnapshot(Map.of(), false, 0);
    }

    public Optional<Node> node(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean contains(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public Optional<Node> primary() {
        return nodes.values().stream().filter(Node::isPrimary).findFirst();
    }

    public Optional<String> primaryId() {
        return primary().map(Node::id);
    }

    /**
     * Replicas in node id order.
     */
    public List<Node> replicas() {
        return nodes.values().stream().filter(Node::isReplica).collect(Collectors.toList());
    }

    public List<Node> healthyReplicas() {
        return nodes.values().stream()
            .filter(Node::isReplica)
            .filter(n -> n.health() == HealthStatus.HEALTHY)
            .collect(Collectors.toList());
    }

    public Map<NodeRole, Integer> countByRole() {
        Map<NodeRole, Integer> counts = new EnumMap<>(NodeRole.class);
        for (Node node : nodes.values()) {
            counts.merge(node.role(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Insert or replace a node.
     *
     * @throws TopologyInvariantException if the result would hold two primaries
     */
    public TopologySnapshot withNode(Node node) {
        if (node.isPrimary()) {
            Optional<Node> existing = primary();
            if (existing.isPresent() && !existing.get().id().equals(node.id())) {
                throw new TopologyInvariantException(String.format(
                    "Cannot make %s PRIMARY while %s is PRIMARY", node.id(), existing.get().id()));
            }
        }
        Map<String, Node> next = new TreeMap<>(nodes);
        next.put(node.id(), node);
        return new TopologySnapshot(next, promotionInProgress, version + 1);
    }

    public TopologySnapshot withoutNode(String nodeId) {
        Map<String, Node> next = new TreeMap<>(nodes);
        next.remove(nodeId);
        return new TopologySnapshot(next, promotionInProgress, version + 1);
    }

    public TopologySnapshot withPromotionInProgress(boolean inProgress) {
        return new TopologySnapshot(nodes, inProgress, version + 1);
    }
}
