package com.platform.hacontroller.promotion;

import com.platform.hacontroller.model.HealthStatus;
import com.platform.hacontroller.model.Node;
import com.platform.hacontroller.topology.TopologySnapshot;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Orders promotion candidates: least replication lag first, ties by lowest node id.
 * Replicas with unknown lag come after all replicas with a known lag; replicas judged
 * DOWN, fenced nodes and the primary are never candidates.
 */
@Component
public class CandidateSelector {

    static final Comparator<Node> BY_LAG_THEN_ID = Comparator
        .comparing(Node::lag, Comparator.nullsLast(Comparator.<Duration>naturalOrder()))
        .thenComparing(Node::id);

    public List<Node> rank(TopologySnapshot snapshot) {
        return snapshot.replicas().stream()
            .filter(n -> n.health() != HealthStatus.DOWN)
            .sorted(BY_LAG_THEN_ID)
            .collect(Collectors.toList());
    }

    public boolean isEligible(Node node) {
        return node.isReplica() && node.health() != HealthStatus.DOWN;
    }
}
