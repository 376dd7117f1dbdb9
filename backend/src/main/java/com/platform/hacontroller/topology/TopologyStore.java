package com.platform.hacontroller.topology;

import com.platform.hacontroller.error.ResourceNotFoundException;
import com.platform.hacontroller.model.Node;
import com.platform.hacontroller.model.NodeRole;
import com.platform.hacontroller.model.NodeSpec;
import com.platform.hacontroller.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Owner of the shared topology.
 *
 * Writers take a short-held lock for the node they touch (never a global lock) and
 * publish a new {@link TopologySnapshot} with compare-and-set. Readers get the current
 * snapshot and never block.
 */
@Slf4j
@Component
public class TopologyStore {

    private final AtomicReference<TopologySnapshot> current = new AtomicReference<>(TopologySnapshot.empty());
    private final Map<String, ReentrantLock> nodeLocks = new ConcurrentHashMap<>();
    private final List<TopologyChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final MetricsRegistry metricsRegistry;

    public TopologyStore(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    public TopologySnapshot snapshot() {
        return current.get();
    }

    public Optional<Node> node(String nodeId) {
        return current.get().node(nodeId);
    }

    public void addListener(TopologyChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Add a node. Returns the existing node unchanged if the id is already known.
     */
    public Node register(NodeSpec spec) {
        Node node = Node.registered(spec);
        Transition transition;
        ReentrantLock lock = lockFor(spec.id());
        lock.lock();
        try {
            Optional<Node> existing = current.get().node(spec.id());
            if (existing.isPresent()) {
                return existing.get();
            }
            transition = swap(snapshot -> snapshot.withNode(node));
        } finally {
            lock.unlock();
        }
        log.info("Registered node {} ({}) at {}", node.id(), node.role(), node.address());
        notifyListeners(transition);
        return node;
    }

    /**
     * Remove a node. Returns false if it was not present.
     */
    public boolean deregister(String nodeId) {
        Transition transition;
        ReentrantLock lock = lockFor(nodeId);
        lock.lock();
        try {
            if (!current.get().contains(nodeId)) {
                return false;
            }
            transition = swap(snapshot -> snapshot.withoutNode(nodeId));
        } finally {
            lock.unlock();
        }
        nodeLocks.remove(nodeId);
        log.info("Deregistered node {}", nodeId);
        notifyListeners(transition);
        return true;
    }

    /**
     * Apply a mutation to one node under that node's lock.
     *
     * @throws ResourceNotFoundException if the node is unknown
     * @throws com.platform.hacontroller.error.TopologyInvariantException if the result breaks single-primary
     */
    public Node update(String nodeId, UnaryOperator<Node> mutation) {
        Node after;
        Transition transition;
        ReentrantLock lock = lockFor(nodeId);
        lock.lock();
        try {
            Node before = current.get().node(nodeId)
                .orElseThrow(() -> ResourceNotFoundException.node(nodeId));
            after = mutation.apply(before);
            if (after.equals(before)) {
                return before;
            }
            // other writers of this node are excluded by the lock, so only other nodes can race
            Node updated = after;
            transition = swap(snapshot -> snapshot.withNode(updated));
        } finally {
            lock.unlock();
        }
        notifyListeners(transition);
        return after;
    }

    public Node setRole(String nodeId, NodeRole role) {
        return update(nodeId, node -> node.withRole(role));
    }

    /**
     * Set the topology-level promotion flag if it is clear.
     *
     * @return false if a promotion is already in progress
     */
    public boolean tryBeginPromotion() {
        while (true) {
            TopologySnapshot snapshot = current.get();
            if (snapshot.promotionInProgress()) {
                return false;
            }
            TopologySnapshot next = snapshot.withPromotionInProgress(true);
            if (current.compareAndSet(snapshot, next)) {
                updateMetrics(next);
                return true;
            }
        }
    }

    /**
     * Clear the promotion flag and notify listeners, which publish the settled topology.
     */
    public void endPromotion() {
        notifyListeners(swap(snapshot -> snapshot.withPromotionInProgress(false)));
    }

    public boolean isPromotionInProgress() {
        return current.get().promotionInProgress();
    }

    private Transition swap(UnaryOperator<TopologySnapshot> change) {
        TopologySnapshot previous;
        TopologySnapshot next;
        do {
            previous = current.get();
            next = change.apply(previous);
        } while (!current.compareAndSet(previous, next));

        updateMetrics(next);
        return new Transition(previous, next);
    }

    /**
     * Runs outside any node lock: listeners may call out to the network.
     */
    private void notifyListeners(Transition transition) {
        for (TopologyChangeListener listener : listeners) {
            try {
                listener.onTopologyChanged(transition.previous(), transition.next());
            } catch (RuntimeException e) {
                log.error("Topology listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private void updateMetrics(TopologySnapshot snapshot) {
        Map<String, Integer> counts = new HashMap<>();
        snapshot.countByRole().forEach((role, count) -> counts.put(role.name(), count));
        metricsRegistry.updateNodeCounts(counts);
        metricsRegistry.updatePromotionInProgress(snapshot.promotionInProgress());
    }

    private record Transition(TopologySnapshot previous, TopologySnapshot next) {
    }

    private ReentrantLock lockFor(String nodeId) {
        return nodeLocks.computeIfAbsent(nodeId, id -> new ReentrantLock());
    }
}
