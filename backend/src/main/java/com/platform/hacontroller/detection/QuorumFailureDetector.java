package com.platform.hacontroller.detection;

import com.platform.hacontroller.config.HaControllerProperties;
import com.platform.hacontroller.error.ResourceNotFoundException;
import com.platform.hacontroller.error.ValidationException;
import com.platform.hacontroller.events.ControllerEventPublisher;
import com.platform.hacontroller.model.ControllerEvent;
import com.platform.hacontroller.model.HealthStatus;
import com.platform.hacontroller.model.Node;
import com.platform.hacontroller.model.Observation;
import com.platform.hacontroller.model.PrimaryDownEvent;
import com.platform.hacontroller.model.Verdict;
import com.platform.hacontroller.observability.LoggingConfig;
import com.platform.hacontroller.observability.MetricsRegistry;
import com.platform.hacontroller.observability.StructuredLogger;
import com.platform.hacontroller.topology.TopologyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns observations from several observers into quorum-backed verdicts.
 *
 * A node is confirmed down only when a strict majority of the configured observers
 * report it Down within the agreement window. Window membership is judged by the
 * time an observation is received, so observer clock skew does not matter.
 */
@Slf4j
@Component
public class QuorumFailureDetector {

    private final Set<String> observers;
    private final int quorumSize;
    private final Duration agreementWindow;
    private final TopologyStore topologyStore;
    private final PrimaryFailureHandler primaryFailureHandler;
    private final ControllerEventPublisher eventPublisher;
    private final StructuredLogger structuredLogger;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;

    private final Map<String, NodeDetection> detections = new ConcurrentHashMap<>();

    public QuorumFailureDetector(HaControllerProperties properties,
                                 TopologyStore topologyStore,
                                 PrimaryFailureHandler primaryFailureHandler,
                                 ControllerEventPublisher eventPublisher,
                                 StructuredLogger structuredLogger,
                                 MetricsRegistry metricsRegistry,
                                 Clock clock) {
        this.observers = Set.copyOf(properties.getDetector().getObservers());
        this.quorumSize = observers.size() / 2 + 1;
        this.agreementWindow = properties.getDetector().getAgreementWindow();
        this.topologyStore = topologyStore;
        this.primaryFailureHandler = primaryFailureHandler;
        this.eventPublisher = eventPublisher;
        this.structuredLogger = structuredLogger;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        log.info("Quorum detector: {} observers, quorum {}, window {}ms",
            observers.size(), quorumSize, agreementWindow.toMillis());
    }

    /**
     * Record one observation and advance the node's state machine.
     *
     * @throws ValidationException if the observer is not configured
     * @throws ResourceNotFoundException if the node is not in the topology
     */
    public DetectorState submit(Observation observation) {
        if (!observers.contains(observation.observerId())) {
            throw ValidationException.unknownObserver(observation.observerId());
        }
        if (topologyStore.node(observation.nodeId()).isEmpty()) {
            throw ResourceNotFoundException.node(observation.nodeId());
        }
        metricsRegistry.recordObservation(observation.observerId(), observation.verdict().name());

        Instant now = clock.instant();
        NodeDetection detection = detections.computeIfAbsent(observation.nodeId(), NodeDetection::new);
        Transition expired;
        Transition transition;
        synchronized (detection) {
            // close a lapsed window first so stale Down votes cannot complete a quorum
            expired = detection.expire(now);
            transition = detection.record(observation, now);
        }
        apply(observation.nodeId(), expired);
        apply(observation.nodeId(), transition);
        return transition.state();
    }

    /**
     * Close agreement windows that ran out without a majority.
     */
    @Scheduled(fixedDelayString = "${hacontroller.detector.sweep-interval-ms:1000}")
    public void expireWindows() {
        Instant now = clock.instant();
        for (NodeDetection detection : detections.values()) {
            Transition transition;
            synchronized (detection) {
                transition = detection.expire(now);
            }
            apply(detection.nodeId, transition);
        }
    }

    public Optional<NodeDetectionStatus> status(String nodeId) {
        NodeDetection detection = detections.get(nodeId);
        if (detection == null) {
            return topologyStore.node(nodeId).map(n -> new NodeDetectionStatus(
                nodeId, DetectorState.HEALTHY, Set.of(), Set.of(), quorumSize, null, null));
        }
        synchronized (detection) {
            return Optional.of(detection.toStatus());
        }
    }

    public DetectorState stateOf(String nodeId) {
        NodeDetection detection = detections.get(nodeId);
        if (detection == null) {
            return DetectorState.HEALTHY;
        }
        synchronized (detection) {
            return detection.state;
        }
    }

    public void forget(String nodeId) {
        detections.remove(nodeId);
    }

    public int getQuorumSize() {
        return quorumSize;
    }

    public Set<String> getObservers() {
        return observers;
    }

    private void apply(String nodeId, Transition transition) {
        switch (transition.kind()) {
            case NONE -> { }
            case SUSPECTED -> eventPublisher.publish(ControllerEvent.info(
                ControllerEvent.EventType.NODE_SUSPECT, nodeId, "First Down observation, agreement window opened"));
            case QUORUM_NOT_REACHED -> {
                log.info("Quorum not reached for {} within {}ms ({} of {} needed), window restarted",
                    nodeId, agreementWindow.toMillis(), transition.observers().size(), quorumSize);
                metricsRegistry.recordQuorumOutcome(nodeId, false);
                eventPublisher.publish(ControllerEvent.info(ControllerEvent.EventType.QUORUM_NOT_REACHED, nodeId,
                    String.format("%d of %d Down observations, window restarted",
                        transition.observers().size(), quorumSize)));
            }
            case CLEARED -> log.info("Suspicion on {} cleared, no Down observation in the window", nodeId);
            case CONFIRMED_DOWN -> confirmDown(nodeId, transition);
            case RECOVERED -> recover(nodeId, transition);
        }
    }

    private void confirmDown(String nodeId, Transition transition) {
        metricsRegistry.recordQuorumOutcome(nodeId, true);
        Optional<Node> node = markHealth(nodeId, HealthStatus.DOWN);
        List<String> confirming = new ArrayList<>(transition.observers());

        if (node.isPresent() && node.get().isPrimary()) {
            structuredLogger.failover().primaryDownConfirmed(nodeId, confirming);
            eventPublisher.publish(ControllerEvent.critical(ControllerEvent.EventType.PRIMARY_DOWN, nodeId,
                "Primary confirmed down by " + confirming));
            primaryFailureHandler.onPrimaryDown(
                new PrimaryDownEvent(nodeId, Set.copyOf(transition.observers()), transition.at()));
        } else {
            log.warn("Node {} confirmed down by {}", nodeId, confirming);
            eventPublisher.publish(ControllerEvent.warning(ControllerEvent.EventType.NODE_DOWN_OBSERVED, nodeId,
                "Confirmed down by " + confirming));
        }
    }

    private void recover(String nodeId, Transition transition) {
        markHealth(nodeId, HealthStatus.HEALTHY);
        log.info("Node {} recovered, confirmed Up by {}", nodeId, transition.observers());
        eventPublisher.publish(ControllerEvent.info(ControllerEvent.EventType.NODE_RECOVERED, nodeId,
            "Confirmed Up by " + transition.observers()));
    }

    private Optional<Node> markHealth(String nodeId, HealthStatus health) {
        try {
            return Optional.of(topologyStore.update(nodeId, n -> n.withHealth(health)));
        } catch (ResourceNotFoundException e) {
            log.debug("Node {} left the topology before its verdict was applied", nodeId);
            return Optional.empty();
        }
    }

    // ==================== Per-node bookkeeping ====================

    enum TransitionKind {
        NONE,
        SUSPECTED,
        QUORUM_NOT_REACHED,
        CLEARED,
        CONFIRMED_DOWN,
        RECOVERED
    }

    record Transition(TransitionKind kind, DetectorState state, Set<String> observers, Instant at) {
        static Transition none(DetectorState state) {
            return new Transition(TransitionKind.NONE, state, Set.of(), null);
        }
    }

    /**
     * Guarded by its own monitor.
     */
    private final class NodeDetection {
        private final String nodeId;
        private final Map<String, Received> latest = new HashMap<>();
        private DetectorState state = DetectorState.HEALTHY;
        private Instant windowStart;
        private Instant confirmedAt;

        NodeDetection(String nodeId) {
            this.nodeId = nodeId;
        }

        Transition record(Observation observation, Instant now) {
            Received previous = latest.get(observation.observerId());
            if (previous != null && observation.timestamp().isBefore(previous.observation().timestamp())) {
                return Transition.none(state);
            }
            latest.put(observation.observerId(), new Received(observation, now));
            LoggingConfig.setObserverContext(observation.observerId(), nodeId);
            try {
                return advance(observation, now);
            } finally {
                LoggingConfig.clearObserverContext();
            }
        }

        private Transition advance(Observation observation, Instant now) {
            switch (state) {
                case HEALTHY -> {
                    if (!observation.isDown()) {
                        return Transition.none(state);
                    }
                    state = DetectorState.SUSPECT;
                    windowStart = now;
                    log.debug("Node {} suspected by {}", nodeId, observation.observerId());
                    Transition confirmed = tryConfirm(now);
                    return confirmed != null
                        ? confirmed
                        : new Transition(TransitionKind.SUSPECTED, state, Set.of(observation.observerId()), now);
                }
                case SUSPECT -> {
                    Transition confirmed = observation.isDown() ? tryConfirm(now) : null;
                    return confirmed != null ? confirmed : Transition.none(state);
                }
                case CONFIRMED_DOWN -> {
                    if (observation.isDown()) {
                        // already confirmed; repeated Down observations never re-emit
                        return Transition.none(state);
                    }
                    Set<String> up = votes(Verdict.UP, confirmedAt);
                    if (up.size() >= quorumSize) {
                        reset();
                        return new Transition(TransitionKind.RECOVERED, state, up, now);
                    }
                    return Transition.none(state);
                }
                default -> throw new IllegalStateException("Unknown detector state " + state);
            }
        }

        private Transition tryConfirm(Instant now) {
            Set<String> down = votes(Verdict.DOWN, windowStart);
            if (down.size() < quorumSize) {
                return null;
            }
            state = DetectorState.CONFIRMED_DOWN;
            confirmedAt = now;
            return new Transition(TransitionKind.CONFIRMED_DOWN, state, down, now);
        }

        Transition expire(Instant now) {
            if (state != DetectorState.SUSPECT || now.isBefore(windowStart.plus(agreementWindow))) {
                return Transition.none(state);
            }
            Set<String> down = votes(Verdict.DOWN, windowStart);
            if (down.isEmpty()) {
                reset();
                return new Transition(TransitionKind.CLEARED, state, Set.of(), now);
            }
            windowStart = now;
            return new Transition(TransitionKind.QUORUM_NOT_REACHED, state, down, now);
        }

        /**
         * Observers whose latest observation has the verdict and arrived at or after {@code since}.
         */
        private Set<String> votes(Verdict verdict, Instant since) {
            Set<String> result = new TreeSet<>();
            for (Map.Entry<String, Received> entry : latest.entrySet()) {
                Received received = entry.getValue();
                if (received.observation().verdict() == verdict && !received.receivedAt().isBefore(since)) {
                    result.add(entry.getKey());
                }
            }
            return result;
        }

        private void reset() {
            state = DetectorState.HEALTHY;
            windowStart = null;
            confirmedAt = null;
        }

        NodeDetectionStatus toStatus() {
            Instant since = state == DetectorState.SUSPECT ? windowStart : Instant.MIN;
            Instant upSince = state == DetectorState.CONFIRMED_DOWN ? confirmedAt : Instant.MIN;
            return new NodeDetectionStatus(nodeId, state, votes(Verdict.DOWN, since),
                votes(Verdict.UP, upSince), quorumSize, windowStart, confirmedAt);
        }
    }

    private record Received(Observation observation, Instant receivedAt) {
    }
}
