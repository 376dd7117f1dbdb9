package com.platform.hacontroller.probe;

import com.platform.hacontroller.config.HaControllerProperties;
import com.platform.hacontroller.detection.DetectorState;
import com.platform.hacontroller.detection.QuorumFailureDetector;
import com.platform.hacontroller.error.ControlPlaneException;
import com.platform.hacontroller.error.ResourceNotFoundException;
import com.platform.hacontroller.error.TransientProbeException;
import com.platform.hacontroller.model.HealthResult;
import com.platform.hacontroller.model.HealthStatus;
import com.platform.hacontroller.model.Node;
import com.platform.hacontroller.model.Observation;
import com.platform.hacontroller.observability.LoggingConfig;
import com.platform.hacontroller.observability.MetricsRegistry;
import com.platform.hacontroller.topology.TopologyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Probes every enrolled node on its own fixed-delay schedule.
 *
 * A failed or timed-out probe only makes a node SUSPECT. After
 * {@code suspect-threshold} consecutive failures the local judgment becomes DOWN and a
 * Down observation goes to the quorum detector on every further failed cycle.
 * The first success after that sends an Up observation. While the quorum holds a node
 * CONFIRMED_DOWN its health stays DOWN; only the detector's recovery lifts it.
 */
@Slf4j
@Component
public class HealthProbeService {

    private final NodeProbe nodeProbe;
    private final TopologyStore topologyStore;
    private final QuorumFailureDetector detector;
    private final TaskScheduler taskScheduler;
    private final ExecutorService probeExecutor;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;

    private final String observerId;
    private final Duration interval;
    private final Duration timeout;
    private final int suspectThreshold;

    private final Map<String, ScheduledFuture<?>> schedules = new ConcurrentHashMap<>();
    private final Map<String, ProbeTracker> trackers = new ConcurrentHashMap<>();

    public HealthProbeService(NodeProbe nodeProbe,
                              TopologyStore topologyStore,
                              QuorumFailureDetector detector,
                              @Qualifier("taskScheduler") TaskScheduler taskScheduler,
                              @Qualifier("probeExecutor") ExecutorService probeExecutor,
                              MetricsRegistry metricsRegistry,
                              HaControllerProperties properties,
                              Clock clock) {
        this.nodeProbe = nodeProbe;
        this.topologyStore = topologyStore;
        this.detector = detector;
        this.taskScheduler = taskScheduler;
        this.probeExecutor = probeExecutor;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        this.observerId = properties.getObserverId();
        this.interval = properties.getProbe().getInterval();
        this.timeout = properties.getProbe().getTimeout();
        this.suspectThreshold = properties.getProbe().getSuspectThreshold();

        if (timeout.compareTo(interval) >= 0) {
            throw new IllegalStateException(String.format(
                "Probe timeout (%dms) must be shorter than the probe interval (%dms)",
                timeout.toMillis(), interval.toMillis()));
        }
        log.info("Health probe: type={} interval={}ms timeout={}ms threshold={}",
            nodeProbe.getType(), interval.toMillis(), timeout.toMillis(), suspectThreshold);
    }

    /**
     * Start probing a node. No-op if it is already enrolled.
     */
    public void enroll(String nodeId) {
        schedules.computeIfAbsent(nodeId, id -> {
            trackers.put(id, new ProbeTracker());
            log.info("Probing {} every {}ms", id, interval.toMillis());
            return taskScheduler.scheduleWithFixedDelay(() -> probeOnce(id), interval);
        });
    }

    /**
     * Stop probing a node and release its probe resources.
     */
    public void withdraw(String nodeId) {
        ScheduledFuture<?> schedule = schedules.remove(nodeId);
        if (schedule != null) {
            schedule.cancel(false);
        }
        trackers.remove(nodeId);
        nodeProbe.release(nodeId);
        log.info("Stopped probing {}", nodeId);
    }

    public Set<String> enrolledNodes() {
        return Set.copyOf(schedules.keySet());
    }

    /**
     * Cancel every schedule. Used on shutdown.
     */
    public void stopAll() {
        schedules.keySet().forEach(this::withdraw);
    }

    /**
     * Run one probe cycle for the node.
     */
    public HealthResult probeOnce(String nodeId) {
        Optional<Node> node = topologyStore.node(nodeId);
        if (node.isEmpty()) {
            return HealthResult.suspect("node not in topology");
        }

        LoggingConfig.setNodeContext(nodeId);
        try {
            HealthResult result = runWithTimeout(node.get());
            metricsRegistry.recordProbe(nodeId, result.status().name(), Math.max(result.latencyMs(), 0));
            handle(nodeId, result);
            return result;
        } finally {
            LoggingConfig.clearNodeContext();
        }
    }

    private HealthResult runWithTimeout(Node node) {
        Future<HealthResult> future = probeExecutor.submit(() -> nodeProbe.probe(node));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("Probe of {} timed out after {}ms", node.id(), timeout.toMillis());
            return HealthResult.suspect("probe timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransientProbeException) {
                log.debug("Probe of {} failed: {}", node.id(), cause.getMessage());
            } else {
                log.warn("Probe of {} failed unexpectedly: {}", node.id(), String.valueOf(cause), cause);
            }
            return HealthResult.suspect(cause != null ? cause.getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return HealthResult.suspect("probe interrupted");
        }
    }

    private void handle(String nodeId, HealthResult result) {
        ProbeTracker tracker = trackers.computeIfAbsent(nodeId, id -> new ProbeTracker());
        Instant now = clock.instant();

        boolean sendUp = false;
        boolean sendDown = false;
        HealthStatus localHealth;
        synchronized (tracker) {
            if (result.isHealthy()) {
                tracker.consecutiveSuspect = 0;
                sendUp = tracker.locallyDown;
                tracker.locallyDown = false;
                localHealth = HealthStatus.HEALTHY;
            } else {
                tracker.consecutiveSuspect++;
                if (tracker.consecutiveSuspect >= suspectThreshold) {
                    if (!tracker.locallyDown) {
                        log.warn("Node {} failed {} consecutive probes, judged DOWN locally: {}",
                            nodeId, tracker.consecutiveSuspect, result.error());
                    }
                    tracker.locallyDown = true;
                    sendDown = true;
                    localHealth = HealthStatus.DOWN;
                } else {
                    localHealth = HealthStatus.SUSPECT;
                }
            }
        }

        HealthStatus applied = detector.stateOf(nodeId) == DetectorState.CONFIRMED_DOWN
            ? HealthStatus.DOWN
            : localHealth;
        try {
            if (result.isHealthy()) {
                topologyStore.update(nodeId, n -> n.withProbeSuccess(now, result.lag()).withHealth(applied));
            } else {
                topologyStore.update(nodeId, n -> n.withHealth(applied));
            }
        } catch (ResourceNotFoundException e) {
            log.debug("Node {} left the topology during its probe", nodeId);
            return;
        }

        if (sendDown) {
            submit(Observation.down(observerId, nodeId, now));
        } else if (sendUp) {
            log.info("Node {} answering probes again", nodeId);
            submit(Observation.up(observerId, nodeId, now));
        }
    }

    private void submit(Observation observation) {
        try {
            detector.submit(observation);
        } catch (ControlPlaneException e) {
            log.warn("Detector rejected local observation for {}: {}", observation.nodeId(), e.getMessage());
        }
    }

    public int consecutiveFailures(String nodeId) {
        ProbeTracker tracker = trackers.get(nodeId);
        if (tracker == null) {
            return 0;
        }
        synchronized (tracker) {
            return tracker.consecutiveSuspect;
        }
    }

    private static final class ProbeTracker {
        private int consecutiveSuspect;
        private boolean locallyDown;
    }
}
