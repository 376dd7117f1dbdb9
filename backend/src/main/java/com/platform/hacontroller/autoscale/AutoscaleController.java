package com.platform.hacontroller.autoscale;

import com.platform.hacontroller.collaborator.TopologyCollaborator;
import com.platform.hacontroller.config.HaControllerProperties;
import com.platform.hacontroller.error.ControlPlaneException;
import com.platform.hacontroller.events.ControllerEventPublisher;
import com.platform.hacontroller.model.AggregateMetrics;
import com.platform.hacontroller.model.ControllerEvent;
import com.platform.hacontroller.model.Node;
import com.platform.hacontroller.model.ScalingDecision;
import com.platform.hacontroller.observability.MetricsRegistry;
import com.platform.hacontroller.observability.StructuredLogger;
import com.platform.hacontroller.telemetry.MetricAggregator;
import com.platform.hacontroller.topology.TopologySnapshot;
import com.platform.hacontroller.topology.TopologyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Replica-count control loop.
 *
 * desired = ceil(current * max(cpu / targetCpu, mem / targetMem)), clamped to [min, max].
 * Scale-up is applied on the tick it is computed. Scale-down waits until every
 * recommendation for a full stabilization window was below the current count, targets
 * the highest of those recommendations and removes at most a bounded number of
 * replicas per tick.
 */
@Slf4j
@Component
public class AutoscaleController {

    private final TopologyStore topologyStore;
    private final MetricAggregator metricAggregator;
    private final TopologyCollaborator collaborator;
    private final ControllerEventPublisher eventPublisher;
    private final StructuredLogger structuredLogger;
    private final MetricsRegistry metricsRegistry;
    private final HaControllerProperties.Autoscale config;
    private final Clock clock;

    private final Deque<Recommendation> recommendations = new ArrayDeque<>();
    private Instant belowCurrentSince;

    private volatile AggregateMetrics lastMetrics;
    private volatile ScalingDecision lastDecision;
    private volatile Integer lastRecommendation;
    private volatile Instant lastTickAt;

    public AutoscaleController(TopologyStore topologyStore,
                               MetricAggregator metricAggregator,
                               TopologyCollaborator collaborator,
                               ControllerEventPublisher eventPublisher,
                               StructuredLogger structuredLogger,
                               MetricsRegistry metricsRegistry,
                               HaControllerProperties properties,
                               Clock clock) {
        this.topologyStore = topologyStore;
        this.metricAggregator = metricAggregator;
        this.collaborator = collaborator;
        this.eventPublisher = eventPublisher;
        this.structuredLogger = structuredLogger;
        this.metricsRegistry = metricsRegistry;
        this.config = properties.getAutoscale();
        this.clock = clock;

        if (config.getMinReplicas() < 0 || config.getMaxReplicas() < config.getMinReplicas()) {
            throw new IllegalStateException("Invalid replica bounds: min=" + config.getMinReplicas()
                + " max=" + config.getMaxReplicas());
        }
    }

    @Scheduled(fixedDelayString = "${hacontroller.autoscale.tick-interval-ms:30000}",
               initialDelayString = "${hacontroller.autoscale.initial-delay-ms:30000}")
    public void scheduledTick() {
        if (!config.isEnabled()) {
            return;
        }
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Autoscale tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * The primary and the replicas. Fenced nodes serve no traffic and send no telemetry.
     */
    private static List<String> servingNodeIds(TopologySnapshot snapshot) {
        return snapshot.nodes().values().stream()
            .filter(n -> n.isPrimary() || n.isReplica())
            .map(Node::id)
            .collect(Collectors.toList());
    }

    /**
     * Run one control-loop iteration.
     *
     * @return the decision applied on this tick, if any
     */
    public synchronized Optional<ScalingDecision> tick() {
        Instant now = clock.instant();
        lastTickAt = now;

        TopologySnapshot snapshot = topologyStore.snapshot();
        int current = snapshot.replicas().size();
        AggregateMetrics metrics = metricAggregator.aggregate(servingNodeIds(snapshot));
        lastMetrics = metrics;

        if (!metrics.hasData()) {
            log.debug("No samples in the aggregation window, skipping autoscale tick");
            return Optional.empty();
        }
        if (metrics.partial()) {
            log.info("Scaling on partial data, no samples for {}", metrics.missingNodes());
        }

        int recommended = recommend(current, metrics);
        lastRecommendation = recommended;
        remember(now, recommended);

        if (recommended > current) {
            belowCurrentSince = null;
            return apply(ScalingDecision.of(current, recommended, describe(metrics, recommended), now));
        }
        if (recommended == current) {
            belowCurrentSince = null;
            return Optional.empty();
        }

        // recommended < current
        if (belowCurrentSince == null) {
            belowCurrentSince = now;
        }
        Duration below = Duration.between(belowCurrentSince, now);
        if (below.compareTo(config.getStabilizationWindow()) < 0) {
            log.debug("Scale-down to {} held: below current for {}s of {}s",
                recommended, below.toSeconds(), config.getStabilizationWindow().toSeconds());
            return Optional.empty();
        }
        if (topologyStore.isPromotionInProgress()) {
            structuredLogger.scaling().deferred(current, recommended, "promotion in progress");
            return Optional.empty();
        }

        int stabilized = recommendations.stream().mapToInt(Recommendation::desired).max().orElse(recommended);
        int desired = Math.max(stabilized, current - maxRemoval(current));
        if (desired >= current) {
            return Optional.empty();
        }
        return apply(ScalingDecision.of(current, desired, describe(metrics, stabilized), now));
    }

    int recommend(int current, AggregateMetrics metrics) {
        double ratio = Math.max(
            metrics.cpuPercent() / config.getTargetCpuPercent(),
            metrics.memPercent() / config.getTargetMemPercent());
        int raw = (int) Math.ceil(current * ratio);
        return Math.max(config.getMinReplicas(), Math.min(config.getMaxReplicas(), raw));
    }

    int maxRemoval(int current) {
        int byFraction = (int) Math.floor(current * config.getScaleDownMaxFraction());
        return Math.max(1, Math.max(config.getScaleDownMaxCount(), byFraction));
    }

    private void remember(Instant now, int recommended) {
        recommendations.addLast(new Recommendation(now, recommended));
        Instant cutoff = now.minus(config.getStabilizationWindow());
        while (!recommendations.isEmpty() && recommendations.peekFirst().at().isBefore(cutoff)) {
            recommendations.pollFirst();
        }
    }

    private Optional<ScalingDecision> apply(ScalingDecision decision) {
        try {
            collaborator.onScalingDecision(decision);
            collaborator.setReplicaCount(decision.desiredReplicas());
        } catch (ControlPlaneException e) {
            log.warn("Could not apply scaling decision {} -> {}: {}",
                decision.currentReplicas(), decision.desiredReplicas(), e.getMessage());
            return Optional.empty();
        }

        lastDecision = decision;
        if (decision.direction() == ScalingDecision.Direction.SCALE_DOWN) {
            belowCurrentSince = null;
        }
        metricsRegistry.recordScalingDecision(decision.direction().name(), decision.desiredReplicas());
        structuredLogger.scaling().decision(decision.currentReplicas(), decision.desiredReplicas(), decision.reason());
        eventPublisher.publish(ControllerEvent.create(ControllerEvent.EventType.SCALING_DECISION,
            ControllerEvent.Severity.INFO, null,
            decision.direction() + " " + decision.currentReplicas() + " -> " + decision.desiredReplicas(),
            Map.of("reason", decision.reason())));
        return Optional.of(decision);
    }

    private String describe(AggregateMetrics metrics, int recommended) {
        return String.format("%s cpu %.1f%% (target %.1f%%), mem %.1f%% (target %.1f%%), recommended %d",
            metrics.statistic(), metrics.cpuPercent(), config.getTargetCpuPercent(),
            metrics.memPercent(), config.getTargetMemPercent(), recommended);
    }

    public AutoscaleStatus status() {
        Instant since;
        synchronized (this) {
            since = belowCurrentSince;
        }
        return new AutoscaleStatus(config.isEnabled(), topologyStore.snapshot().replicas().size(),
            config.getMinReplicas(), config.getMaxReplicas(), lastRecommendation, since,
            lastMetrics, lastDecision, lastTickAt);
    }

    public Optional<ScalingDecision> lastDecision() {
        return Optional.ofNullable(lastDecision);
    }

    private record Recommendation(Instant at, int desired) {
    }
}
