package com.platform.hacontroller.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Central registry for controller metrics: probe outcomes, quorum decisions,
 * promotions, endpoint generations and scaling decisions.
 */
@Slf4j
@Component
public class MetricsRegistry {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final Map<String, AtomicInteger> gaugeValues;
    private final AtomicLong endpointGeneration;

    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.gaugeValues = new ConcurrentHashMap<>();
        this.endpointGeneration = new AtomicLong(0);

        initializeMetrics();
    }

    private void initializeMetrics() {
        for (String role : new String[]{"PRIMARY", "REPLICA", "CANDIDATE", "FENCED"}) {
            registerGauge("hacontroller.topology.nodes", "role", role, () ->
                gaugeValues.computeIfAbsent("nodes." + role, k -> new AtomicInteger(0)).get());
        }
        registerGauge("hacontroller.autoscale.replicas.desired", "source", "autoscaler", () ->
            gaugeValues.computeIfAbsent("replicas.desired", k -> new AtomicInteger(0)).get());
        Gauge.builder("hacontroller.endpoints.generation", endpointGeneration::get)
            .register(meterRegistry);
        Gauge.builder("hacontroller.promotion.in_progress", () ->
                gaugeValues.computeIfAbsent("promotion.inProgress", k -> new AtomicInteger(0)).get())
            .register(meterRegistry);

        log.info("Metrics registry initialized");
    }

    private void registerGauge(String name, String tagKey, String tagValue, Supplier<Number> valueSupplier) {
        Gauge.builder(name, valueSupplier)
            .tag(tagKey, tagValue)
            .register(meterRegistry);
    }

    /**
     * Record one probe outcome for a node.
     */
    public void recordProbe(String nodeId, String status, long latencyMs) {
        incrementCounter("hacontroller.probe.result", "node", nodeId, "status", status);
        recordLatency("probe", latencyMs);
    }

    /**
     * Record an observation accepted by the failure detector.
     */
    public void recordObservation(String observerId, String verdict) {
        incrementCounter("hacontroller.detector.observations", "observer", observerId, "verdict", verdict);
    }

    public void recordQuorumOutcome(String nodeId, boolean reached) {
        incrementCounter("hacontroller.detector.quorum", "node", nodeId, "reached", String.valueOf(reached));
    }

    public void recordPromotion(String outcome, long durationMs) {
        incrementCounter("hacontroller.promotion.total", "outcome", outcome);
        recordLatency("promotion", durationMs);
    }

    public void recordFencing(String nodeId, boolean success) {
        incrementCounter("hacontroller.promotion.fencing", "node", nodeId, "success", String.valueOf(success));
    }

    public void recordEndpointPublished(long generation, boolean degraded) {
        endpointGeneration.set(generation);
        incrementCounter("hacontroller.endpoints.published", "degraded", String.valueOf(degraded));
    }

    public void recordScalingDecision(String direction, int desiredReplicas) {
        incrementCounter("hacontroller.autoscale.decisions", "direction", direction);
        gaugeValues.computeIfAbsent("replicas.desired", k -> new AtomicInteger(0)).set(desiredReplicas);
    }

    public void recordAlert(String eventType) {
        incrementCounter("hacontroller.alerts", "type", eventType);
    }

    public void updatePromotionInProgress(boolean inProgress) {
        gaugeValues.computeIfAbsent("promotion.inProgress", k -> new AtomicInteger(0)).set(inProgress ? 1 : 0);
    }

    /**
     * Update the per-role node gauges after a topology change.
     */
    public void updateNodeCounts(Map<String, Integer> countsByRole) {
        for (String role : new String[]{"PRIMARY", "REPLICA", "CANDIDATE", "FENCED"}) {
            gaugeValues.computeIfAbsent("nodes." + role, k -> new AtomicInteger(0))
                .set(countsByRole.getOrDefault(role, 0));
        }
    }

    /**
     * Record latency for an operation.
     */
    public void recordLatency(String operation, long latencyMs) {
        Timer timer = timers.computeIfAbsent(operation, k ->
            Timer.builder("hacontroller.operation.latency")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));

        timer.record(Duration.ofMillis(latencyMs));
    }

    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }

    public long getEndpointGeneration() {
        return endpointGeneration.get();
    }
}
