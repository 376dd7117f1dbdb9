package com.platform.hacontroller.telemetry;

import com.platform.hacontroller.config.HaControllerProperties;
import com.platform.hacontroller.error.ResourceNotFoundException;
import com.platform.hacontroller.error.ValidationException;
import com.platform.hacontroller.model.AggregateMetrics;
import com.platform.hacontroller.model.MetricSample;
import com.platform.hacontroller.topology.TopologyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding window of telemetry samples per node.
 *
 * Samples older than the window are evicted lazily on ingest and on read. The lag of
 * a node's newest sample becomes the node's replication lag in the topology, which
 * is what promotion ranks candidates by.
 */
@Slf4j
@Component
public class MetricAggregator {

    private final Map<String, Deque<MetricSample>> samples = new ConcurrentHashMap<>();
    private final Duration window;
    private final AggregationStatistic statistic;
    private final TopologyStore topologyStore;
    private final Clock clock;

    public MetricAggregator(HaControllerProperties properties, TopologyStore topologyStore, Clock clock) {
        this.window = properties.getAggregator().getWindow();
        this.statistic = properties.getAggregator().getStatistic();
        this.topologyStore = topologyStore;
        this.clock = clock;
        if (statistic == null) {
            throw new IllegalStateException("hacontroller.aggregator.statistic must be configured");
        }
        log.info("Metric aggregator: window={}s statistic={}", window.toSeconds(), statistic);
    }

    public void ingest(MetricSample sample) {
        validate(sample);
        Instant cutoff = clock.instant().minus(window);
        if (sample.timestamp().isBefore(cutoff)) {
            log.debug("Dropping sample for {} older than the window: {}", sample.nodeId(), sample.timestamp());
            return;
        }
        Deque<MetricSample> deque = samples.computeIfAbsent(sample.nodeId(), id -> new ArrayDeque<>());
        boolean newest;
        synchronized (deque) {
            newest = deque.stream().noneMatch(s -> s.timestamp().isAfter(sample.timestamp()));
            deque.addLast(sample);
            evict(deque, cutoff);
        }
        if (newest) {
            recordLag(sample);
        }
    }

    private void recordLag(MetricSample sample) {
        Duration lag = Duration.ofMillis(Math.round(sample.lagSeconds() * 1000));
        try {
            topologyStore.update(sample.nodeId(), n -> n.withLag(lag));
        } catch (ResourceNotFoundException e) {
            log.debug("Telemetry for {} which is not in the topology, lag not recorded", sample.nodeId());
        }
    }

    /**
     * Aggregate over the given nodes. Nodes without an in-window sample are left out
     * and reported as missing.
     */
    public AggregateMetrics aggregate(Collection<String> nodeIds) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);

        List<Double> cpu = new ArrayList<>();
        List<Double> mem = new ArrayList<>();
        double maxLag = 0.0;
        Set<String> missing = new TreeSet<>();

        for (String nodeId : nodeIds) {
            Deque<MetricSample> deque = samples.get(nodeId);
            if (deque == null) {
                missing.add(nodeId);
                continue;
            }
            synchronized (deque) {
                evict(deque, cutoff);
                MetricSample latest = null;
                for (MetricSample sample : deque) {
                    // samples may arrive out of order, so eviction from the head is not enough
                    if (sample.timestamp().isBefore(cutoff)) {
                        continue;
                    }
                    cpu.add(sample.cpuPercent());
                    mem.add(sample.memPercent());
                    if (latest == null || sample.timestamp().isAfter(latest.timestamp())) {
                        latest = sample;
                    }
                }
                if (latest == null) {
                    missing.add(nodeId);
                    continue;
                }
                maxLag = Math.max(maxLag, latest.lagSeconds());
            }
        }

        if (cpu.isEmpty()) {
            return AggregateMetrics.empty(statistic.name(), missing, now);
        }
        if (!missing.isEmpty()) {
            log.debug("Partial telemetry, no samples for {}", missing);
        }
        return new AggregateMetrics(
            statistic.apply(toArray(cpu)),
            statistic.apply(toArray(mem)),
            maxLag,
            statistic.name(),
            cpu.size(),
            !missing.isEmpty(),
            missing,
            now);
    }

    public void forget(String nodeId) {
        samples.remove(nodeId);
    }

    public AggregationStatistic getStatistic() {
        return statistic;
    }

    public Duration getWindow() {
        return window;
    }

    private void validate(MetricSample sample) {
        if (sample.nodeId() == null || sample.nodeId().isBlank()) {
            throw new ValidationException("nodeId", sample.nodeId(), "must not be blank");
        }
        if (sample.timestamp() == null) {
            throw new ValidationException("timestamp", null, "must not be null");
        }
        if (sample.cpuPercent() < 0 || sample.cpuPercent() > 100) {
            throw new ValidationException("cpuPercent", sample.cpuPercent(), "must be between 0 and 100");
        }
        if (sample.memPercent() < 0 || sample.memPercent() > 100) {
            throw new ValidationException("memPercent", sample.memPercent(), "must be between 0 and 100");
        }
        if (sample.lagSeconds() < 0) {
            throw new ValidationException("lagSeconds", sample.lagSeconds(), "must not be negative");
        }
    }

    private static void evict(Deque<MetricSample> deque, Instant cutoff) {
        while (!deque.isEmpty() && deque.peekFirst().timestamp().isBefore(cutoff)) {
            deque.pollFirst();
        }
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
