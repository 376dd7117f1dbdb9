package com.platform.hacontroller.events;

import com.platform.hacontroller.model.ControllerEvent;
import com.platform.hacontroller.observability.MetricsRegistry;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publishes controller events to the event backbone.
 * Events that cannot be delivered are queued and replayed once Kafka is reachable again.
 */
@Slf4j
@Component
public class KafkaEventProducer {

    private static final int MAX_QUEUED_EVENTS = 10_000;

    private final KafkaTemplate<String, ControllerEvent> kafkaTemplate;
    private final MetricsRegistry metricsRegistry;
    private final ConcurrentLinkedQueue<ControllerEvent> eventQueue;
    private final AtomicBoolean isKafkaAvailable;

    @Value("${hacontroller.kafka.event-topic:ha-controller-events}")
    private String eventTopic = "ha-controller-events";

    public KafkaEventProducer(
            KafkaTemplate<String, ControllerEvent> kafkaTemplate,
            MetricsRegistry metricsRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsRegistry = metricsRegistry;
        this.eventQueue = new ConcurrentLinkedQueue<>();
        this.isKafkaAvailable = new AtomicBoolean(true);
    }

    /**
     * Send one event, keyed by node id so events about a node stay ordered.
     */
    @CircuitBreaker(name = "kafka", fallbackMethod = "publishFallback")
    @Retry(name = "kafka")
    public CompletableFuture<Boolean> emit(ControllerEvent event) {
        long startTime = System.currentTimeMillis();

        CompletableFuture<SendResult<String, ControllerEvent>> future =
            kafkaTemplate.send(eventTopic, event.nodeId(), event);

        return future.thenApply(result -> {
            long latency = System.currentTimeMillis() - startTime;
            metricsRegistry.recordLatency("kafka.publish", latency);
            metricsRegistry.incrementCounter("hacontroller.events.published", "type", event.eventType().name());
            log.debug("Event published in {}ms: {}", latency, event.eventId());
            isKafkaAvailable.set(true);
            return true;
        }).exceptionally(ex -> {
            log.error("Failed to publish event {}: {}", event.eventId(), ex.getMessage());
            metricsRegistry.incrementCounter("hacontroller.events.failed", "type", event.eventType().name());
            enqueue(event);
            return false;
        });
    }

    @SuppressWarnings("unused")
    private CompletableFuture<Boolean> publishFallback(ControllerEvent event, Exception e) {
        log.warn("Kafka circuit breaker open, queuing event {}: {}", event.eventId(), e.getMessage());
        enqueue(event);
        return CompletableFuture.completedFuture(false);
    }

    private void enqueue(ControllerEvent event) {
        isKafkaAvailable.set(false);
        if (eventQueue.size() >= MAX_QUEUED_EVENTS) {
            ControllerEvent dropped = eventQueue.poll();
            log.warn("Event queue full, dropping oldest event {}", dropped != null ? dropped.eventId() : null);
        }
        eventQueue.offer(event);
        metricsRegistry.incrementCounter("hacontroller.events.queued");
    }

    /**
     * Replay queued events. Stops at the first failure so ordering is preserved.
     */
    @Scheduled(fixedDelayString = "${hacontroller.kafka.replay-interval-ms:30000}")
    public void processQueuedEvents() {
        if (eventQueue.isEmpty()) {
            return;
        }

        log.info("Replaying {} queued events", eventQueue.size());

        ControllerEvent event;
        while ((event = eventQueue.peek()) != null) {
            try {
                kafkaTemplate.send(eventTopic, event.nodeId(), event).join();
            } catch (RuntimeException e) {
                log.warn("Replay of queued event {} failed, will retry: {}", event.eventId(), e.getMessage());
                isKafkaAvailable.set(false);
                return;
            }
            eventQueue.poll();
            isKafkaAvailable.set(true);
        }
    }

    /**
     * Best-effort flush used during shutdown.
     */
    public void flush() {
        processQueuedEvents();
        kafkaTemplate.flush();
    }

    public int getQueuedEventCount() {
        return eventQueue.size();
    }

    public boolean isKafkaAvailable() {
        return isKafkaAvailable.get();
    }
}
