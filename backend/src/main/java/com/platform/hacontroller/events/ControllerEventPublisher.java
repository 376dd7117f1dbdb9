package com.platform.hacontroller.events;

import com.platform.hacontroller.model.ControllerEvent;
import com.platform.hacontroller.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for controller events and alerts.
 *
 * Each event is logged at a level matching its severity, kept in a bounded history
 * for the REST API, pushed to WebSocket subscribers and sent to Kafka.
 */
@Slf4j
@Component
public class ControllerEventPublisher {

    static final String EVENTS_TOPIC = "/topic/events";
    private static final int MAX_HISTORY = 500;

    private final KafkaEventProducer kafkaEventProducer;
    private final SimpMessagingTemplate messagingTemplate;
    private final MetricsRegistry metricsRegistry;
    private final Deque<ControllerEvent> history = new ConcurrentLinkedDeque<>();
    private final AtomicInteger historySize = new AtomicInteger();

    public ControllerEventPublisher(KafkaEventProducer kafkaEventProducer,
                                    SimpMessagingTemplate messagingTemplate,
                                    MetricsRegistry metricsRegistry) {
        this.kafkaEventProducer = kafkaEventProducer;
        this.messagingTemplate = messagingTemplate;
        this.metricsRegistry = metricsRegistry;
    }

    public void publish(ControllerEvent event) {
        logEvent(event);
        remember(event);
        if (event.isAlert()) {
            metricsRegistry.recordAlert(event.eventType().name());
        }

        try {
            messagingTemplate.convertAndSend(EVENTS_TOPIC, event);
        } catch (RuntimeException e) {
            log.warn("WebSocket push failed for event {}: {}", event.eventId(), e.getMessage());
        }

        try {
            kafkaEventProducer.emit(event);
        } catch (RuntimeException e) {
            log.warn("Kafka emit failed for event {}: {}", event.eventId(), e.getMessage());
        }
    }

    /**
     * Most recent events first.
     *
     * @param type optional filter, null for all types
     */
    public List<ControllerEvent> recent(int limit, ControllerEvent.EventType type) {
        List<ControllerEvent> result = new ArrayList<>();
        Iterator<ControllerEvent> it = history.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            ControllerEvent event = it.next();
            if (type == null || event.eventType() == type) {
                result.add(event);
            }
        }
        return result;
    }

    private void remember(ControllerEvent event) {
        history.addLast(event);
        if (historySize.incrementAndGet() > MAX_HISTORY) {
            history.pollFirst();
            historySize.decrementAndGet();
        }
    }

    private void logEvent(ControllerEvent event) {
        switch (event.severity()) {
            case CRITICAL -> log.error("ALERT {} node={}: {}", event.eventType(), event.nodeId(), event.message());
            case WARNING -> log.warn("{} node={}: {}", event.eventType(), event.nodeId(), event.message());
            default -> log.info("{} node={}: {}", event.eventType(), event.nodeId(), event.message());
        }
    }
}
