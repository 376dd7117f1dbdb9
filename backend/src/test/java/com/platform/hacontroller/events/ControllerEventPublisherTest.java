package com.platform.hacontroller.events;

import com.platform.hacontroller.model.ControllerEvent;
import com.platform.hacontroller.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ControllerEventPublisherTest {

    private KafkaEventProducer kafka;
    private SimpMessagingTemplate messagingTemplate;
    private SimpleMeterRegistry meterRegistry;
    private ControllerEventPublisher publisher;

    @BeforeEach
    void setUp() {
        kafka = mock(KafkaEventProducer.class);
        messagingTemplate = mock(SimpMessagingTemplate.class);
        meterRegistry = new SimpleMeterRegistry();
        publisher = new ControllerEventPublisher(kafka, messagingTemplate, new MetricsRegistry(meterRegistry));
    }

    @Test
    void eventIsPushedAndEmitted() {
        ControllerEvent event = ControllerEvent.info(ControllerEvent.EventType.NODE_REGISTERED, "replica-3", "joined");

        publisher.publish(event);

        verify(messagingTemplate).convertAndSend(ControllerEventPublisher.EVENTS_TOPIC, event);
        verify(kafka).emit(event);
    }

    @Test
    void recentReturnsNewestFirstWithFilter() {
        publisher.publish(ControllerEvent.info(ControllerEvent.EventType.NODE_SUSPECT, "primary-1", "first"));
        publisher.publish(ControllerEvent.warning(ControllerEvent.EventType.PRIMARY_PROMOTED, "replica-1", "second"));
        publisher.publish(ControllerEvent.info(ControllerEvent.EventType.NODE_SUSPECT, "replica-2", "third"));

        List<ControllerEvent> all = publisher.recent(10, null);
        assertThat(all).extracting(ControllerEvent::message).containsExactly("third", "second", "first");

        List<ControllerEvent> suspects = publisher.recent(1, ControllerEvent.EventType.NODE_SUSPECT);
        assertThat(suspects).extracting(ControllerEvent::message).containsExactly("third");
    }

    @Test
    void historyIsBounded() {
        for (int i = 0; i < 520; i++) {
            publisher.publish(ControllerEvent.info(ControllerEvent.EventType.SCALING_DECISION, null, "tick " + i));
        }

        List<ControllerEvent> recent = publisher.recent(1000, null);
        assertThat(recent).hasSize(500);
        assertThat(recent.get(0).message()).isEqualTo("tick 519");
    }

    @Test
    void criticalEventsCountAsAlerts() {
        publisher.publish(ControllerEvent.critical(ControllerEvent.EventType.NO_VIABLE_PRIMARY, null, "none left"));
        publisher.publish(ControllerEvent.info(ControllerEvent.EventType.NODE_REGISTERED, "replica-3", "joined"));

        assertThat(meterRegistry.get("hacontroller.alerts").tag("type", "NO_VIABLE_PRIMARY").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void webSocketFailureDoesNotStopKafkaEmit() {
        doThrow(new MessagingException("broker gone"))
            .when(messagingTemplate).convertAndSend(anyString(), any(Object.class));
        ControllerEvent event = ControllerEvent.warning(ControllerEvent.EventType.PROMOTION_TIMEOUT, "replica-1", "slow");

        publisher.publish(event);

        verify(kafka).emit(event);
        assertThat(publisher.recent(1, null)).containsExactly(event);
    }
}
