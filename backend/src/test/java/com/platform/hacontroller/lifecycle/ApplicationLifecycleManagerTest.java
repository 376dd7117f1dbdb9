package com.platform.hacontroller.lifecycle;

import com.platform.hacontroller.model.NodeRole;
import com.platform.hacontroller.model.NodeSpec;
import com.platform.hacontroller.observability.MetricsRegistry;
import com.platform.hacontroller.support.MutableClock;
import com.platform.hacontroller.topology.TopologyReconciler;
import com.platform.hacontroller.topology.TopologyStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.boot.availability.ReadinessState;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ApplicationLifecycleManagerTest {

    private ApplicationEventPublisher eventPublisher;
    private TopologyReconciler reconciler;
    private TopologyStore store;
    private ApplicationLifecycleManager lifecycle;

    @BeforeEach
    void setUp() {
        eventPublisher = mock(ApplicationEventPublisher.class);
        reconciler = mock(TopologyReconciler.class);
        when(reconciler.isFirstReconcileSucceeded()).thenReturn(true);
        store = new TopologyStore(new MetricsRegistry(new SimpleMeterRegistry()));
        store.register(NodeSpec.primary("primary-1", "primary-1:3306"));
        store.register(NodeSpec.replica("replica-1", "replica-1:3306"));
        lifecycle = new ApplicationLifecycleManager(eventPublisher, reconciler, store,
            MutableClock.startingAt("2026-03-01T10:00:00Z"));
    }

    @Test
    void notReadyWhileStarting() {
        assertThat(lifecycle.isReady()).isFalse();
        assertThat(lifecycle.getStatus().phase()).isEqualTo(ApplicationLifecycleManager.LifecyclePhase.STARTING);
    }

    @Test
    void readyWithPrimaryAfterReconciliation() {
        lifecycle.markReady();

        assertThat(lifecycle.isReady()).isTrue();
        assertThat(lifecycle.getStatus().primaryId()).isEqualTo("primary-1");
    }

    @Test
    void notReadyBeforeFirstReconciliation() {
        when(reconciler.isFirstReconcileSucceeded()).thenReturn(false);
        lifecycle.markReady();

        assertThat(lifecycle.isReady()).isFalse();
    }

    @Test
    void readinessFollowsPrimaryPresence() {
        lifecycle.markReady();
        store.setRole("primary-1", NodeRole.FENCED);
        assertThat(lifecycle.isReady()).isFalse();

        store.tryBeginPromotion();
        assertThat(lifecycle.isReady()).isTrue();
    }

    @Test
    void drainingRefusesTraffic() {
        lifecycle.markReady();
        lifecycle.startDraining();
        lifecycle.startDraining();

        assertThat(lifecycle.isReady()).isFalse();
        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(eventPublisher, times(2)).publishEvent(captor.capture());
        assertThat(((AvailabilityChangeEvent<?>) captor.getAllValues().get(1)).getState())
            .isEqualTo(ReadinessState.REFUSING_TRAFFIC);
    }
}
