package com.platform.hacontroller.lifecycle;

import com.platform.hacontroller.topology.TopologyReconciler;
import com.platform.hacontroller.topology.TopologySnapshot;
import com.platform.hacontroller.topology.TopologyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.boot.availability.ReadinessState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifecycle phase of the controller and its readiness rule.
 *
 * Phases: STARTING until the context is up, READY afterwards, DRAINING once shutdown
 * begins. The controller reports ready only in READY, after a first successful
 * reconciliation, and while it either has a primary or is promoting one.
 */
@Slf4j
@Component
public class ApplicationLifecycleManager {

    private final ApplicationEventPublisher eventPublisher;
    private final TopologyReconciler reconciler;
    private final TopologyStore topologyStore;
    private final Clock clock;

    private final AtomicReference<LifecyclePhase> currentPhase = new AtomicReference<>(LifecyclePhase.STARTING);
    private volatile Instant phaseStartTime;

    public ApplicationLifecycleManager(ApplicationEventPublisher eventPublisher,
                                       TopologyReconciler reconciler,
                                       TopologyStore topologyStore,
                                       Clock clock) {
        this.eventPublisher = eventPublisher;
        this.reconciler = reconciler;
        this.topologyStore = topologyStore;
        this.clock = clock;
        this.phaseStartTime = clock.instant();
    }

    public void markReady() {
        if (currentPhase.compareAndSet(LifecyclePhase.STARTING, LifecyclePhase.READY)) {
            phaseStartTime = clock.instant();
            log.info("Controller marked READY");
            AvailabilityChangeEvent.publish(eventPublisher, this, ReadinessState.ACCEPTING_TRAFFIC);
        }
    }

    public void startDraining() {
        LifecyclePhase previous = currentPhase.getAndSet(LifecyclePhase.DRAINING);
        if (previous != LifecyclePhase.DRAINING) {
            phaseStartTime = clock.instant();
            log.info("Controller entering DRAINING phase (was {})", previous);
            AvailabilityChangeEvent.publish(eventPublisher, this, ReadinessState.REFUSING_TRAFFIC);
        }
    }

    public LifecyclePhase getCurrentPhase() {
        return currentPhase.get();
    }

    public boolean isReady() {
        if (currentPhase.get() != LifecyclePhase.READY || !reconciler.isFirstReconcileSucceeded()) {
            return false;
        }
        TopologySnapshot snapshot = topologyStore.snapshot();
        return snapshot.primary().isPresent() || snapshot.promotionInProgress();
    }

    public LifecycleStatus getStatus() {
        TopologySnapshot snapshot = topologyStore.snapshot();
        return new LifecycleStatus(
            currentPhase.get(),
            phaseStartTime,
            reconciler.isFirstReconcileSucceeded(),
            snapshot.primaryId().orElse(null),
            snapshot.promotionInProgress(),
            isReady()
        );
    }

    public enum LifecyclePhase {
        STARTING,
        READY,
        DRAINING
    }

    public record LifecycleStatus(
        LifecyclePhase phase,
        Instant phaseStartTime,
        boolean reconciled,
        String primaryId,
        boolean promotionInProgress,
        boolean ready
    ) {}
}
