package com.platform.hacontroller.lifecycle;

import com.platform.hacontroller.config.HaControllerProperties;
import com.platform.hacontroller.events.KafkaEventProducer;
import com.platform.hacontroller.observability.MetricsRegistry;
import com.platform.hacontroller.observability.StructuredLogger;
import com.platform.hacontroller.probe.HealthProbeService;
import com.platform.hacontroller.promotion.PromotionCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orderly stop of the controller.
 *
 * Order:
 * 1. Leave the ready state
 * 2. Cancel probe schedules so no new observations are produced
 * 3. Let an in-flight promotion finish, up to the promotion timeout
 * 4. Flush queued controller events to Kafka
 */
@Slf4j
@Component
public class GracefulShutdownManager implements ApplicationListener<ContextClosedEvent> {

    private final ApplicationLifecycleManager lifecycleManager;
    private final HealthProbeService healthProbeService;
    private final PromotionCoordinator promotionCoordinator;
    private final KafkaEventProducer kafkaEventProducer;
    private final StructuredLogger structuredLogger;
    private final MetricsRegistry metricsRegistry;
    private final Duration promotionDrainTimeout;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownManager(ApplicationLifecycleManager lifecycleManager,
                                   HealthProbeService healthProbeService,
                                   PromotionCoordinator promotionCoordinator,
                                   KafkaEventProducer kafkaEventProducer,
                                   StructuredLogger structuredLogger,
                                   MetricsRegistry metricsRegistry,
                                   HaControllerProperties properties) {
        this.lifecycleManager = lifecycleManager;
        this.healthProbeService = healthProbeService;
        this.promotionCoordinator = promotionCoordinator;
        this.kafkaEventProducer = kafkaEventProducer;
        this.structuredLogger = structuredLogger;
        this.metricsRegistry = metricsRegistry;
        this.promotionDrainTimeout = properties.getPromotion().getTimeout();
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        performGracefulShutdown();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public synchronized void performGracefulShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return;
        }
        long start = System.currentTimeMillis();
        structuredLogger.lifecycle().shutdownStarted();

        log.info("[1/4] Draining");
        lifecycleManager.startDraining();

        log.info("[2/4] Stopping health probes");
        try {
            healthProbeService.stopAll();
        } catch (RuntimeException e) {
            log.error("Error stopping probes", e);
        }

        log.info("[3/4] Waiting for in-flight promotion");
        if (!promotionCoordinator.awaitIdle(promotionDrainTimeout)) {
            log.warn("Promotion still running after {}s, stopping anyway", promotionDrainTimeout.toSeconds());
        }

        log.info("[4/4] Flushing controller events ({} queued)", kafkaEventProducer.getQueuedEventCount());
        try {
            kafkaEventProducer.flush();
        } catch (RuntimeException e) {
            log.error("Error flushing Kafka", e);
        }

        long durationMs = System.currentTimeMillis() - start;
        metricsRegistry.incrementCounter("hacontroller.lifecycle.shutdown", "status", "complete");
        structuredLogger.lifecycle().shutdownCompleted(durationMs);
    }
}
