package com.platform.hacontroller.lifecycle;

import com.platform.hacontroller.observability.StructuredLogger;
import com.platform.hacontroller.routing.EndpointRouter;
import com.platform.hacontroller.topology.TopologyReconciler;
import com.platform.hacontroller.topology.TopologyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;

/**
 * Bootstraps the topology from the collaborator once the context is up, then marks
 * the controller ready.
 */
@Slf4j
@Component
public class ApplicationStartupListener {

    private final ApplicationLifecycleManager lifecycleManager;
    private final TopologyReconciler reconciler;
    private final TopologyStore topologyStore;
    private final EndpointRouter endpointRouter;
    private final StructuredLogger structuredLogger;

    public ApplicationStartupListener(ApplicationLifecycleManager lifecycleManager,
                                      TopologyReconciler reconciler,
                                      TopologyStore topologyStore,
                                      EndpointRouter endpointRouter,
                                      StructuredLogger structuredLogger) {
        this.lifecycleManager = lifecycleManager;
        this.reconciler = reconciler;
        this.topologyStore = topologyStore;
        this.endpointRouter = endpointRouter;
        this.structuredLogger = structuredLogger;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        try {
            int added = reconciler.reconcile();
            log.info("Bootstrap reconciliation registered {} nodes", added);
        } catch (RuntimeException e) {
            // the scheduled reconciler retries; readiness stays false until it succeeds
            log.error("Bootstrap reconciliation failed: {}", e.getMessage(), e);
        }

        if (topologyStore.snapshot().primary().isPresent() && endpointRouter.latestMapping().isEmpty()) {
            endpointRouter.publish();
        }

        lifecycleManager.markReady();
        long startupMs = System.currentTimeMillis() - ManagementFactory.getRuntimeMXBean().getStartTime();
        structuredLogger.lifecycle().started(topologyStore.snapshot().nodes().size(), startupMs);
    }
}
