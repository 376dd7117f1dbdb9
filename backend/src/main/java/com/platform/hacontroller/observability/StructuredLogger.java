package com.platform.hacontroller.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Structured logger for controller decisions.
 *
 * REPLACES: log.info("promoted node")
 * WITH: structuredLogger.failover().promotionCompleted(...)
 *
 * Every line is a JSON document on a dedicated "structured.*" logger.
 */
@Component
public class StructuredLogger {

    @Value("${otel.service.name:ha-controller}")
    private String serviceName;

    @Value("${otel.environment:development}")
    private String environment;

    public FailoverLogger failover() {
        return new FailoverLogger(serviceName, environment);
    }

    public ScalingLogger scaling() {
        return new ScalingLogger(serviceName, environment);
    }

    public RoutingLogger routing() {
        return new RoutingLogger(serviceName, environment);
    }

    public LifecycleLogger lifecycle() {
        return new LifecycleLogger(serviceName, environment);
    }

    // ==================== FAILOVER LOGGER ====================

    public static class FailoverLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.failover");
        private final String service;
        private final String environment;

        FailoverLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }

        public void primaryDownConfirmed(String nodeId, List<String> observers) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.PRIMARY_DOWN_CONFIRMED, "WARN")
                .actor("detector")
                .nodeId(nodeId)
                .context(Map.of("observers", observers))
                .build();
            log.warn(event.toJson());
        }

        public void nodeFenced(String nodeId, boolean success, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    success ? LogEventType.NODE_FENCED : LogEventType.FENCING_FAILED, success ? "INFO" : "ERROR")
                .actor("coordinator")
                .nodeId(nodeId)
                .action("fence")
                .success(success)
                .errorMessage(errorMessage)
                .build();
            if (success) {
                log.info(event.toJson());
            } else {
                log.error(event.toJson());
            }
        }

        public void promotionStarted(String oldPrimary, String candidate, String trigger) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.PROMOTION_STARTED, "INFO")
                .actor(trigger)
                .nodeId(candidate)
                .action("promote")
                .context(oldPrimary != null ? Map.of("old_primary", oldPrimary) : Map.of())
                .build();
            log.info(event.toJson());
        }

        public void promotionCompleted(String newPrimary, long durationMs, long generation) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.PROMOTION_COMPLETED, "INFO")
                .actor("coordinator")
                .nodeId(newPrimary)
                .action("promote")
                .success(true)
                .durationMs(durationMs)
                .generation(generation)
                .build();
            log.info(event.toJson());
        }

        public void promotionFailed(String candidate, String errorCode, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.PROMOTION_FAILED, "WARN")
                .actor("coordinator")
                .nodeId(candidate)
                .action("promote")
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.warn(event.toJson());
        }

        public void automationHalted(String reason) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.AUTOMATION_HALTED, "ERROR")
                .actor("coordinator")
                .message(reason)
                .build();
            log.error(event.toJson());
        }

        public void automationResumed(String actor) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.AUTOMATION_RESUMED, "INFO")
                .actor(actor)
                .build();
            log.info(event.toJson());
        }
    }

    // ==================== SCALING LOGGER ====================

    public static class ScalingLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.scaling");
        private final String service;
        private final String environment;

        ScalingLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }

        public void decision(int current, int desired, String reason) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.SCALING_DECISION, "INFO")
                .actor("autoscaler")
                .action(desired > current ? "scale_up" : "scale_down")
                .message(reason)
                .context(Map.of("current", current, "desired", desired))
                .build();
            log.info(event.toJson());
        }

        public void deferred(int current, int recommended, String reason) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.SCALING_DEFERRED, "DEBUG")
                .actor("autoscaler")
                .message(reason)
                .context(Map.of("current", current, "recommended", recommended))
                .build();
            log.debug(event.toJson());
        }
    }

    // ==================== ROUTING LOGGER ====================

    public static class RoutingLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.routing");
        private final String service;
        private final String environment;

        RoutingLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }

        public void mappingPublished(long generation, String writeEndpoint, int readCount, boolean degraded) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.MAPPING_PUBLISHED, degraded ? "WARN" : "INFO")
                .actor("router")
                .generation(generation)
                .context(Map.of(
                    "write_endpoint", writeEndpoint,
                    "read_endpoints", readCount,
                    "degraded", degraded))
                .build();
            if (degraded) {
                log.warn(event.toJson());
            } else {
                log.info(event.toJson());
            }
        }

        public void mappingRejected(String consumer, long lastApplied, long rejected) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.MAPPING_REJECTED, "ERROR")
                .actor(consumer)
                .generation(rejected)
                .success(false)
                .context(Map.of("last_applied", lastApplied))
                .build();
            log.error(event.toJson());
        }
    }

    // ==================== LIFECYCLE LOGGER ====================

    public static class LifecycleLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.lifecycle");
        private final String service;
        private final String environment;

        LifecycleLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }

        public void started(int nodes, long startupMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.APPLICATION_STARTED, "INFO")
                .actor("system")
                .durationMs(startupMs)
                .context(Map.of("nodes", nodes))
                .build();
            log.info(event.toJson());
        }

        public void shutdownStarted() {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.SHUTDOWN_STARTED, "INFO")
                .actor("system")
                .build();
            log.info(event.toJson());
        }

        public void shutdownCompleted(long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.SHUTDOWN_COMPLETED, "INFO")
                .actor("system")
                .durationMs(durationMs)
                .build();
            log.info(event.toJson());
        }
    }
}
