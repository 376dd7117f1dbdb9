package com.platform.hacontroller.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import lombok.Data;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

/**
 * Structured log event schema.
 *
 * Mandatory fields: timestamp, level, service, environment, event_type, actor.
 * Node, promotion and correlation ids are picked up from the MDC when present.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructuredLogEvent {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private String timestamp;
    private String level;
    private String service;
    private String environment;
    private LogEventType eventType;
    private String actor;

    private String correlationId;
    private String promotionId;

    private String message;
    private String nodeId;
    private String action;
    private Boolean success;
    private Long durationMs;
    private Long generation;
    private String errorCode;
    private String errorMessage;

    private Map<String, Object> context;

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            return String.format("{\"event_type\":\"%s\",\"message\":\"%s\",\"error\":\"serialization_failed\"}",
                eventType, message);
        }
    }

    public static StructuredLogEventBuilder fromContext(
            String service, String environment, LogEventType eventType, String level) {

        return StructuredLogEvent.builder()
            .timestamp(Instant.now().toString())
            .level(level)
            .service(service)
            .environment(environment)
            .eventType(eventType)
            .correlationId(MDC.get(LoggingConfig.MDC_CORRELATION_ID))
            .promotionId(MDC.get(LoggingConfig.MDC_PROMOTION_ID))
            .nodeId(MDC.get(LoggingConfig.MDC_NODE_ID));
    }
}
