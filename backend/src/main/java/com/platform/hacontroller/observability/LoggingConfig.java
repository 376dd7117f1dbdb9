package com.platform.hacontroller.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation ids for HTTP requests plus MDC helpers
 * for the node, observer and promotion being worked on.
 */
@Slf4j
@Configuration
public class LoggingConfig {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_NODE_ID = "nodeId";
    public static final String MDC_OBSERVER_ID = "observerId";
    public static final String MDC_PROMOTION_ID = "promotionId";

    @Value("${spring.application.name:ha-controller}")
    private String applicationName;

    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);

        log.info("Logging configuration initialized for application: {}", applicationName);
    }

    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }

    public static class CorrelationIdFilter extends OncePerRequestFilter {

        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_REQUEST_PATH = "requestPath";
        private static final String MDC_REQUEST_METHOD = "requestMethod";

        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {

            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }

                MDC.put(MDC_CORRELATION_ID, correlationId);
                MDC.put(MDC_REQUEST_PATH, request.getRequestURI());
                MDC.put(MDC_REQUEST_METHOD, request.getMethod());

                response.setHeader(CORRELATION_ID_HEADER, correlationId);

                filterChain.doFilter(request, response);

            } finally {
                MDC.remove(MDC_CORRELATION_ID);
                MDC.remove(MDC_REQUEST_PATH);
                MDC.remove(MDC_REQUEST_METHOD);
            }
        }
    }

    public static void setNodeContext(String nodeId) {
        MDC.put(MDC_NODE_ID, nodeId);
    }

    public static void clearNodeContext() {
        MDC.remove(MDC_NODE_ID);
    }

    public static void setObserverContext(String observerId, String nodeId) {
        MDC.put(MDC_OBSERVER_ID, observerId);
        MDC.put(MDC_NODE_ID, nodeId);
    }

    public static void clearObserverContext() {
        MDC.remove(MDC_OBSERVER_ID);
        MDC.remove(MDC_NODE_ID);
    }

    /**
     * Tag every log line of a promotion run with its id.
     */
    public static void setPromotionContext(String promotionId) {
        MDC.put(MDC_PROMOTION_ID, promotionId);
    }

    public static void clearPromotionContext() {
        MDC.remove(MDC_PROMOTION_ID);
    }
}
