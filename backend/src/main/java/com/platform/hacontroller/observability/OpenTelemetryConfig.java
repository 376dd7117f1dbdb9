package com.platform.hacontroller.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ResourceAttributes;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * OpenTelemetry SDK configuration. Promotion runs are traced, one span per run;
 * with otel.enabled=false a no-op tracer is used.
 */
@Slf4j
@Configuration
public class OpenTelemetryConfig {

    @Value("${otel.service.name:ha-controller}")
    private String serviceName;

    @Value("${otel.service.version:1.0.0}")
    private String serviceVersion;

    @Value("${otel.environment:development}")
    private String environment;

    @Value("${otel.exporter.otlp.endpoint:http://localhost:4317}")
    private String otlpEndpoint;

    @Value("${otel.enabled:false}")
    private boolean enabled;

    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);

    private SdkTracerProvider tracerProvider;

    @Bean
    public OpenTelemetry openTelemetry() {
        if (!enabled) {
            log.info("OpenTelemetry disabled");
            return OpenTelemetry.noop();
        }

        log.info("Initializing OpenTelemetry SDK: service={}, version={}, env={}, instance={}",
            serviceName, serviceVersion, environment, instanceId);

        OtlpGrpcSpanExporter spanExporter = OtlpGrpcSpanExporter.builder()
            .setEndpoint(otlpEndpoint)
            .setTimeout(10, TimeUnit.SECONDS)
            .build();

        tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(BatchSpanProcessor.builder(spanExporter)
                .setMaxQueueSize(2048)
                .setScheduleDelay(5, TimeUnit.SECONDS)
                .build())
            .setResource(resource())
            .build();

        OpenTelemetrySdk openTelemetry = OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
            .build();

        GlobalOpenTelemetry.resetForTest();
        GlobalOpenTelemetry.set(openTelemetry);

        log.info("OpenTelemetry SDK initialized, exporting to {}", otlpEndpoint);

        return openTelemetry;
    }

    Resource resource() {
        return Resource.getDefault()
            .merge(Resource.create(Attributes.builder()
                .put(ResourceAttributes.SERVICE_NAME, serviceName)
                .put(ResourceAttributes.SERVICE_VERSION, serviceVersion)
                .put(ResourceAttributes.DEPLOYMENT_ENVIRONMENT, environment)
                .put(ResourceAttributes.SERVICE_INSTANCE_ID, instanceId)
                .build()));
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(serviceName, serviceVersion);
    }

    @PreDestroy
    public void shutdown() {
        if (tracerProvider != null) {
            log.info("Shutting down OpenTelemetry SDK");
            tracerProvider.shutdown();
        }
    }
}
