package com.platform.hacontroller.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.semconv.ResourceAttributes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class OpenTelemetryConfigTest {

    private OpenTelemetryConfig config;

    @BeforeEach
    void setUp() {
        config = new OpenTelemetryConfig();
        ReflectionTestUtils.setField(config, "serviceName", "ha-controller");
        ReflectionTestUtils.setField(config, "serviceVersion", "2.1.0");
        ReflectionTestUtils.setField(config, "environment", "staging");
    }

    @Test
    void resourceCarriesServiceIdentity() {
        Resource resource = config.resource();

        assertThat(resource.getAttribute(ResourceAttributes.SERVICE_NAME)).isEqualTo("ha-controller");
        assertThat(resource.getAttribute(ResourceAttributes.SERVICE_VERSION)).isEqualTo("2.1.0");
        assertThat(resource.getAttribute(ResourceAttributes.DEPLOYMENT_ENVIRONMENT)).isEqualTo("staging");
        assertThat(resource.getAttribute(ResourceAttributes.SERVICE_INSTANCE_ID)).hasSize(8);
    }

    @Test
    void disabledTracingUsesNoopTracer() {
        ReflectionTestUtils.setField(config, "enabled", false);

        OpenTelemetry openTelemetry = config.openTelemetry();

        assertThat(openTelemetry).isSameAs(OpenTelemetry.noop());
        assertThat(config.tracer(openTelemetry)).isNotNull();
    }
}
