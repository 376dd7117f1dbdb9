package com.platform.hacontroller.api;

import com.platform.hacontroller.error.GlobalExceptionHandler;
import com.platform.hacontroller.error.NoPrimaryException;
import com.platform.hacontroller.model.EndpointMapping;
import com.platform.hacontroller.observability.MetricsRegistry;
import com.platform.hacontroller.routing.EndpointRouter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class EndpointControllerTest {

    private EndpointRouter router;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        router = mock(EndpointRouter.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new EndpointController(router))
            .setControllerAdvice(new GlobalExceptionHandler(new MetricsRegistry(new SimpleMeterRegistry())))
            .build();
    }

    @Test
    void writeEndpointWithGeneration() throws Exception {
        when(router.writeEndpoint()).thenReturn("primary-1:3306");
        when(router.currentGeneration()).thenReturn(4L);

        mockMvc.perform(get("/api/endpoints/write"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.writeEndpoint").value("primary-1:3306"))
            .andExpect(jsonPath("$.generation").value(4));
    }

    @Test
    void noPrimaryAnswersServiceUnavailable() throws Exception {
        when(router.writeEndpoint()).thenThrow(new NoPrimaryException("No node currently holds the primary role"));

        mockMvc.perform(get("/api/endpoints/write"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.code").value("HA-510"))
            .andExpect(jsonPath("$.path").value("/api/endpoints/write"));
    }

    @Test
    void readEndpointsList() throws Exception {
        when(router.readEndpoints()).thenReturn(List.of("replica-1:3306", "replica-2:3306"));
        when(router.currentGeneration()).thenReturn(2L);

        mockMvc.perform(get("/api/endpoints/read"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.readEndpoints.length()").value(2))
            .andExpect(jsonPath("$.readEndpoints[0]").value("replica-1:3306"));
    }

    @Test
    void mappingBeforeFirstPublicationIsEmpty() throws Exception {
        when(router.latestMapping()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/endpoints"))
            .andExpect(status().isNoContent());
    }

    @Test
    void latestMapping() throws Exception {
        when(router.latestMapping()).thenReturn(Optional.of(new EndpointMapping(7, "replica-1:3306", "replica-1",
            List.of("replica-1:3306"), true, Instant.parse("2026-03-01T10:00:00Z"))));

        mockMvc.perform(get("/api/endpoints"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.generation").value(7))
            .andExpect(jsonPath("$.primaryNodeId").value("replica-1"))
            .andExpect(jsonPath("$.degraded").value(true));
    }
}
