package com.platform.hacontroller.api;

import com.platform.hacontroller.error.GlobalExceptionHandler;
import com.platform.hacontroller.error.PromotionInProgressException;
import com.platform.hacontroller.observability.MetricsRegistry;
import com.platform.hacontroller.promotion.PromotionCoordinator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.concurrent.CompletableFuture;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class FailoverControllerTest {

    private PromotionCoordinator coordinator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        coordinator = mock(PromotionCoordinator.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new FailoverController(coordinator))
            .setControllerAdvice(new GlobalExceptionHandler(new MetricsRegistry(new SimpleMeterRegistry())))
            .build();
    }

    @Test
    void failoverWithoutBodyPicksCandidateAutomatically() throws Exception {
        when(coordinator.forceFailover(null, false)).thenReturn(new CompletableFuture<>());

        mockMvc.perform(post("/api/failover"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.targetNodeId").value("auto"));

        verify(coordinator).forceFailover(null, false);
    }

    @Test
    void failoverToTarget() throws Exception {
        when(coordinator.forceFailover("replica-2", true)).thenReturn(new CompletableFuture<>());

        mockMvc.perform(post("/api/failover")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetNodeId\":\"replica-2\",\"abortInFlight\":true}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.targetNodeId").value("replica-2"));
    }

    @Test
    void promotionInProgressIsConflict() throws Exception {
        when(coordinator.forceFailover(null, false)).thenThrow(new PromotionInProgressException());

        mockMvc.perform(post("/api/failover"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("HA-312"));
    }

    @Test
    void resumeReportsHaltState() throws Exception {
        when(coordinator.resumeAutomaticPromotion()).thenReturn(true);
        when(coordinator.isHalted()).thenReturn(false);

        mockMvc.perform(post("/api/failover/resume"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.resumed").value(true))
            .andExpect(jsonPath("$.halted").value(false));
    }
}
