package com.platform.hacontroller.api;

import com.platform.hacontroller.detection.DetectorState;
import com.platform.hacontroller.detection.QuorumFailureDetector;
import com.platform.hacontroller.error.GlobalExceptionHandler;
import com.platform.hacontroller.error.ValidationException;
import com.platform.hacontroller.model.Observation;
import com.platform.hacontroller.model.Verdict;
import com.platform.hacontroller.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ObservationControllerTest {

    private QuorumFailureDetector detector;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        detector = mock(QuorumFailureDetector.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ObservationController(detector))
            .setControllerAdvice(new GlobalExceptionHandler(new MetricsRegistry(new SimpleMeterRegistry())))
            .build();
    }

    @Test
    void acceptedObservationReturnsDetectorState() throws Exception {
        when(detector.submit(any(Observation.class))).thenReturn(DetectorState.SUSPECT);

        mockMvc.perform(post("/api/observations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"observerId\":\"obs-b\",\"nodeId\":\"primary-1\",\"verdict\":\"DOWN\","
                    + "\"timestamp\":\"2026-03-01T10:00:00Z\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.nodeId").value("primary-1"))
            .andExpect(jsonPath("$.state").value("SUSPECT"));

        verify(detector).submit(new Observation("obs-b", "primary-1", Verdict.DOWN,
            Instant.parse("2026-03-01T10:00:00Z")));
    }

    @Test
    void unknownObserverIsRejected() throws Exception {
        when(detector.submit(any(Observation.class))).thenThrow(ValidationException.unknownObserver("rogue"));

        mockMvc.perform(post("/api/observations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"observerId\":\"rogue\",\"nodeId\":\"primary-1\",\"verdict\":\"DOWN\","
                    + "\"timestamp\":\"2026-03-01T10:00:00Z\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("HA-104"))
            .andExpect(jsonPath("$.fieldErrors[0].field").value("observerId"));
    }

    @Test
    void missingVerdictFailsValidation() throws Exception {
        mockMvc.perform(post("/api/observations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"observerId\":\"obs-a\",\"nodeId\":\"primary-1\","
                    + "\"timestamp\":\"2026-03-01T10:00:00Z\"}"))
            .andExpect(status().isBadRequest());

        verify(detector, never()).submit(any());
    }

    @Test
    void statusOfUnknownNodeIsNotFound() throws Exception {
        when(detector.status("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/observations/ghost"))
            .andExpect(status().isNotFound());
    }
}
