package com.platform.hacontroller.api;

import com.platform.hacontroller.detection.DetectorState;
import com.platform.hacontroller.detection.NodeDetectionStatus;
import com.platform.hacontroller.detection.QuorumFailureDetector;
import com.platform.hacontroller.error.ResourceNotFoundException;
import com.platform.hacontroller.model.Observation;
import com.platform.hacontroller.observability.LoggingConfig;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Intake for observations from remote observer instances.
 */
@Slf4j
@RestController
@RequestMapping("/api/observations")
public class ObservationController {

    private final QuorumFailureDetector failureDetector;

    public ObservationController(QuorumFailureDetector failureDetector) {
        this.failureDetector = failureDetector;
    }

    @PostMapping
    public Map<String, Object> submit(@Valid @RequestBody Observation observation) {
        LoggingConfig.setObserverContext(observation.observerId(), observation.nodeId());
        try {
            log.debug("Observation {} for {} from {}", observation.verdict(), observation.nodeId(),
                observation.observerId());
            DetectorState state = failureDetector.submit(observation);
            return Map.of("nodeId", observation.nodeId(), "state", state);
        } finally {
            LoggingConfig.clearObserverContext();
        }
    }

    @GetMapping("/{nodeId}")
    public NodeDetectionStatus getStatus(@PathVariable String nodeId) {
        return failureDetector.status(nodeId)
            .orElseThrow(() -> ResourceNotFoundException.node(nodeId));
    }
}
