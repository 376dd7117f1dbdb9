package com.platform.hacontroller.api;

import com.platform.hacontroller.lifecycle.ApplicationLifecycleManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness and readiness for the platform's probes.
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

    private final ApplicationLifecycleManager lifecycleManager;

    @GetMapping("/live")
    public ResponseEntity<Map<String, String>> liveness() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    /**
     * Ready after the first reconciliation, while a primary exists or is being promoted.
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> readiness() {
        ApplicationLifecycleManager.LifecycleStatus status = lifecycleManager.getStatus();
        if (status.ready()) {
            return ResponseEntity.ok(Map.of(
                "status", "UP",
                "phase", status.phase().name(),
                "primary", status.primaryId() != null ? status.primaryId() : "promoting"
            ));
        }
        return ResponseEntity.status(503).body(Map.of(
            "status", "DOWN",
            "phase", status.phase().name(),
            "reconciled", status.reconciled(),
            "promotionInProgress", status.promotionInProgress()
        ));
    }
}
