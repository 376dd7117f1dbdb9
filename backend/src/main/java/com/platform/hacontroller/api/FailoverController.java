package com.platform.hacontroller.api;

import com.platform.hacontroller.promotion.PromotionCoordinator;
import com.platform.hacontroller.promotion.PromotionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator failover controls.
 */
@Slf4j
@RestController
@RequestMapping("/api/failover")
public class FailoverController {

    private final PromotionCoordinator promotionCoordinator;

    public FailoverController(PromotionCoordinator promotionCoordinator) {
        this.promotionCoordinator = promotionCoordinator;
    }

    /**
     * Start a forced failover. The promotion runs asynchronously; poll
     * {@code /api/failover/status} for the result.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> failover(@RequestBody(required = false) FailoverRequest request) {
        FailoverRequest effective = request != null ? request : new FailoverRequest(null, false);
        log.warn("Manual failover requested (target={}, abortInFlight={})",
            effective.targetNodeId(), effective.abortInFlight());

        promotionCoordinator.forceFailover(effective.targetNodeId(), effective.abortInFlight())
            .whenComplete((result, error) -> {
                if (error != null) {
                    log.error("Manual failover did not run: {}", error.getMessage());
                } else {
                    log.info("Manual failover finished: {}", result.outcome());
                }
            });

        return ResponseEntity.accepted().body(Map.of(
            "accepted", true,
            "targetNodeId", effective.targetNodeId() != null ? effective.targetNodeId() : "auto"
        ));
    }

    @PostMapping("/resume")
    public Map<String, Object> resume() {
        boolean resumed = promotionCoordinator.resumeAutomaticPromotion();
        return Map.of("resumed", resumed, "halted", promotionCoordinator.isHalted());
    }

    @GetMapping("/status")
    public PromotionStatus status() {
        return promotionCoordinator.status();
    }

    public record FailoverRequest(String targetNodeId, boolean abortInFlight) {
    }
}
