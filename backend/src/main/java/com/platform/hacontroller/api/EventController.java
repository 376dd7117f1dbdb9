package com.platform.hacontroller.api;

import com.platform.hacontroller.error.ValidationException;
import com.platform.hacontroller.events.ControllerEventPublisher;
import com.platform.hacontroller.model.ControllerEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final ControllerEventPublisher eventPublisher;

    /**
     * Most recent events first, optionally filtered by type.
     */
    @GetMapping
    public List<ControllerEvent> getEvents(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) ControllerEvent.EventType type) {
        if (limit < 1 || limit > 500) {
            throw new ValidationException("limit", limit, "must be between 1 and 500");
        }
        return eventPublisher.recent(limit, type);
    }
}
