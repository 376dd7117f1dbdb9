package com.platform.hacontroller.api;

import com.platform.hacontroller.model.EndpointMapping;
import com.platform.hacontroller.routing.EndpointRouter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Client-facing resolution of the write and read endpoints.
 */
@RestController
@RequestMapping("/api/endpoints")
@RequiredArgsConstructor
public class EndpointController {

    private final EndpointRouter endpointRouter;

    /**
     * Latest published mapping, 204 before the first publication.
     */
    @GetMapping
    public ResponseEntity<EndpointMapping> getMapping() {
        return endpointRouter.latestMapping()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * Answers 503 with NoPrimary while no node holds the primary role.
     */
    @GetMapping("/write")
    public Map<String, Object> getWriteEndpoint() {
        String endpoint = endpointRouter.writeEndpoint();
        return Map.of("writeEndpoint", endpoint, "generation", endpointRouter.currentGeneration());
    }

    @GetMapping("/read")
    public Map<String, Object> getReadEndpoints() {
        List<String> endpoints = endpointRouter.readEndpoints();
        return Map.of("readEndpoints", endpoints, "generation", endpointRouter.currentGeneration());
    }
}
