package com.platform.hacontroller.api;

import com.platform.hacontroller.collaborator.TopologyCollaborator;
import com.platform.hacontroller.error.DuplicateNodeException;
import com.platform.hacontroller.error.ResourceNotFoundException;
import com.platform.hacontroller.error.ValidationException;
import com.platform.hacontroller.model.Node;
import com.platform.hacontroller.model.NodeSpec;
import com.platform.hacontroller.topology.TopologyReconciler;
import com.platform.hacontroller.topology.TopologySnapshot;
import com.platform.hacontroller.topology.TopologyStore;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for topology membership.
 */
@Slf4j
@RestController
@RequestMapping("/api/topology")
public class TopologyController {

    private final TopologyStore topologyStore;
    private final TopologyCollaborator collaborator;
    private final TopologyReconciler reconciler;

    public TopologyController(TopologyStore topologyStore,
                              TopologyCollaborator collaborator,
                              TopologyReconciler reconciler) {
        this.topologyStore = topologyStore;
        this.collaborator = collaborator;
        this.reconciler = reconciler;
    }

    @GetMapping
    public TopologySnapshot getTopology() {
        return topologyStore.snapshot();
    }

    /**
     * Register a node on the platform and start tracking it.
     */
    @PostMapping("/nodes")
    public ResponseEntity<Node> registerNode(@Valid @RequestBody NodeSpec spec) {
        if (topologyStore.snapshot().contains(spec.id())) {
            throw new DuplicateNodeException(spec.id());
        }
        log.info("Operator registering node {} at {} as {}", spec.id(), spec.address(), spec.role());
        collaborator.registerNode(spec);
        return ResponseEntity.status(HttpStatus.CREATED).body(reconciler.admit(spec));
    }

    /**
     * Deregister a node. The current primary must be failed over first.
     */
    @DeleteMapping("/nodes/{id}")
    public ResponseEntity<Void> deregisterNode(@PathVariable String id) {
        TopologySnapshot snapshot = topologyStore.snapshot();
        if (!snapshot.contains(id)) {
            throw ResourceNotFoundException.node(id);
        }
        if (snapshot.primaryId().filter(id::equals).isPresent()) {
            throw new ValidationException("id", id, "is the current primary; fail over before deregistering");
        }
        log.info("Operator deregistering node {}", id);
        collaborator.deregisterNode(id);
        reconciler.remove(id);
        return ResponseEntity.noContent().build();
    }
}
