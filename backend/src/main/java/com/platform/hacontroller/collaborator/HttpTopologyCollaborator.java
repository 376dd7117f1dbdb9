package com.platform.hacontroller.collaborator;

import com.platform.hacontroller.error.SystemUnavailableException;
import com.platform.hacontroller.model.EndpointMapping;
import com.platform.hacontroller.model.NodeRole;
import com.platform.hacontroller.model.NodeSpec;
import com.platform.hacontroller.model.ScalingDecision;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Collaborator backed by an orchestration platform's REST API.
 *
 * Reads and commands fail with {@link SystemUnavailableException} while the circuit is
 * open. A stale node listing would make reconciliation drop nodes registered since, and
 * a swallowed command would make callers assume a role change happened when it did not.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "hacontroller.collaborator.type", havingValue = "http")
public class HttpTopologyCollaborator implements TopologyCollaborator {

    private final RestTemplate restTemplate;

    public HttpTopologyCollaborator(@Qualifier("collaboratorRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    @CircuitBreaker(name = "collaborator", fallbackMethod = "listNodesFallback")
    @Retry(name = "collaborator")
    public List<NodeSpec> listNodes() {
        NodeSpec[] body = restTemplate.getForObject("/nodes", NodeSpec[].class);
        return body != null ? Arrays.asList(body) : List.of();
    }

    @Override
    @CircuitBreaker(name = "collaborator", fallbackMethod = "registerNodeFallback")
    @Retry(name = "collaborator")
    public void registerNode(NodeSpec spec) {
        restTemplate.postForLocation("/nodes", spec);
        log.info("Registered node {} with orchestration API", spec.id());
    }

    @Override
    @CircuitBreaker(name = "collaborator", fallbackMethod = "deregisterNodeFallback")
    @Retry(name = "collaborator")
    public void deregisterNode(String nodeId) {
        restTemplate.delete("/nodes/{id}", nodeId);
        log.info("Deregistered node {} with orchestration API", nodeId);
    }

    @Override
    @CircuitBreaker(name = "collaborator", fallbackMethod = "setNodeRoleFallback")
    public void setNodeRole(String nodeId, NodeRole role) {
        // no retry: a duplicated promote or fence is not harmless to replay blindly
        restTemplate.put("/nodes/{id}/role", Map.of("role", role.name()), nodeId);
        log.info("Requested role {} for node {}", role, nodeId);
    }

    @Override
    @CircuitBreaker(name = "collaborator", fallbackMethod = "setReplicaCountFallback")
    @Retry(name = "collaborator")
    public void setReplicaCount(int replicas) {
        restTemplate.put("/replicas", Map.of("count", replicas));
        log.info("Requested replica count {}", replicas);
    }

    @Override
    @CircuitBreaker(name = "collaborator", fallbackMethod = "onScalingDecisionFallback")
    public void onScalingDecision(ScalingDecision decision) {
        restTemplate.postForLocation("/scaling-decisions", decision);
    }

    @Override
    @CircuitBreaker(name = "collaborator", fallbackMethod = "onEndpointMappingFallback")
    public void onEndpointMapping(EndpointMapping mapping) {
        restTemplate.postForLocation("/endpoint-mappings", mapping);
    }

    @Override
    public String getType() {
        return "http";
    }

    @SuppressWarnings("unused")
    private List<NodeSpec> listNodesFallback(Exception e) {
        throw SystemUnavailableException.collaborator("Listing nodes failed: " + e.getMessage(), e);
    }

    @SuppressWarnings("unused")
    private void setNodeRoleFallback(String nodeId, NodeRole role, Exception e) {
        throw SystemUnavailableException.collaborator(
            String.format("Role change to %s for %s failed: %s", role, nodeId, e.getMessage()), e);
    }

    @SuppressWarnings("unused")
    private void registerNodeFallback(NodeSpec spec, Exception e) {
        throw SystemUnavailableException.collaborator("Registering " + spec.id() + " failed: " + e.getMessage(), e);
    }

    @SuppressWarnings("unused")
    private void deregisterNodeFallback(String nodeId, Exception e) {
        throw SystemUnavailableException.collaborator("Deregistering " + nodeId + " failed: " + e.getMessage(), e);
    }

    @SuppressWarnings("unused")
    private void setReplicaCountFallback(int replicas, Exception e) {
        throw SystemUnavailableException.collaborator("Resize to " + replicas + " failed: " + e.getMessage(), e);
    }

    /**
     * Notifications are best effort; the next decision or mapping supersedes this one.
     */
    @SuppressWarnings("unused")
    private void onScalingDecisionFallback(ScalingDecision decision, Exception e) {
        log.warn("Scaling decision notification dropped ({} -> {}): {}",
            decision.currentReplicas(), decision.desiredReplicas(), e.getMessage());
    }

    @SuppressWarnings("unused")
    private void onEndpointMappingFallback(EndpointMapping mapping, Exception e) {
        log.warn("Endpoint mapping generation {} not delivered: {}", mapping.generation(), e.getMessage());
    }
}
