package com.platform.hacontroller.collaborator;

import com.platform.hacontroller.model.EndpointMapping;
import com.platform.hacontroller.model.NodeRole;
import com.platform.hacontroller.model.NodeSpec;
import com.platform.hacontroller.model.ScalingDecision;

import java.util.List;

/**
 * The cluster or orchestration platform that actually runs the store nodes.
 *
 * The controller never starts or stops processes itself; it asks the collaborator
 * to do so and reads back what the collaborator reports.
 */
public interface TopologyCollaborator {

    /**
     * Nodes as currently reported by the platform, including the role each one reports.
     */
    List<NodeSpec> listNodes();

    void registerNode(NodeSpec spec);

    void deregisterNode(String nodeId);

    /**
     * Ask a node to take a role. Returns once the command is accepted; the caller
     * confirms completion through {@link #listNodes()}.
     */
    void setNodeRole(String nodeId, NodeRole role);

    void setReplicaCount(int replicas);

    void onScalingDecision(ScalingDecision decision);

    void onEndpointMapping(EndpointMapping mapping);

    /**
     * Short name used in logs and on the status endpoints.
     */
    String getType();
}
