package com.platform.hacontroller.collaborator;

import com.platform.hacontroller.config.HaControllerProperties;
import com.platform.hacontroller.error.ResourceNotFoundException;
import com.platform.hacontroller.error.SystemUnavailableException;
import com.platform.hacontroller.model.EndpointMapping;
import com.platform.hacontroller.model.NodeRole;
import com.platform.hacontroller.model.NodeSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTopologyCollaboratorTest {

    private InMemoryTopologyCollaborator platform;

    @BeforeEach
    void setUp() {
        HaControllerProperties properties = new HaControllerProperties();
        properties.getCollaborator().setReplicaAddressTemplate("replica-%d.db:3306");
        properties.getCollaborator().setNodes(List.of(
            NodeSpec.primary("primary-1", "primary-1.db:3306"),
            NodeSpec.replica("replica-1", "replica-1.db:3306"),
            NodeSpec.replica("replica-2", "replica-2.db:3306")));
        platform = new InMemoryTopologyCollaborator(properties);
    }

    private NodeRole reportedRole(String nodeId) {
        return platform.listNodes().stream()
            .filter(n -> n.id().equals(nodeId))
            .findFirst()
            .orElseThrow()
            .role();
    }

    private List<String> ids() {
        return platform.listNodes().stream().map(NodeSpec::id).collect(Collectors.toList());
    }

    @Test
    void listsSeededNodesInIdOrder() {
        assertThat(ids()).containsExactly("primary-1", "replica-1", "replica-2");
    }

    @Test
    void roleChangesAreReportedBack() {
        platform.setNodeRole("primary-1", NodeRole.FENCED);
        platform.setNodeRole("replica-1", NodeRole.PRIMARY);

        assertThat(reportedRole("primary-1")).isEqualTo(NodeRole.FENCED);
        assertThat(reportedRole("replica-1")).isEqualTo(NodeRole.PRIMARY);
    }

    @Test
    void unresponsiveNodeAcceptsButNeverCompletesPromotion() {
        platform.simulateUnresponsive("replica-1");

        platform.setNodeRole("replica-1", NodeRole.PRIMARY);

        assertThat(reportedRole("replica-1")).isEqualTo(NodeRole.REPLICA);
    }

    @Test
    void rejectedFencingFails() {
        platform.simulateFencingRejected("primary-1");

        assertThatThrownBy(() -> platform.setNodeRole("primary-1", NodeRole.FENCED))
            .isInstanceOf(SystemUnavailableException.class);
        assertThat(reportedRole("primary-1")).isEqualTo(NodeRole.PRIMARY);
    }

    @Test
    void scalingUpProvisionsNextOrdinals() {
        platform.setReplicaCount(4);

        assertThat(ids()).containsExactly("primary-1", "replica-1", "replica-2", "replica-3", "replica-4");
        assertThat(platform.listNodes().get(3).address()).isEqualTo("replica-3.db:3306");
    }

    @Test
    void scalingDownRemovesNewestReplicasAndNeverThePrimary() {
        platform.setReplicaCount(0);

        assertThat(ids()).containsExactly("primary-1");
    }

    @Test
    void unknownNodesAreRejected() {
        assertThatThrownBy(() -> platform.setNodeRole("ghost", NodeRole.PRIMARY))
            .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> platform.deregisterNode("ghost"))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void staleMappingIsNotApplied() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        EndpointMapping second = new EndpointMapping(2, "replica-1.db:3306", "replica-1",
            List.of("replica-2.db:3306"), false, now);
        EndpointMapping first = new EndpointMapping(1, "primary-1.db:3306", "primary-1",
            List.of("replica-1.db:3306", "replica-2.db:3306"), false, now);

        platform.onEndpointMapping(second);
        platform.onEndpointMapping(first);

        assertThat(platform.getAppliedMapping()).contains(second);
    }
}
