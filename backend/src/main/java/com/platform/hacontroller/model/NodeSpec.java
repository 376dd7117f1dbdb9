package com.platform.hacontroller.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Declarative description of a node as handed over by the topology collaborator.
 */
public record NodeSpec(
    @NotBlank String id,
    @NotBlank String address,
    @NotNull NodeRole role
) {

    public static NodeSpec replica(String id, String address) {
        return new NodeSpec(id, address, NodeRole.REPLICA);
    }

    public static NodeSpec primary(String id, String address) {
        return new NodeSpec(id, address, NodeRole.PRIMARY);
    }
}
