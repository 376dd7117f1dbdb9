package com.platform.hacontroller.probe;

import com.platform.hacontroller.error.TransientProbeException;
import com.platform.hacontroller.model.HealthResult;
import com.platform.hacontroller.model.Node;

/**
 * One way of checking a store node's liveness and replication lag.
 * Implementations are selected by {@code hacontroller.probe.type}.
 */
public interface NodeProbe {

    /**
     * @return a healthy result, with lag when the node reports one
     * @throws TransientProbeException if the node could not be reached or answered wrongly
     */
    HealthResult probe(Node node);

    /**
     * Release any per-node resources once the node leaves the topology.
     */
    default void release(String nodeId) {
    }

    String getType();

    static HostAndPort parseAddress(String address, int defaultPort) {
        int colon = address.lastIndexOf(':');
        if (colon < 0) {
            return new HostAndPort(address, defaultPort);
        }
        return new HostAndPort(address.substring(0, colon), Integer.parseInt(address.substring(colon + 1)));
    }

    record HostAndPort(String host, int port) {
    }
}
