package com.platform.hacontroller.topology;

/**
 * Notified after every accepted topology mutation, on the mutating thread.
 */
@FunctionalInterface
public interface TopologyChangeListener {

    void onTopologyChanged(TopologySnapshot previous, TopologySnapshot current);
}
