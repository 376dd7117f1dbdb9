package com.platform.hacontroller.model;

/**
 * Role a node plays in the replicated store.
 */
public enum NodeRole {
    /**
     * The single node accepting writes.
     */
    PRIMARY,

    /**
     * Receives a continuous copy of primary data and serves reads.
     */
    REPLICA,

    /**
     * Replica chosen for promotion while the promote command is in flight.
     */
    CANDIDATE,

    /**
     * Write capability revoked. Never routed to and never auto-promoted.
     */
    FENCED;

    public boolean acceptsWrites() {
        return this == PRIMARY;
    }
}
