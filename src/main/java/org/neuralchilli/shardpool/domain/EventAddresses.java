package org.neuralchilli.shardpool.domain;

/**
 * Event bus addresses for registry events.
 */
public final class EventAddresses {

    public static final String WORKER_LOST = "workers.lost";
    public static final String WORKER_HEALTHY = "workers.healthy";
    public static final String WORKER_HOST_MISMATCH = "workers.host-mismatch";
    public static final String INITIAL_WAIT_ENDED = "workers.initial-wait-ended";

    private EventAddresses() {
    }
}
