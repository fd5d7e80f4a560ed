package org.neuralchilli.shardpool.domain;

/**
 * Kinds of events the registry reports back to its caller.
 */
public enum WorkerEventType {
    WORKER_LOST(EventAddresses.WORKER_LOST),
    WORKER_HEALTHY(EventAddresses.WORKER_HEALTHY),
    WORKER_HOST_MISMATCH(EventAddresses.WORKER_HOST_MISMATCH),
    INITIAL_WAIT_ENDED(EventAddresses.INITIAL_WAIT_ENDED);

    private final String address;

    WorkerEventType(String address) {
        this.address = address;
    }

    /**
     * Event bus address events of this type are published on.
     */
    public String address() {
        return address;
    }
}
