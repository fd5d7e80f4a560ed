package org.neuralchilli.shardpool.domain;

/**
 * Health state of a remote worker, as seen by the scheduler.
 */
public enum WorkerHealth {
    /**
     * Registered, but its running tasks have not been reported yet
     */
    NEW,

    /**
     * Heartbeating and fully reconciled
     */
    HEALTHY,

    /**
     * Missed heartbeats for longer than the suspect threshold
     */
    SUSPECTED_LOST,

    /**
     * Missed heartbeats for longer than the lost threshold.
     * Its tasks are assumed dead.
     */
    LOST;

    /**
     * Check if worker can accept new tasks
     */
    public boolean canAcceptWork() {
        return this == HEALTHY;
    }
}
