package org.neuralchilli.shardpool.domain;

/**
 * Instruction returned to a worker in reply to its heartbeat.
 */
public enum HeartbeatResponse {
    /**
     * Worker registered (or re-registered after a restart)
     */
    ACKNOWLEDGE,

    /**
     * Worker speaks a different protocol version and must reload its config
     */
    STALE_CONFIG,

    /**
     * Worker was declared lost; its tasks have been written off and it must exit
     */
    TERMINATE_SELF
}
