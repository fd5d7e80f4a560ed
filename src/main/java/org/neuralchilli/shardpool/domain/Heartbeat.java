package org.neuralchilli.shardpool.domain;

import java.io.Serial;
import java.io.Serializable;

/**
 * Periodic liveness message sent by a worker to the scheduler.
 */
public final class Heartbeat implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String shardId;
    private final String hostname;
    private final WorkerIdentity identity;

    public Heartbeat(String shardId, String hostname, WorkerIdentity identity) {
        if (shardId == null || shardId.isBlank()) {
            throw new IllegalArgumentException("Shard ID cannot be null or empty");
        }
        if (hostname == null || hostname.isBlank()) {
            throw new IllegalArgumentException("Hostname cannot be null or empty");
        }
        if (identity == null) {
            throw new IllegalArgumentException("Worker identity cannot be null");
        }
        this.shardId = shardId;
        this.hostname = hostname;
        this.identity = identity;
    }

    public static Heartbeat of(String shardId, String hostname, WorkerIdentity identity) {
        return new Heartbeat(shardId, hostname, identity);
    }

    public String shardId() {
        return shardId;
    }

    public String hostname() {
        return hostname;
    }

    public WorkerIdentity identity() {
        return identity;
    }

    @Override
    public String toString() {
        return "Heartbeat[shardId=" + shardId +
                ", hostname=" + hostname +
                ", instanceId=" + identity.instanceId() +
                ", protocolVersion=" + identity.protocolVersion() +
                "]";
    }
}
