package org.neuralchilli.shardpool.domain;

import java.io.Serializable;
import java.time.Instant;

/**
 * Identity of one running worker process.
 * A shard keeps its id across restarts; the instance id changes every time
 * the worker process starts.
 */
public record WorkerIdentity(
        String instanceId,
        int protocolVersion,
        Instant startedAt
) implements Serializable {

    public WorkerIdentity {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("Instance ID cannot be null or empty");
        }
        if (protocolVersion < 0) {
            throw new IllegalArgumentException("Protocol version cannot be negative");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("Started at cannot be null");
        }
    }

    public static WorkerIdentity of(String instanceId, int protocolVersion, Instant startedAt) {
        return new WorkerIdentity(instanceId, protocolVersion, startedAt);
    }

    public boolean isSameInstance(WorkerIdentity other) {
        return other != null && instanceId.equals(other.instanceId);
    }
}
