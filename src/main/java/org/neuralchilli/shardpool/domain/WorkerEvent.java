package org.neuralchilli.shardpool.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;

/**
 * Actionable event emitted by the registry for its caller.
 *
 * @param type             what happened
 * @param shardId          affected shard, null for {@link WorkerEventType#INITIAL_WAIT_ENDED}
 * @param hostname         host the registry has on record for the shard
 * @param reportedHostname host the worker claimed, only set for host mismatches
 * @param runningTasks     tasks the worker was running, set for lost workers
 * @param at               registry time of the event
 */
public record WorkerEvent(
        WorkerEventType type,
        String shardId,
        String hostname,
        String reportedHostname,
        Set<String> runningTasks,
        Instant at
) implements Serializable {

    public WorkerEvent {
        if (type == null) {
            throw new IllegalArgumentException("Event type cannot be null");
        }
        if (at == null) {
            throw new IllegalArgumentException("Event time cannot be null");
        }
        if (type != WorkerEventType.INITIAL_WAIT_ENDED && (shardId == null || shardId.isBlank())) {
            throw new IllegalArgumentException("Shard ID is required for " + type);
        }
        runningTasks = runningTasks != null ? Set.copyOf(runningTasks) : Set.of();
    }

    public static WorkerEvent lost(Worker worker, Instant at) {
        return new WorkerEvent(WorkerEventType.WORKER_LOST, worker.shardId(), worker.hostname(),
                null, worker.runningTasks(), at);
    }

    public static WorkerEvent healthy(Worker worker, Instant at) {
        return new WorkerEvent(WorkerEventType.WORKER_HEALTHY, worker.shardId(), worker.hostname(),
                null, Set.of(), at);
    }

    public static WorkerEvent hostMismatch(Worker worker, String reportedHostname, Instant at) {
        return new WorkerEvent(WorkerEventType.WORKER_HOST_MISMATCH, worker.shardId(), worker.hostname(),
                reportedHostname, Set.of(), at);
    }

    public static WorkerEvent initialWaitEnded(Instant at) {
        return new WorkerEvent(WorkerEventType.INITIAL_WAIT_ENDED, null, null, null, Set.of(), at);
    }
}
