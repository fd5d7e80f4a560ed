package org.neuralchilli.shardpool.domain;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Represents a remote worker that executes tasks.
 * Keyed by shard id, which survives worker restarts and host moves.
 * Immutable: every transition returns a new record.
 */
public record Worker(
        String shardId,
        String hostname,
        WorkerIdentity identity,
        WorkerHealth health,
        Instant lastHeartbeat,
        Set<String> runningTasks,
        boolean runningTasksKnown
) implements Serializable {

    public Worker {
        if (shardId == null || shardId.isBlank()) {
            throw new IllegalArgumentException("Shard ID cannot be null or empty");
        }
        if (hostname == null || hostname.isBlank()) {
            throw new IllegalArgumentException("Hostname cannot be null or empty");
        }
        if (identity == null) {
            throw new IllegalArgumentException("Identity cannot be null");
        }
        if (health == null) {
            throw new IllegalArgumentException("Health cannot be null");
        }
        if (lastHeartbeat == null) {
            throw new IllegalArgumentException("Last heartbeat cannot be null");
        }
        runningTasks = runningTasks != null ? Set.copyOf(runningTasks) : Set.of();
    }

    /**
     * Register a worker seen for the first time
     */
    public static Worker register(Heartbeat heartbeat, Instant now) {
        return new Worker(
                heartbeat.shardId(),
                heartbeat.hostname(),
                heartbeat.identity(),
                WorkerHealth.NEW,
                now,
                Set.of(),
                false
        );
    }

    /**
     * Update heartbeat
     */
    public Worker heartbeat(Instant now) {
        return new Worker(shardId, hostname, identity, health, now, runningTasks, runningTasksKnown);
    }

    public Worker withHealth(WorkerHealth newHealth) {
        return new Worker(shardId, hostname, identity, newHealth, lastHeartbeat, runningTasks, runningTasksKnown);
    }

    public Worker markHealthy() {
        return withHealth(WorkerHealth.HEALTHY);
    }

    public Worker markSuspected() {
        return withHealth(WorkerHealth.SUSPECTED_LOST);
    }

    public Worker markLost() {
        return withHealth(WorkerHealth.LOST);
    }

    /**
     * Replace the running-task set with what the worker reported.
     */
    public Worker withRunningTasks(Set<String> taskIds) {
        return new Worker(shardId, hostname, identity, health, lastHeartbeat, taskIds, true);
    }

    /**
     * Same shard, new worker process. Nothing carries over from the old instance.
     */
    public Worker restartedAs(WorkerIdentity newIdentity, Instant now) {
        return new Worker(shardId, hostname, newIdentity, WorkerHealth.NEW, now, Set.of(), false);
    }

    public boolean isLost() {
        return health == WorkerHealth.LOST;
    }

    /**
     * Time since the last heartbeat, never negative
     */
    public Duration silenceAt(Instant now) {
        Duration silence = Duration.between(lastHeartbeat, now);
        return silence.isNegative() ? Duration.ZERO : silence;
    }

    /**
     * Check if worker has been heard from within the threshold
     */
    public boolean isResponsive(Duration threshold, Instant now) {
        return !isLost() && silenceAt(now).compareTo(threshold) <= 0;
    }

    /**
     * Check if worker can take new tasks
     */
    public boolean hasCapacity() {
        return health.canAcceptWork();
    }
}
