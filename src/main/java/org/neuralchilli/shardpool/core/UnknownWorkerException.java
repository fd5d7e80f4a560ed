package org.neuralchilli.shardpool.core;

/**
 * Thrown when an externally supplied shard id is not known to the registry.
 * Recoverable: the caller decides how to react to stale input.
 */
public class UnknownWorkerException extends RuntimeException {

    private final String shardId;

    public UnknownWorkerException(String shardId) {
        super("Unknown worker: " + shardId);
        this.shardId = shardId;
    }

    public String shardId() {
        return shardId;
    }
}
