package org.neuralchilli.shardpool.core;

import java.time.Duration;

/**
 * Timing and protocol settings for a {@link WorkerRegistry}.
 *
 * @param initialWait     how long after startup new task placement is withheld
 * @param suspectAfter    silence after which a worker is suspected lost
 * @param lostAfter       silence after which a worker is declared lost
 * @param protocolVersion protocol version workers must report
 */
public record RegistrySettings(
        Duration initialWait,
        Duration suspectAfter,
        Duration lostAfter,
        int protocolVersion
) {

    public RegistrySettings {
        if (initialWait == null || suspectAfter == null || lostAfter == null) {
            throw new IllegalArgumentException("Durations cannot be null");
        }
        if (suspectAfter.isNegative() || suspectAfter.isZero()) {
            throw new IllegalArgumentException("Suspect threshold must be > 0");
        }
        if (lostAfter.compareTo(suspectAfter) <= 0) {
            throw new IllegalArgumentException("Lost threshold must be longer than suspect threshold");
        }
        // Workers that cannot reach the scheduler kill themselves once they would be
        // declared lost, so the wait has to outlast that for the stale tasks to be gone.
        if (initialWait.compareTo(lostAfter) < 0) {
            throw new IllegalArgumentException("Initial wait cannot be shorter than the lost threshold");
        }
        if (protocolVersion < 0) {
            throw new IllegalArgumentException("Protocol version cannot be negative");
        }
    }
}
