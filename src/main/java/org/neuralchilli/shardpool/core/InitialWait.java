package org.neuralchilli.shardpool.core;

import org.neuralchilli.shardpool.domain.WorkerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Startup gate: WAITING until the wait duration has passed, then ACTIVE for good.
 *
 * Right after a scheduler restart its placement bookkeeping is empty, even though
 * tasks started before the restart may still be running on workers. Until the wait
 * is over, "not in my bookkeeping" does not mean "not running anywhere".
 */
class InitialWait {

    private static final Logger log = LoggerFactory.getLogger(InitialWait.class);

    enum State {
        WAITING,
        ACTIVE
    }

    private final Instant startTime;
    private final Duration duration;
    private State state = State.WAITING;

    InitialWait(Instant startTime, Duration duration) {
        this.startTime = startTime;
        this.duration = duration;
    }

    /**
     * Ends the wait once it has expired, reporting it exactly once.
     */
    void check(Instant now, RegistryUpdate update) {
        if (state == State.ACTIVE) {
            return;
        }

        Duration elapsed = Duration.between(startTime, now);
        if (elapsed.compareTo(duration) > 0) {
            state = State.ACTIVE;
            update.add(WorkerEvent.initialWaitEnded(now));
            log.info("Initial wait of {}s ended after {}s, new task placement may begin",
                    duration.toSeconds(), elapsed.toSeconds());
        }
    }

    boolean isWaiting() {
        return state == State.WAITING;
    }

    State state() {
        return state;
    }

    Instant startTime() {
        return startTime;
    }
}
