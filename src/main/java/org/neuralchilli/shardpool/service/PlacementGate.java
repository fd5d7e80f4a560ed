package org.neuralchilli.shardpool.service;

import io.quarkus.vertx.ConsumeEvent;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.shardpool.domain.EventAddresses;
import org.neuralchilli.shardpool.domain.WorkerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Tells task placement whether it may start new work yet.
 *
 * Closed from startup until the registry reports the end of its initial wait.
 * Placement decisions that rely on "this task is not running anywhere" must be
 * deferred while the gate is closed.
 */
@ApplicationScoped
public class PlacementGate {

    private static final Logger log = LoggerFactory.getLogger(PlacementGate.class);

    private volatile Instant openedAt;

    @ConsumeEvent(EventAddresses.INITIAL_WAIT_ENDED)
    public void onInitialWaitEnded(WorkerEvent event) {
        if (openedAt != null) {
            log.warn("Ignoring duplicate initial-wait-ended event at {}", event.at());
            return;
        }
        openedAt = event.at();
        log.info("Placement gate opened at {}", openedAt);
    }

    public boolean isPlacementAllowed() {
        return openedAt != null;
    }

    public Optional<Instant> openedAt() {
        return Optional.ofNullable(openedAt);
    }
}
