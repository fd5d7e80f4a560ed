package org.neuralchilli.shardpool.service;

import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.shardpool.config.WorkerRegistryConfig;
import org.neuralchilli.shardpool.core.RegistrySettings;
import org.neuralchilli.shardpool.core.RegistryUpdate;
import org.neuralchilli.shardpool.core.WorkerRegistry;
import org.neuralchilli.shardpool.domain.Heartbeat;
import org.neuralchilli.shardpool.domain.HeartbeatResponse;
import org.neuralchilli.shardpool.domain.Worker;
import org.neuralchilli.shardpool.domain.WorkerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Sole owner of the {@link WorkerRegistry}.
 *
 * The registry is a plain data structure with no locking of its own. Every access
 * goes through this service, which runs it under a single lock and then publishes
 * the events the call produced on the event bus. Events are published after the
 * lock is released so consumers may call back into the service.
 */
@ApplicationScoped
public class WorkerRegistryService {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistryService.class);

    @Inject
    WorkerRegistryConfig config;

    @Inject
    Clock clock;

    @Inject
    EventBus eventBus;

    private final Lock lock = new ReentrantLock();
    private WorkerRegistry registry;

    @PostConstruct
    void init() {
        RegistrySettings settings = new RegistrySettings(
                config.initialWait(),
                config.suspectAfter(),
                config.lostAfter(),
                config.protocolVersion());
        registry = new WorkerRegistry(settings, clock);
        log.info("WorkerRegistryService initialized, placement withheld until {}",
                registry.startTime().plus(config.initialWait()));
    }

    public Optional<HeartbeatResponse> processHeartbeat(Heartbeat heartbeat) {
        return withUpdate((registry, update) -> registry.processHeartbeat(update, heartbeat));
    }

    /**
     * Maintenance tick.
     */
    public void updateState() {
        withUpdate((registry, update) -> {
            registry.updateState(update);
            return null;
        });
    }

    public void initializeRunningTasks(String shard, Set<String> taskIds) {
        withRegistry(registry -> {
            registry.initializeRunningTasks(shard, taskIds);
            return null;
        });
    }

    public Optional<Worker> evictWorker(String shard) {
        return withRegistry(registry -> registry.evictWorker(shard));
    }

    public Optional<Worker> findWorker(String shard) {
        return withRegistry(registry -> registry.findWorker(shard));
    }

    public boolean isInInitialWait() {
        return withRegistry(WorkerRegistry::isInInitialWait);
    }

    /**
     * Run one exclusive turn against the registry, e.g. a placement decision that
     * calls {@link WorkerRegistry#nextWorker()}. The registry must not escape the turn.
     */
    public <T> T withRegistry(Function<WorkerRegistry, T> action) {
        lock.lock();
        try {
            return action.apply(registry);
        } finally {
            lock.unlock();
        }
    }

    private <T> T withUpdate(BiFunction<WorkerRegistry, RegistryUpdate, T> action) {
        RegistryUpdate update = new RegistryUpdate();
        T result;
        lock.lock();
        try {
            result = action.apply(registry, update);
        } finally {
            lock.unlock();
        }
        publish(update);
        return result;
    }

    private void publish(RegistryUpdate update) {
        if (update.isEmpty()) {
            return;
        }
        log.debug("Publishing {} registry events", update.size());
        for (WorkerEvent event : update.events()) {
            eventBus.publish(event.type().address(), event);
        }
    }
}
