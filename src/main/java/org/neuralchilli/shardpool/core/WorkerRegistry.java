package org.neuralchilli.shardpool.core;

import org.neuralchilli.shardpool.domain.Heartbeat;
import org.neuralchilli.shardpool.domain.HeartbeatResponse;
import org.neuralchilli.shardpool.domain.Worker;
import org.neuralchilli.shardpool.domain.WorkerEvent;
import org.neuralchilli.shardpool.domain.WorkerHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Index of the remote workers known to the scheduler.
 *
 * The global pool is the only store of {@link Worker} records, keyed by shard id.
 * Host pools hold shard ids and are resolved against the global pool, so there is
 * a single copy of every record. Both support round-robin selection.
 *
 * Also owns the initial-wait gate that tells the caller when it is safe to start
 * placing new tasks after a scheduler restart.
 *
 * Not thread-safe. Callers must serialize access, see
 * {@code org.neuralchilli.shardpool.service.WorkerRegistryService}.
 */
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final RegistrySettings settings;
    private final Clock clock;
    private final InitialWait initialWait;

    private final RotatingPool<Worker> workerPool = new RotatingPool<>("all workers");
    private final Map<String, RotatingPool<String>> hostToShards = new HashMap<>();

    public WorkerRegistry(RegistrySettings settings, Clock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("Settings cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.settings = settings;
        this.clock = clock;
        this.initialWait = new InitialWait(clock.instant(), settings.initialWait());

        log.info("Worker registry started, initial wait {}s, suspect after {}s, lost after {}s",
                settings.initialWait().toSeconds(),
                settings.suspectAfter().toSeconds(),
                settings.lostAfter().toSeconds());
    }

    /**
     * Record a heartbeat, registering the worker on first contact.
     *
     * @param update collects events for the caller
     * @param heartbeat message from the worker
     * @return instruction for the worker, empty when none is warranted
     */
    public Optional<HeartbeatResponse> processHeartbeat(RegistryUpdate update, Heartbeat heartbeat) {
        Instant now = clock.instant();
        Optional<HeartbeatResponse> response = applyHeartbeat(update, heartbeat, now);
        initialWait.check(now, update);
        return response;
    }

    private Optional<HeartbeatResponse> applyHeartbeat(RegistryUpdate update, Heartbeat heartbeat, Instant now) {
        String shard = heartbeat.shardId();
        Optional<Worker> existing = workerPool.get(shard);

        if (existing.isEmpty()) {
            Worker worker = Worker.register(heartbeat, now);
            workerPool.insert(shard, worker);
            mutableHostPool(worker.hostname()).insert(shard, shard);
            Worker registered = requireWorker(shard);
            log.info("Registered new worker {} on host {} (instance {})",
                    shard, registered.hostname(), registered.identity().instanceId());
            return Optional.of(HeartbeatResponse.ACKNOWLEDGE);
        }

        Worker worker = existing.get();

        if (!worker.hostname().equals(heartbeat.hostname())) {
            // Keep the old record. What to do about a moved shard is the caller's call.
            log.warn("Worker {} is registered on host {} but heartbeat came from {}",
                    shard, worker.hostname(), heartbeat.hostname());
            update.add(WorkerEvent.hostMismatch(worker, heartbeat.hostname(), now));
            return Optional.empty();
        }

        if (!worker.identity().isSameInstance(heartbeat.identity())) {
            return Optional.of(replaceInstance(update, worker, heartbeat, now));
        }

        if (worker.isLost()) {
            log.warn("Lost worker {} is still heartbeating, telling it to exit", shard);
            return Optional.of(HeartbeatResponse.TERMINATE_SELF);
        }

        if (heartbeat.identity().protocolVersion() != settings.protocolVersion()) {
            // Alive but not usable: drop any suspicion back to NEW, never up to HEALTHY
            Worker refreshed = worker.heartbeat(now);
            if (refreshed.health() == WorkerHealth.SUSPECTED_LOST) {
                refreshed = refreshed.withHealth(WorkerHealth.NEW);
            }
            workerPool.insert(shard, refreshed);
            log.warn("Worker {} speaks protocol {}, expected {}",
                    shard, heartbeat.identity().protocolVersion(), settings.protocolVersion());
            return Optional.of(HeartbeatResponse.STALE_CONFIG);
        }

        Worker refreshed = advanceHealth(update, worker.heartbeat(now), now);
        workerPool.insert(shard, refreshed);
        log.trace("Heartbeat from {} ({})", shard, refreshed.health());
        return Optional.empty();
    }

    /**
     * The worker process behind a shard restarted. Whatever the old process was
     * running died with it.
     */
    private HeartbeatResponse replaceInstance(RegistryUpdate update, Worker worker, Heartbeat heartbeat, Instant now) {
        if (!worker.isLost()) {
            update.add(WorkerEvent.lost(worker, now));
        }
        Worker restarted = worker.restartedAs(heartbeat.identity(), now);
        workerPool.insert(worker.shardId(), restarted);
        log.info("Worker {} restarted: instance {} replaced by {}",
                worker.shardId(), worker.identity().instanceId(), heartbeat.identity().instanceId());
        return HeartbeatResponse.ACKNOWLEDGE;
    }

    private Worker advanceHealth(RegistryUpdate update, Worker worker, Instant now) {
        return switch (worker.health()) {
            case NEW, SUSPECTED_LOST -> {
                if (!worker.runningTasksKnown()) {
                    yield worker.withHealth(WorkerHealth.NEW);
                }
                Worker healthy = worker.markHealthy();
                update.add(WorkerEvent.healthy(healthy, now));
                log.info("Worker {} is healthy", worker.shardId());
                yield healthy;
            }
            case HEALTHY, LOST -> worker;
        };
    }

    /**
     * Periodic sweep: demotes silent workers and reports newly lost ones.
     * Never removes workers, see {@link #evictWorker(String)}.
     */
    public void updateState(RegistryUpdate update) {
        Instant now = clock.instant();

        // Collect first, the pool cannot be written while its view is iterated
        List<Worker> changed = new ArrayList<>();
        for (Worker worker : workerPool.members().values()) {
            if (worker.isLost() || worker.isResponsive(settings.suspectAfter(), now)) {
                continue;
            }
            Duration silence = worker.silenceAt(now);
            if (silence.compareTo(settings.lostAfter()) > 0) {
                Worker lost = worker.markLost();
                changed.add(lost);
                update.add(WorkerEvent.lost(lost, now));
                log.warn("Worker {} on host {} lost after {}s of silence, {} running tasks",
                        worker.shardId(), worker.hostname(), silence.toSeconds(), worker.runningTasks().size());
            } else if (silence.compareTo(settings.suspectAfter()) > 0
                    && worker.health() != WorkerHealth.SUSPECTED_LOST) {
                changed.add(worker.markSuspected());
                log.warn("Worker {} silent for {}s, suspected lost", worker.shardId(), silence.toSeconds());
            }
        }
        changed.forEach(worker -> workerPool.insert(worker.shardId(), worker));

        initialWait.check(now, update);
    }

    /**
     * Replace a worker's running-task set with what it reports it is executing.
     * Called after a scheduler restart so placement can reconcile against reality.
     *
     * @throws UnknownWorkerException if no heartbeat was processed for the shard
     */
    public void initializeRunningTasks(String shard, Set<String> taskIds) {
        Worker worker = requireWorkerOrFail(shard);
        workerPool.insert(shard, worker.withRunningTasks(taskIds));
        log.debug("Worker {} reports {} running tasks", shard, taskIds == null ? 0 : taskIds.size());
    }

    /**
     * Forget a worker, removing it from the global pool and its host pool.
     */
    public Optional<Worker> evictWorker(String shard) {
        Optional<Worker> removed = workerPool.remove(shard);
        removed.ifPresent(worker -> {
            RotatingPool<String> hostPool = hostToShards.get(worker.hostname());
            if (hostPool != null) {
                hostPool.remove(shard);
                if (hostPool.isEmpty()) {
                    hostToShards.remove(worker.hostname());
                }
            }
            log.info("Evicted worker {} from host {}", shard, worker.hostname());
        });
        return removed;
    }

    /**
     * For call sites that just inserted the shard. Absence means the index is corrupt.
     *
     * @throws RegistryInvariantError if the shard is unknown
     */
    public Worker requireWorker(String shard) {
        return workerPool.get(shard)
                .orElseThrow(() -> new RegistryInvariantError("Unknown worker: " + shard));
    }

    /**
     * For call sites driven by external, possibly stale, input.
     *
     * @throws UnknownWorkerException if the shard is unknown
     */
    public Worker requireWorkerOrFail(String shard) {
        return workerPool.get(shard)
                .orElseThrow(() -> new UnknownWorkerException(shard));
    }

    public Optional<Worker> findWorker(String shard) {
        return workerPool.get(shard);
    }

    /**
     * Next worker in global rotation, empty if there are none.
     */
    public Optional<Worker> nextWorker() {
        return workerPool.next();
    }

    /**
     * Next worker on the given host, empty if the host has none.
     */
    public Optional<Worker> nextWorkerForHost(String hostname) {
        return mutableHostPool(hostname).next()
                .map(this::requireWorker);
    }

    /**
     * All workers, in rotation order. Does not affect rotation.
     */
    public List<Worker> allWorkers() {
        return List.copyOf(workerPool.members().values());
    }

    /**
     * All workers on a host, in rotation order. Does not affect rotation.
     */
    public List<Worker> allWorkersForHost(String hostname) {
        RotatingPool<String> hostPool = hostToShards.get(hostname);
        if (hostPool == null) {
            return List.of();
        }
        return hostPool.members().keySet().stream()
                .map(this::requireWorker)
                .toList();
    }

    public Set<String> hostnames() {
        return Set.copyOf(hostToShards.keySet());
    }

    public int size() {
        return workerPool.size();
    }

    public boolean isInInitialWait() {
        return initialWait.isWaiting();
    }

    public Instant startTime() {
        return initialWait.startTime();
    }

    public RegistrySettings settings() {
        return settings;
    }

    /**
     * Creates an empty pool for unknown hosts, so callers never see null.
     */
    private RotatingPool<String> mutableHostPool(String hostname) {
        return hostToShards.computeIfAbsent(hostname, host -> new RotatingPool<>("host " + host));
    }
}
