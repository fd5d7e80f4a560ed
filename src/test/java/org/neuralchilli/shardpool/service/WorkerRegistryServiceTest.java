package org.neuralchilli.shardpool.service;

import io.vertx.mutiny.core.eventbus.EventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.neuralchilli.shardpool.config.TestClock;
import org.neuralchilli.shardpool.config.WorkerRegistryConfig;
import org.neuralchilli.shardpool.core.UnknownWorkerException;
import org.neuralchilli.shardpool.core.WorkerRegistry;
import org.neuralchilli.shardpool.domain.EventAddresses;
import org.neuralchilli.shardpool.domain.Heartbeat;
import org.neuralchilli.shardpool.domain.HeartbeatResponse;
import org.neuralchilli.shardpool.domain.Worker;
import org.neuralchilli.shardpool.domain.WorkerEvent;
import org.neuralchilli.shardpool.domain.WorkerEventType;
import org.neuralchilli.shardpool.domain.WorkerIdentity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class WorkerRegistryServiceTest {

    private TestClock clock;
    private EventBus eventBus;
    private WorkerRegistryService service;

    static WorkerRegistryConfig config() {
        return new WorkerRegistryConfig() {
            @Override
            public Duration initialWait() {
                return Duration.ofSeconds(30);
            }

            @Override
            public Duration suspectAfter() {
                return Duration.ofSeconds(10);
            }

            @Override
            public Duration lostAfter() {
                return Duration.ofSeconds(20);
            }

            @Override
            public int protocolVersion() {
                return 1;
            }

            @Override
            public Duration maintenanceInterval() {
                return Duration.ofSeconds(5);
            }
        };
    }

    private static Heartbeat heartbeat(String shard, String host) {
        return Heartbeat.of(shard, host, WorkerIdentity.of("instance-" + shard, 1, Instant.ofEpochSecond(900)));
    }

    @BeforeEach
    void setup() {
        clock = new TestClock(1000);
        eventBus = mock(EventBus.class);

        service = new WorkerRegistryService();
        service.config = config();
        service.clock = clock;
        service.eventBus = eventBus;
        service.init();
    }

    @Test
    void shouldRegisterWorkerWithoutPublishing() {
        clock.setEpochSecond(1001);

        assertThat(service.processHeartbeat(heartbeat("w1", "h1"))).contains(HeartbeatResponse.ACKNOWLEDGE);

        assertThat(service.findWorker("w1")).isPresent();
        verifyNoInteractions(eventBus);
    }

    @Test
    void shouldPublishHealthyWorker() {
        clock.setEpochSecond(1001);
        service.processHeartbeat(heartbeat("w1", "h1"));
        service.initializeRunningTasks("w1", Set.of("task-a"));

        clock.setEpochSecond(1002);
        service.processHeartbeat(heartbeat("w1", "h1"));

        ArgumentCaptor<WorkerEvent> captor = ArgumentCaptor.forClass(WorkerEvent.class);
        verify(eventBus).publish(eq(EventAddresses.WORKER_HEALTHY), captor.capture());
        assertThat(captor.getValue().shardId()).isEqualTo("w1");
    }

    @Test
    void shouldPublishLostWorkersAndInitialWaitFromMaintenance() {
        clock.setEpochSecond(1001);
        service.processHeartbeat(heartbeat("w1", "h1"));

        clock.setEpochSecond(1031);
        service.updateState();

        verify(eventBus).publish(eq(EventAddresses.WORKER_LOST), any(WorkerEvent.class));
        verify(eventBus).publish(eq(EventAddresses.INITIAL_WAIT_ENDED), any(WorkerEvent.class));
        assertThat(service.isInInitialWait()).isFalse();
    }

    @Test
    void shouldPublishHostMismatch() {
        clock.setEpochSecond(1001);
        service.processHeartbeat(heartbeat("w1", "h1"));
        service.processHeartbeat(heartbeat("w1", "h2"));

        ArgumentCaptor<WorkerEvent> captor = ArgumentCaptor.forClass(WorkerEvent.class);
        verify(eventBus).publish(eq(WorkerEventType.WORKER_HOST_MISMATCH.address()), captor.capture());
        assertThat(captor.getValue().reportedHostname()).isEqualTo("h2");
    }

    @Test
    void shouldPropagateUnknownWorker() {
        assertThatThrownBy(() -> service.initializeRunningTasks("ghost", Set.of()))
                .isInstanceOf(UnknownWorkerException.class);
        verify(eventBus, never()).publish(anyString(), any());
    }

    @Test
    void shouldRunPlacementTurnAgainstRegistry() {
        clock.setEpochSecond(1001);
        service.processHeartbeat(heartbeat("w1", "h1"));
        service.processHeartbeat(heartbeat("w2", "h1"));

        String picked = service.withRegistry(registry -> registry.nextWorkerForHost("h1")
                .map(Worker::shardId)
                .orElseThrow());
        String pickedAgain = service.withRegistry(registry -> registry.nextWorkerForHost("h1")
                .map(Worker::shardId)
                .orElseThrow());

        assertThat(Set.of(picked, pickedAgain)).containsExactlyInAnyOrder("w1", "w2");
    }

    @Test
    void shouldHandOutEnumerationThatOutlivesTheTurn() {
        clock.setEpochSecond(1001);
        service.processHeartbeat(heartbeat("w1", "h1"));
        service.processHeartbeat(heartbeat("w2", "h1"));

        List<Worker> workers = service.withRegistry(WorkerRegistry::allWorkers);
        int visited = 0;
        for (Worker worker : workers) {
            service.processHeartbeat(heartbeat("w3-" + worker.shardId(), "h1"));
            visited++;
        }

        assertThat(visited).isEqualTo(2);
        assertThat(service.withRegistry(WorkerRegistry::size)).isEqualTo(4);
    }

    @Test
    void shouldAllowNestedCallsWithinTurn() {
        clock.setEpochSecond(1001);
        service.processHeartbeat(heartbeat("w1", "h1"));

        boolean found = service.withRegistry(registry -> service.findWorker("w1").isPresent());

        assertThat(found).isTrue();
    }

    @Test
    void shouldEvictWorker() {
        clock.setEpochSecond(1001);
        service.processHeartbeat(heartbeat("w1", "h1"));

        assertThat(service.evictWorker("w1")).isPresent();
        assertThat(service.withRegistry(WorkerRegistry::size)).isZero();
    }

    @Test
    void shouldSerializeAccess() throws Exception {
        CountDownLatch inTurn = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean heartbeatDone = new AtomicBoolean(false);

        Thread holder = new Thread(() -> service.withRegistry(registry -> {
            inTurn.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        assertThat(inTurn.await(5, TimeUnit.SECONDS)).isTrue();

        Thread writer = new Thread(() -> {
            service.processHeartbeat(heartbeat("w1", "h1"));
            heartbeatDone.set(true);
        });
        writer.start();

        Thread.sleep(100);
        assertThat(heartbeatDone.get()).isFalse();

        release.countDown();
        holder.join(5000);
        writer.join(5000);
        assertThat(heartbeatDone.get()).isTrue();
        assertThat(service.findWorker("w1")).isPresent();
    }
}
