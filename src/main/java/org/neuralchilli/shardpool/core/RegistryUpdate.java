package org.neuralchilli.shardpool.core;

import org.neuralchilli.shardpool.domain.WorkerEvent;
import org.neuralchilli.shardpool.domain.WorkerEventType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the events produced by registry calls, for the caller to act on.
 * The registry only ever appends.
 */
public class RegistryUpdate {

    private final List<WorkerEvent> events = new ArrayList<>();

    void add(WorkerEvent event) {
        events.add(event);
    }

    public List<WorkerEvent> events() {
        return Collections.unmodifiableList(events);
    }

    public List<WorkerEvent> eventsOfType(WorkerEventType type) {
        return events.stream()
                .filter(event -> event.type() == type)
                .toList();
    }

    public boolean initialWaitEnded() {
        return events.stream().anyMatch(event -> event.type() == WorkerEventType.INITIAL_WAIT_ENDED);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    @Override
    public String toString() {
        return "RegistryUpdate[events=" + events + "]";
    }
}
