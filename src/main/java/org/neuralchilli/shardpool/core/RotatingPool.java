package org.neuralchilli.shardpool.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Shard-keyed membership set with a round-robin cursor.
 *
 * Members are kept in shard id order, so the rotation order depends only on
 * who is in the pool. The cursor is the last shard handed out by {@link #next()};
 * it may refer to a shard that has since been removed, in which case rotation
 * resumes at the member that sorts after it.
 *
 * Not thread-safe.
 *
 * @param <V> value stored per shard
 */
public class RotatingPool<V> {

    private static final Logger log = LoggerFactory.getLogger(RotatingPool.class);

    private final String name;
    private final NavigableMap<String, V> members = new TreeMap<>();
    private final Map<String, V> readOnlyMembers = Collections.unmodifiableMap(members);
    private String cursor;

    public RotatingPool(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pool name cannot be null or empty");
        }
        this.name = name;
    }

    /**
     * Add or replace the value for a shard. Replacing keeps the shard's rotation slot.
     */
    public void insert(String shard, V value) {
        if (shard == null) {
            throw new IllegalArgumentException("Shard cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        members.put(shard, value);
    }

    /**
     * Remove a shard. Removing the shard under the cursor is allowed.
     *
     * @return the removed value, if the shard was a member
     */
    public Optional<V> remove(String shard) {
        return Optional.ofNullable(members.remove(shard));
    }

    /**
     * Next member in rotation, or empty if the pool has no members.
     */
    public Optional<V> next() {
        if (members.isEmpty()) {
            return Optional.empty();
        }

        Map.Entry<String, V> selected = cursor == null ? null : members.higherEntry(cursor);
        if (selected == null) {
            // Never started, or walked off the end
            selected = members.firstEntry();
        }

        if (cursor != null && !members.containsKey(cursor)) {
            log.trace("[{}] Cursor shard {} left the pool, resuming at {}", name, cursor, selected.getKey());
        }

        cursor = selected.getKey();
        return Optional.of(selected.getValue());
    }

    /**
     * Read-only view of all members, in rotation order.
     * Does not touch the cursor.
     */
    public Map<String, V> members() {
        return readOnlyMembers;
    }

    public Optional<V> get(String shard) {
        return Optional.ofNullable(members.get(shard));
    }

    public boolean contains(String shard) {
        return members.containsKey(shard);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public String name() {
        return name;
    }

    /**
     * Shard last returned by {@link #next()}, if any. It need not still be a member.
     */
    Optional<String> cursor() {
        return Optional.ofNullable(cursor);
    }

    @Override
    public String toString() {
        return "RotatingPool[name=" + name + ", size=" + members.size() + ", cursor=" + cursor + "]";
    }
}
