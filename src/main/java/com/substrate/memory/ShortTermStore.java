package com.substrate.memory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded recency buffer kept in insertion order. Overflow removes the oldest
 * item and hands it back to the caller. Not thread-safe.
 */
public class ShortTermStore {

    private final int capacity;
    private final Deque<MemoryItem> items = new ArrayDeque<>();

    public ShortTermStore(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
    }

    /**
     * Appends {@code item} at the tail.
     *
     * @return the evicted head when the store overflowed, empty otherwise
     */
    public Optional<MemoryItem> store(MemoryItem item) {
        items.addLast(item);
        if (items.size() > capacity) {
            return Optional.of(items.removeFirst());
        }
        return Optional.empty();
    }

    public List<MemoryItem> snapshot() {
        return List.copyOf(items);
    }

    /** Up to {@code n} newest items, oldest first. */
    public List<MemoryItem> mostRecent(int n) {
        var all = new ArrayList<>(items);
        return List.copyOf(all.subList(Math.max(0, all.size() - n), all.size()));
    }

    public void clear() {
        items.clear();
    }

    public int size() { return items.size(); }

    public int capacity() { return capacity; }
}
