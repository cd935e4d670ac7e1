package com.substrate.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bounded store for promoted items. Residents stay in insertion order; an
 * insert that breaches capacity removes exactly one item with the lowest
 * {@link MemoryItem#evictionScore()}, the earliest inserted among ties.
 * Not thread-safe.
 */
public class LongTermStore {

    private final int capacity;
    private final List<MemoryItem> items = new ArrayList<>();

    public LongTermStore(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
    }

    /**
     * Appends {@code item}, evicting one resident if capacity is exceeded. The
     * new item competes too: with no recorded accesses its score is zero.
     *
     * @return the permanently removed item, if any
     */
    public Optional<MemoryItem> insert(MemoryItem item) {
        items.add(item);
        if (items.size() <= capacity) {
            return Optional.empty();
        }
        return Optional.of(items.remove(lowestScoreIndex()));
    }

    // strict '<' keeps the earliest index on ties
    private int lowestScoreIndex() {
        int victim = 0;
        double lowest = items.get(0).evictionScore();
        for (int i = 1; i < items.size(); i++) {
            double score = items.get(i).evictionScore();
            if (score < lowest) {
                lowest = score;
                victim = i;
            }
        }
        return victim;
    }

    public List<MemoryItem> snapshot() {
        return List.copyOf(items);
    }

    public void clear() {
        items.clear();
    }

    public int size() { return items.size(); }

    public int capacity() { return capacity; }
}
