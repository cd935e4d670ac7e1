package com.substrate.memory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One stored record. An item belongs to exactly one store at a time and is
 * moved, never copied, when it is promoted. Only the memory package mutates
 * access count and importance.
 */
public final class MemoryItem {

    private final Object content;
    private final String searchKey;
    private final Instant createdAt;
    private final Set<String> tags;
    private int accessCount;
    private double importance;

    MemoryItem(Object content, double importance, Set<String> tags, Instant createdAt) {
        if (!(importance >= 0.0 && importance <= 1.0)) {
            throw new IllegalArgumentException("importance must be in [0,1], got " + importance);
        }
        this.content = content;
        this.searchKey = ContentProjection.searchKey(content);
        this.importance = importance;
        this.tags = tags == null || tags.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        this.createdAt = createdAt;
    }

    public Object content() { return content; }

    public Instant createdAt() { return createdAt; }

    public int accessCount() { return accessCount; }

    public double importance() { return importance; }

    public Set<String> tags() { return tags; }

    /** Score used to rank long-term eviction candidates, lowest goes first. */
    public double evictionScore() {
        return importance * accessCount;
    }

    String searchKey() { return searchKey; }

    void access() {
        accessCount++;
    }

    void reinforce(double factor) {
        importance = Math.min(1.0, importance * factor);
    }

    @Override
    public String toString() {
        return "MemoryItem{content=" + content + ", importance=" + importance
                + ", accessCount=" + accessCount + ", tags=" + tags + "}";
    }
}
