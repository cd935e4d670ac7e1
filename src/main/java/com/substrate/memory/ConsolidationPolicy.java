package com.substrate.memory;

/**
 * Decides whether an item evicted from short-term memory moves to long-term
 * memory. The decision is all or nothing and must not modify the item.
 */
public interface ConsolidationPolicy {
    boolean shouldPromote(MemoryItem evicted);
}
