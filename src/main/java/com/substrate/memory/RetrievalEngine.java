package com.substrate.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Substring search over both tiers. A query matches an item when either
 * lower-cased text contains the other. An empty query matches nothing, while
 * empty content is contained in every query. Every match records one access
 * on the item.
 */
public class RetrievalEngine {

    private final ShortTermStore shortTerm;
    private final LongTermStore longTerm;

    public RetrievalEngine(ShortTermStore shortTerm, LongTermStore longTerm) {
        this.shortTerm = shortTerm;
        this.longTerm = longTerm;
    }

    /**
     * Scans every item in {@code scope}, short-term before long-term, each in
     * store order. No result cap.
     */
    public List<Object> retrieve(Object query, MemoryScope scope) {
        var key = ContentProjection.searchKey(query);
        var results = new ArrayList<Object>();
        if (key.isEmpty()) return Collections.unmodifiableList(results);
        if (scope.includesShortTerm()) {
            collect(shortTerm.snapshot(), key, results, Integer.MAX_VALUE);
        }
        if (scope.includesLongTerm()) {
            collect(longTerm.snapshot(), key, results, Integer.MAX_VALUE);
        }
        return Collections.unmodifiableList(results);
    }

    /**
     * Like {@link #retrieve(Object, MemoryScope)} over both tiers, but stops as
     * soon as {@code limit} matches are found. Items after that point are not
     * visited and their access counts stay unchanged.
     */
    public List<Object> findSimilar(Object query, int limit) {
        var key = ContentProjection.searchKey(query);
        var results = new ArrayList<Object>();
        if (key.isEmpty() || limit <= 0) return Collections.unmodifiableList(results);
        collect(shortTerm.snapshot(), key, results, limit);
        if (results.size() < limit) {
            collect(longTerm.snapshot(), key, results, limit);
        }
        return Collections.unmodifiableList(results);
    }

    static boolean matches(String queryKey, String itemKey) {
        if (queryKey.isEmpty()) return false;
        return itemKey.contains(queryKey) || queryKey.contains(itemKey);
    }

    private static void collect(List<MemoryItem> items, String key, List<Object> out, int limit) {
        for (var item : items) {
            if (out.size() >= limit) return;
            if (matches(key, item.searchKey())) {
                item.access();
                out.add(item.content());
            }
        }
    }
}
