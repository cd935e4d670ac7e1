package com.substrate.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RetrievalEngineTest {

    private ShortTermStore stm;
    private LongTermStore ltm;
    private RetrievalEngine engine;

    @BeforeEach
    void setUp() {
        stm = new ShortTermStore(10);
        ltm = new LongTermStore(10);
        engine = new RetrievalEngine(stm, ltm);
    }

    private static MemoryItem item(Object content) {
        return new MemoryItem(content, 0.8, Set.of(), Instant.EPOCH);
    }

    @Test
    void queryContainedInContentMatches() {
        stm.store(item("cats are great"));
        assertEquals(List.of("cats are great"), engine.retrieve("cat", MemoryScope.ALL));
    }

    @Test
    void contentContainedInQueryMatches() {
        stm.store(item("cat"));
        assertEquals(List.of("cat"), engine.retrieve("cats are great", MemoryScope.ALL));
    }

    @Test
    void matchingIgnoresCase() {
        stm.store(item("Artificial Intelligence"));
        assertEquals(1, engine.retrieve("INTELLIGENCE", MemoryScope.ALL).size());
    }

    @Test
    void shortTermResultsComeBeforeLongTerm() {
        ltm.insert(item("long cat"));
        stm.store(item("short cat"));
        stm.store(item("other cat"));
        assertThat(engine.retrieve("cat", MemoryScope.ALL))
                .containsExactly("short cat", "other cat", "long cat");
    }

    @Test
    void scopeRestrictsTier() {
        ltm.insert(item("long cat"));
        stm.store(item("short cat"));
        assertThat(engine.retrieve("cat", MemoryScope.STM)).containsExactly("short cat");
        assertThat(engine.retrieve("cat", MemoryScope.LTM)).containsExactly("long cat");
    }

    @Test
    void eachRetrieveCountsOneAccessPerMatch() {
        var hit = item("cats are great");
        var miss = item("dogs");
        stm.store(hit);
        stm.store(miss);

        engine.retrieve("cat", MemoryScope.ALL);
        assertEquals(1, hit.accessCount());
        engine.retrieve("cat", MemoryScope.ALL);
        assertEquals(2, hit.accessCount());
        assertEquals(0, miss.accessCount());
    }

    @Test
    void retrieveHasNoResultCap() {
        for (int i = 0; i < 8; i++) stm.store(item("note " + i));
        assertEquals(8, engine.retrieve("note", MemoryScope.ALL).size());
    }

    @Test
    void findSimilarStopsAtLimitAndLeavesRestUntouched() {
        var a = item("x1");
        var b = item("x2");
        var c = item("x3");
        stm.store(a);
        stm.store(b);
        stm.store(c);

        assertThat(engine.findSimilar("x", 2)).containsExactly("x1", "x2");
        assertEquals(1, a.accessCount());
        assertEquals(1, b.accessCount());
        assertEquals(0, c.accessCount());
    }

    @Test
    void findSimilarContinuesIntoLongTerm() {
        var longItem = item("cat in ltm");
        ltm.insert(longItem);
        stm.store(item("cat in stm"));
        assertThat(engine.findSimilar("cat", 5)).containsExactly("cat in stm", "cat in ltm");
        assertEquals(1, longItem.accessCount());
    }

    @Test
    void findSimilarSkipsLongTermOnceLimitReached() {
        var longItem = item("cat in ltm");
        ltm.insert(longItem);
        stm.store(item("cat in stm"));
        engine.findSimilar("cat", 1);
        assertEquals(0, longItem.accessCount());
    }

    @Test
    void emptyQueryMatchesNothing() {
        var it = item("anything");
        stm.store(it);
        assertTrue(engine.retrieve("", MemoryScope.ALL).isEmpty());
        assertTrue(engine.findSimilar("", 5).isEmpty());
        assertEquals(0, it.accessCount());
    }

    @Test
    void emptyContentMatchesAnyNonEmptyQuery() {
        var blank = item("");
        stm.store(blank);
        assertEquals(List.of(""), engine.retrieve("hello", MemoryScope.ALL));
        assertEquals(1, blank.accessCount());
        assertTrue(engine.retrieve("", MemoryScope.ALL).isEmpty());
    }

    @Test
    void unmatchedQueryReturnsEmptyList() {
        stm.store(item("cats"));
        assertTrue(engine.retrieve("zebra", MemoryScope.ALL).isEmpty());
    }

    @Test
    void structuredContentIsSearchedThroughItsProjection() {
        stm.store(item(Map.of("animal", "Cat", "legs", 4)));
        var results = engine.retrieve("cat", MemoryScope.ALL);
        assertEquals(1, results.size());
        assertEquals(Map.of("animal", "Cat", "legs", 4), results.get(0));
    }

    @Test
    void scopeParsesExternalNames() {
        assertEquals(MemoryScope.STM, MemoryScope.fromName("short_term").orElseThrow());
        assertEquals(MemoryScope.LTM, MemoryScope.fromName("long_term").orElseThrow());
        assertEquals(MemoryScope.ALL, MemoryScope.fromName("ALL").orElseThrow());
        assertTrue(MemoryScope.fromName("working").isEmpty());
        assertTrue(MemoryScope.fromName(null).isEmpty());
    }
}
