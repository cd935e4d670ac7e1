package com.substrate.memory;

import com.substrate.cognition.CognitiveModule;
import com.substrate.cognition.ModuleState;
import com.substrate.cognition.Thought;
import com.substrate.observability.MemoryMetrics;
import com.substrate.shared.config.MemoryConfig;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Two-tier memory exposed as a {@link CognitiveModule}.
 *
 * <p>New items land in a bounded short-term buffer. Items pushed out of it
 * are promoted to the bounded long-term store when the
 * {@link ConsolidationPolicy} accepts them and are dropped otherwise. The
 * long-term store evicts its lowest scoring resident on overflow.
 *
 * <p>All public operations hold this instance's monitor, so one instance may
 * be shared across threads. Separate instances share no state.
 */
public class MemorySystemModule implements CognitiveModule {

    private static final Logger log = LoggerFactory.getLogger(MemorySystemModule.class);

    static final double PROCESS_CONFIDENCE = 0.9;
    static final String REINFORCE_KEY = "reinforce";
    static final int REINFORCE_WINDOW = 3;
    static final double REINFORCE_FACTOR = 1.2;
    static final double DEFAULT_IMPORTANCE = 0.5;

    private final MemoryConfig config;
    private final ShortTermStore shortTerm;
    private final LongTermStore longTerm;
    private final ConsolidationPolicy policy;
    private final RetrievalEngine retrieval;
    private final MemoryMetrics metrics;
    private final Clock clock;
    private volatile ModuleState state = ModuleState.IDLE;

    public MemorySystemModule() {
        this(MemoryConfig.defaults());
    }

    public MemorySystemModule(int stmCapacity, int ltmCapacity) {
        this(MemoryConfig.withCapacities(stmCapacity, ltmCapacity));
    }

    public MemorySystemModule(MemoryConfig config) {
        this(config, new ThresholdConsolidationPolicy(config.promotionThreshold()),
                new MemoryMetrics(config.name()), Clock.systemUTC());
    }

    public MemorySystemModule(MemoryConfig config, ConsolidationPolicy policy,
                              MemoryMetrics metrics, Clock clock) {
        this.config = config;
        this.shortTerm = new ShortTermStore(config.stmCapacity());
        this.longTerm = new LongTermStore(config.ltmCapacity());
        this.policy = policy;
        this.retrieval = new RetrievalEngine(shortTerm, longTerm);
        this.metrics = metrics;
        this.clock = clock;
        log.info("Memory module {} ready (stm={}, ltm={})",
                config.name(), config.stmCapacity(), config.ltmCapacity());
    }

    @Override
    public String name() { return config.name(); }

    @Override
    public ModuleState state() { return state; }

    /**
     * Stores {@code input} in short-term memory at the configured process
     * importance, then looks up similar memories. The lookup sees the item
     * just stored.
     */
    @Override
    public synchronized Thought process(Object input) {
        state = ModuleState.PROCESSING;
        // TODO: let callers query without recording the input once the orchestrator can ask for it
        var sample = Timer.start(metrics.registry());
        try {
            storeItem(new MemoryItem(input, config.processImportance(), Set.of(), clock.instant()));
            var similar = retrieval.findSimilar(input, config.similarLimit());
            metrics.retrievals().increment();

            var content = new LinkedHashMap<String, Object>();
            content.put("stored", input);
            content.put("similar_memories", similar);
            return new Thought(content, PROCESS_CONFIDENCE, name(),
                    Map.of("memory_type", MemoryScope.STM.externalName()));
        } finally {
            sample.stop(metrics.processLatency());
            state = ModuleState.IDLE;
        }
    }

    /**
     * Recognizes a single signal: when {@code feedback} contains the key
     * {@code "reinforce"}, the newest three short-term items have their
     * importance multiplied by 1.2, capped at 1.0. Anything else is ignored.
     */
    @Override
    public synchronized void update(Map<String, Object> feedback) {
        if (feedback == null || !feedback.containsKey(REINFORCE_KEY)) return;
        var recent = shortTerm.mostRecent(REINFORCE_WINDOW);
        recent.forEach(item -> item.reinforce(REINFORCE_FACTOR));
        log.debug("Reinforced {} short-term item(s) in {}", recent.size(), name());
    }

    public void store(Object content) {
        store(content, DEFAULT_IMPORTANCE, Set.of());
    }

    public void store(Object content, double importance) {
        store(content, importance, Set.of());
    }

    public synchronized void store(Object content, double importance, Set<String> tags) {
        storeItem(new MemoryItem(content, importance, tags, clock.instant()));
    }

    public List<Object> retrieve(Object query) {
        return retrieve(query, MemoryScope.ALL);
    }

    public synchronized List<Object> retrieve(Object query, MemoryScope scope) {
        var results = retrieval.retrieve(query, scope);
        metrics.retrievals().increment();
        return results;
    }

    public synchronized List<Object> stmContents() {
        return contents(shortTerm.snapshot());
    }

    public synchronized List<Object> ltmContents() {
        return contents(longTerm.snapshot());
    }

    public synchronized List<MemoryItem> stmItems() {
        return shortTerm.snapshot();
    }

    public synchronized List<MemoryItem> ltmItems() {
        return longTerm.snapshot();
    }

    public synchronized void clearStm() {
        shortTerm.clear();
        log.debug("Cleared short-term memory of {}", name());
    }

    public synchronized void clearLtm() {
        longTerm.clear();
        log.debug("Cleared long-term memory of {}", name());
    }

    public int stmCapacity() { return shortTerm.capacity(); }

    public int ltmCapacity() { return longTerm.capacity(); }

    public MemoryMetrics metrics() { return metrics; }

    private void storeItem(MemoryItem item) {
        shortTerm.store(item).ifPresent(this::consolidate);
        metrics.stored().increment();
    }

    private void consolidate(MemoryItem evicted) {
        if (!policy.shouldPromote(evicted)) {
            metrics.discarded().increment();
            log.debug("Discarded {} from short-term memory", evicted);
            return;
        }
        metrics.promoted().increment();
        log.debug("Promoted {} to long-term memory", evicted);
        longTerm.insert(evicted).ifPresent(victim -> {
            metrics.ltmEvicted().increment();
            log.debug("Evicted {} from long-term memory (score {})", victim, victim.evictionScore());
        });
    }

    private static List<Object> contents(List<MemoryItem> items) {
        var out = new ArrayList<Object>(items.size());
        for (var item : items) out.add(item.content());
        return Collections.unmodifiableList(out);
    }
}
