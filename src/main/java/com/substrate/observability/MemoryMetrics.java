package com.substrate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MemoryMetrics {

    private final MeterRegistry registry;
    private final String module;

    public MemoryMetrics(String module) {
        this(new SimpleMeterRegistry(), module);
    }

    public MemoryMetrics(MeterRegistry registry, String module) {
        this.registry = registry;
        this.module = module;
    }

    public MeterRegistry registry() { return registry; }

    public Counter stored() {
        return Counter.builder("substrate.memory.stored").tag("module", module).register(registry);
    }

    public Counter promoted() {
        return Counter.builder("substrate.memory.promoted").tag("module", module).register(registry);
    }

    public Counter discarded() {
        return Counter.builder("substrate.memory.discarded").tag("module", module).register(registry);
    }

    public Counter ltmEvicted() {
        return Counter.builder("substrate.memory.ltm.evicted").tag("module", module).register(registry);
    }

    public Counter retrievals() {
        return Counter.builder("substrate.memory.retrievals").tag("module", module).register(registry);
    }

    public Timer processLatency() {
        return Timer.builder("substrate.memory.process").tag("module", module).register(registry);
    }
}
