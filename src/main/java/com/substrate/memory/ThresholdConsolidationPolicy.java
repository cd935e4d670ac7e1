package com.substrate.memory;

/** Promotes items whose importance is strictly above a fixed threshold. */
public class ThresholdConsolidationPolicy implements ConsolidationPolicy {

    public static final double DEFAULT_THRESHOLD = 0.5;

    private final double threshold;

    public ThresholdConsolidationPolicy() {
        this(DEFAULT_THRESHOLD);
    }

    public ThresholdConsolidationPolicy(double threshold) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("threshold must be in [0,1], got " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public boolean shouldPromote(MemoryItem evicted) {
        return evicted.importance() > threshold;
    }

    public double threshold() { return threshold; }
}
