package com.substrate.shared.config;

public record MemoryConfig(
    String name,
    int stmCapacity,
    int ltmCapacity,
    double promotionThreshold,
    double processImportance,
    int similarLimit
) {
    public static final String DEFAULT_NAME = "MemorySystem";

    public MemoryConfig {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("memory name must not be blank");
        }
        if (stmCapacity < 1) {
            throw new InvalidConfigurationException("stm-capacity must be >= 1, got " + stmCapacity);
        }
        if (ltmCapacity < 1) {
            throw new InvalidConfigurationException("ltm-capacity must be >= 1, got " + ltmCapacity);
        }
        if (!inUnitRange(promotionThreshold)) {
            throw new InvalidConfigurationException("promotion-threshold must be in [0,1], got " + promotionThreshold);
        }
        if (!inUnitRange(processImportance)) {
            throw new InvalidConfigurationException("process-importance must be in [0,1], got " + processImportance);
        }
        if (similarLimit < 1) {
            throw new InvalidConfigurationException("similar-limit must be >= 1, got " + similarLimit);
        }
    }

    public static MemoryConfig defaults() {
        return new MemoryConfig(DEFAULT_NAME, 7, 1000, 0.5, 0.5, 5);
    }

    public static MemoryConfig withCapacities(int stmCapacity, int ltmCapacity) {
        var d = defaults();
        return new MemoryConfig(d.name(), stmCapacity, ltmCapacity,
                d.promotionThreshold(), d.processImportance(), d.similarLimit());
    }

    public MemoryConfig withName(String newName) {
        return new MemoryConfig(newName, stmCapacity, ltmCapacity,
                promotionThreshold, processImportance, similarLimit);
    }

    public MemoryConfig withPromotionThreshold(double threshold) {
        return new MemoryConfig(name, stmCapacity, ltmCapacity,
                threshold, processImportance, similarLimit);
    }

    private static boolean inUnitRange(double v) {
        return v >= 0.0 && v <= 1.0;
    }
}
