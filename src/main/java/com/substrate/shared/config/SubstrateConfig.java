package com.substrate.shared.config;

public record SubstrateConfig(MemoryConfig memory) {

    public static SubstrateConfig defaults() {
        return new SubstrateConfig(MemoryConfig.defaults());
    }
}
