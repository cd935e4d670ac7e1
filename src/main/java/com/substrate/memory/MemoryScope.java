package com.substrate.memory;

import java.util.Optional;

public enum MemoryScope {
    STM("short_term"),
    LTM("long_term"),
    ALL("all");

    private final String externalName;

    MemoryScope(String externalName) {
        this.externalName = externalName;
    }

    public String externalName() { return externalName; }

    public boolean includesShortTerm() { return this != LTM; }

    public boolean includesLongTerm() { return this != STM; }

    public static Optional<MemoryScope> fromName(String name) {
        if (name == null) return Optional.empty();
        for (var scope : values()) {
            if (scope.externalName.equalsIgnoreCase(name.trim()) || scope.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
