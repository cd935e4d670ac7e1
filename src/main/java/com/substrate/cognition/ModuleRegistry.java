package com.substrate.cognition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named set of modules handed to the orchestrator. Rejections leave the
 * registry untouched.
 */
public class ModuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModuleRegistry.class);

    private final Map<String, CognitiveModule> modules = new LinkedHashMap<>();

    public RegistrationResult register(CognitiveModule module) {
        if (module == null) {
            return RegistrationResult.invalid("Module must not be null");
        }
        var name = module.name();
        if (name == null || name.isBlank()) {
            return RegistrationResult.invalid("Module name must not be blank");
        }
        if (modules.containsKey(name)) {
            log.warn("Rejected duplicate module registration: {}", name);
            return RegistrationResult.invalid("Duplicate module: " + name);
        }
        modules.put(name, module);
        log.info("Registered module {}", name);
        return RegistrationResult.ok();
    }

    public Optional<CognitiveModule> get(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    public Collection<CognitiveModule> all() {
        return Collections.unmodifiableCollection(modules.values());
    }
}
