package com.substrate.shared.config;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".substrate", "config.yaml"
    );

    public static SubstrateConfig load() {
        return load(DEFAULT_PATH);
    }

    public static SubstrateConfig load(Path path) {
        return load(path, System.getenv());
    }

    @SuppressWarnings("unchecked")
    public static SubstrateConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                Object parsed = new Yaml().load(in);
                if (parsed == null) {
                    raw = Map.of();
                } else if (parsed instanceof Map) {
                    raw = (Map<String, Object>) parsed;
                } else {
                    throw new InvalidConfigurationException("Config root must be a mapping: " + path);
                }
            } catch (IOException | YAMLException e) {
                throw new InvalidConfigurationException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var memory = section(raw, "memory");
        return new SubstrateConfig(parseMemoryConfig(memory, env));
    }

    private static MemoryConfig parseMemoryConfig(Map<String, Object> memory, Map<String, String> env) {
        var defaults = MemoryConfig.defaults();
        try {
            return new MemoryConfig(
                valueOrDefault(memory, "name", defaults.name()),
                Integer.parseInt(envOrDefault(env, "SUBSTRATE_STM_CAPACITY",
                    String.valueOf(memory.getOrDefault("stm-capacity", defaults.stmCapacity())))),
                Integer.parseInt(envOrDefault(env, "SUBSTRATE_LTM_CAPACITY",
                    String.valueOf(memory.getOrDefault("ltm-capacity", defaults.ltmCapacity())))),
                Double.parseDouble(envOrDefault(env, "SUBSTRATE_PROMOTION_THRESHOLD",
                    String.valueOf(memory.getOrDefault("promotion-threshold", defaults.promotionThreshold())))),
                Double.parseDouble(String.valueOf(
                    memory.getOrDefault("process-importance", defaults.processImportance()))),
                Integer.parseInt(String.valueOf(
                    memory.getOrDefault("similar-limit", defaults.similarLimit())))
            );
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Invalid number in memory config: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> raw, String key) {
        var value = raw.get(key);
        if (value == null) return Map.of();
        if (!(value instanceof Map)) {
            throw new InvalidConfigurationException("Config section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static String valueOrDefault(Map<String, Object> section, String key, String fallback) {
        var value = section.get(key);
        return value != null ? String.valueOf(value) : fallback;
    }

    private static String envOrDefault(Map<String, String> env, String name, String fallback) {
        var val = env.get(name);
        return val != null && !val.isBlank() ? val.trim() : fallback;
    }
}
