package com.substrate.cognition;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ThoughtTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
    }

    @Test
    void rejectsConfidenceOutsideUnitRange() {
        assertThrows(IllegalArgumentException.class, () -> new Thought("x", 1.1, "m", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new Thought("x", -0.1, "m", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new Thought("x", Double.NaN, "m", Map.of()));
    }

    @Test
    void metadataIsCopiedAndNeverNull() {
        var meta = new HashMap<String, Object>();
        meta.put("memory_type", "short_term");
        var thought = new Thought("x", 0.9, "MemorySystem", meta);
        meta.put("later", true);

        assertEquals(1, thought.metadata().size());
        assertTrue(new Thought("x", 0.9, "MemorySystem", null).metadata().isEmpty());
    }

    @Test
    void jsonRoundTrip() throws Exception {
        var thought = new Thought(
            Map.of("stored", "hello", "similar_memories", List.of("hello")),
            0.9,
            "MemorySystem",
            Map.of("memory_type", "short_term")
        );

        String json = objectMapper.writeValueAsString(thought);
        Thought restored = objectMapper.readValue(json, Thought.class);
        assertThat(restored).isEqualTo(thought);
    }
}
