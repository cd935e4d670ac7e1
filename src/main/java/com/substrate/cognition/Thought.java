package com.substrate.cognition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response produced by a {@link CognitiveModule} for one call to
 * {@link CognitiveModule#process(Object)}.
 *
 * @param content      module specific payload
 * @param confidence   in [0,1]
 * @param sourceModule name of the producing module
 * @param metadata     free-form annotations, never null
 */
public record Thought(
    Object content,
    double confidence,
    String sourceModule,
    Map<String, Object> metadata
) {
    public Thought {
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + confidence);
        }
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
