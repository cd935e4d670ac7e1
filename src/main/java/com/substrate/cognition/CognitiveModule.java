package com.substrate.cognition;

import java.util.Map;

/**
 * Capability contract every cognitive module exposes to the orchestrator and
 * to its peers.
 */
public interface CognitiveModule {

    String name();

    ModuleState state();

    /**
     * Handles one input and always returns a response. Implementations move
     * to {@link ModuleState#PROCESSING} for the duration of the call and are
     * back at {@link ModuleState#IDLE} afterwards, whatever happened.
     */
    Thought process(Object input);

    /**
     * Applies feedback. Unknown keys are ignored, a null map is a no-op.
     */
    void update(Map<String, Object> feedback);
}
