package com.substrate.cognition;

public enum ModuleState {
    IDLE,
    PROCESSING
}
