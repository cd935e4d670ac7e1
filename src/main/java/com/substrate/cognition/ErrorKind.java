package com.substrate.cognition;

public enum ErrorKind {
    INVALID_CONFIGURATION
}
