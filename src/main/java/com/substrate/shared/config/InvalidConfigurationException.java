package com.substrate.shared.config;

/**
 * Raised when configuration values are out of range or cannot be read.
 * Nothing is constructed when this is thrown.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
