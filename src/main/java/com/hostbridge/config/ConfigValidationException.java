package com.hostbridge.config;

/**
 * Exception thrown when configuration values violate the schema.
 */
public class ConfigValidationException extends Exception {
    
    public ConfigValidationException(String message) {
        super(message);
    }
}
