package com.hostbridge.config;

/**
 * Exception thrown when a configuration source cannot be read or parsed.
 */
public class ConfigLoadException extends Exception {
    
    public ConfigLoadException(String message) {
        super(message);
    }
    
    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
