package com.hostbridge.capability;

/**
 * Thrown when a capability name is registered twice.
 */
public class DuplicateCapabilityException extends RuntimeException {
    
    private final String capabilityName;
    
    public DuplicateCapabilityException(String capabilityName) {
        super("Capability '" + capabilityName + "' already registered");
        this.capabilityName = capabilityName;
    }
    
    public String getCapabilityName() {
        return capabilityName;
    }
}
