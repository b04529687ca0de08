package com.hostbridge.rpc;

/**
 * Thrown when content calls a capability name that is not registered.
 */
public class UnknownCapabilityException extends BridgeException {
    
    private final String capabilityName;
    
    public UnknownCapabilityException(String capabilityName) {
        super(ErrorKind.UNKNOWN_CAPABILITY, "Unknown capability: " + capabilityName);
        this.capabilityName = capabilityName;
    }
    
    public String getCapabilityName() {
        return capabilityName;
    }
}
