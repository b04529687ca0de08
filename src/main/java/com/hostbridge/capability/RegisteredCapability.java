package com.hostbridge.capability;

/**
 * A contract with its handler, as stored in the registry.
 * 
 * Exactly one of the two handlers is set, matching the contract's invocation kind.
 * 
 * @param available whether the contract supports the registry's platform; decided once at registration
 */
public record RegisteredCapability(
    CapabilityContract contract,
    CapabilityHandler handler,
    WatchHandler watchHandler,
    boolean available
) {
    
    public String name() {
        return contract.name();
    }
    
    public boolean isWatch() {
        return contract.kind() == InvocationKind.WATCH;
    }
}
