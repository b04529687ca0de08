package com.hostbridge.capability;

import com.hostbridge.platform.Platform;
import com.hostbridge.rpc.UnknownCapabilityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Registry mapping capability names to handlers for one bridge instance.
 * 
 * Built through {@link Builder} and immutable afterwards, so lookups on the
 * dispatch path need no locking.
 */
public final class CapabilityRegistry {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityRegistry.class);
    
    private final Platform platform;
    private final Map<String, RegisteredCapability> capabilities;
    
    private CapabilityRegistry(Platform platform, Map<String, RegisteredCapability> capabilities) {
        this.platform = platform;
        this.capabilities = Map.copyOf(capabilities);
    }
    
    public static Builder builder(Platform platform) {
        return new Builder(platform);
    }
    
    /**
     * Looks up a capability.
     * 
     * @throws UnknownCapabilityException if no capability of that name is registered
     */
    public RegisteredCapability resolve(String name) throws UnknownCapabilityException {
        RegisteredCapability capability = name == null ? null : capabilities.get(name);
        if (capability == null) {
            throw new UnknownCapabilityException(name);
        }
        return capability;
    }
    
    public boolean contains(String name) {
        return capabilities.containsKey(name);
    }
    
    public Set<String> names() {
        return capabilities.keySet();
    }
    
    public int size() {
        return capabilities.size();
    }
    
    public Platform getPlatform() {
        return platform;
    }
    
    public static class Builder {
        private final Platform platform;
        private final Map<String, RegisteredCapability> capabilities = new LinkedHashMap<>();
        private boolean built = false;
        
        private Builder(Platform platform) {
            this.platform = platform;
        }
        
        /**
         * Registers a one-shot capability.
         * 
         * @throws DuplicateCapabilityException if the name is already registered
         */
        public Builder register(CapabilityContract contract, CapabilityHandler handler) {
            requireKind(contract, InvocationKind.ONE_SHOT);
            return add(new RegisteredCapability(contract, handler, null, contract.supports(platform)));
        }
        
        /**
         * Registers a watch-style capability.
         * 
         * @throws DuplicateCapabilityException if the name is already registered
         */
        public Builder registerWatch(CapabilityContract contract, WatchHandler handler) {
            requireKind(contract, InvocationKind.WATCH);
            return add(new RegisteredCapability(contract, null, handler, contract.supports(platform)));
        }
        
        public CapabilityRegistry build() {
            if (built) {
                throw new IllegalStateException("CapabilityRegistry already built");
            }
            built = true;
            CapabilityRegistry registry = new CapabilityRegistry(platform, capabilities);
            LOGGER.debug("CapabilityRegistry built for {} with {} capabilities", platform.id(), registry.size());
            return registry;
        }
        
        private Builder add(RegisteredCapability capability) {
            if (built) {
                throw new IllegalStateException("CapabilityRegistry is frozen - no further registrations allowed");
            }
            if (capabilities.containsKey(capability.name())) {
                throw new DuplicateCapabilityException(capability.name());
            }
            capabilities.put(capability.name(), capability);
            if (!capability.available()) {
                LOGGER.debug("Capability {} is unavailable on {}", capability.name(), platform.id());
            }
            return this;
        }
        
        private static void requireKind(CapabilityContract contract, InvocationKind expected) {
            if (contract.kind() != expected) {
                throw new IllegalArgumentException(
                    "Capability '" + contract.name() + "' is " + contract.kind() + ", expected " + expected);
            }
        }
    }
}
