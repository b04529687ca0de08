package com.hostbridge.capability;

import com.hostbridge.rpc.BridgeException;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Performs a one-shot capability call.
 */
@FunctionalInterface
public interface CapabilityHandler {
    
    /**
     * @param arguments sanitized arguments that passed the contract's schema
     * @return future completed with the success value; typed failures complete it
     *         exceptionally with a {@link BridgeException}
     */
    CompletableFuture<?> invoke(InvocationContext context, Map<String, Object> arguments) throws BridgeException;
}
