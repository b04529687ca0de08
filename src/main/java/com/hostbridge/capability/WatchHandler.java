package com.hostbridge.capability;

import com.hostbridge.rpc.BridgeException;
import com.hostbridge.subscription.Cancellation;
import com.hostbridge.subscription.EventSink;

import java.util.Map;

/**
 * Starts a watch-style capability.
 */
@FunctionalInterface
public interface WatchHandler {
    
    /**
     * Opens the event source.
     * 
     * @return stops the source
     */
    Cancellation subscribe(InvocationContext context, Map<String, Object> arguments, EventSink sink) throws BridgeException;
}
