package com.hostbridge.subscription;

import com.hostbridge.rpc.BridgeException;

/**
 * Opens the underlying event source of a watch-style capability.
 */
@FunctionalInterface
public interface WatchSource {
    
    /**
     * Starts delivering events to the sink.
     * 
     * @return the thunk that stops delivery at the source
     * @throws BridgeException if the source cannot be opened
     */
    Cancellation open(EventSink sink) throws BridgeException;
}
