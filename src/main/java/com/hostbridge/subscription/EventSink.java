package com.hostbridge.subscription;

import com.hostbridge.rpc.ErrorKind;

/**
 * Receives the events of one subscription.
 */
public interface EventSink {
    
    /**
     * Delivers one event payload.
     */
    void emit(Object payload);
    
    /**
     * Delivers a non-terminal error (for example a lost GPS fix).
     * The subscription stays active until it is cancelled.
     */
    void fail(ErrorKind kind, String message);
}
