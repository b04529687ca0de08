package com.hostbridge.rpc;

import com.hostbridge.subscription.SubscriptionEvent;

/**
 * Bridge to script direction of the protocol.
 */
public interface OutboundChannel {
    
    /**
     * Delivers the single result of a call.
     */
    void deliverResult(CallResult result);
    
    /**
     * Delivers one event of an active subscription.
     */
    void deliverEvent(SubscriptionEvent event);
}
