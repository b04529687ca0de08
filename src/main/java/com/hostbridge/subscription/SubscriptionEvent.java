package com.hostbridge.subscription;

import com.hostbridge.rpc.ErrorKind;

/**
 * One event of an active subscription, tagged with the subscription id.
 */
public record SubscriptionEvent(
    long subscriptionId,
    Object payload,
    ErrorKind errorKind,
    String message
) {
    
    public static SubscriptionEvent of(long subscriptionId, Object payload) {
        return new SubscriptionEvent(subscriptionId, payload, null, null);
    }
    
    public static SubscriptionEvent error(long subscriptionId, ErrorKind kind, String message) {
        return new SubscriptionEvent(subscriptionId, null, kind, message);
    }
    
    public boolean isError() {
        return errorKind != null;
    }
}
