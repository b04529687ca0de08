package com.hostbridge.capability;

public enum InvocationKind {
    /** One call, one result. */
    ONE_SHOT,
    /** One call returning a subscription id, then a stream of events. */
    WATCH
}
