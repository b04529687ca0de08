package com.hostbridge.capability;

/**
 * Schema tag of a capability's success value.
 */
public enum ResultShape {
    BOOLEAN,
    TEXT,
    PERMISSION_STATE,
    POSITION,
    SUBSCRIPTION_ID,
    BATTERY_STATUS,
    NETWORK_STATUS,
    ORIENTATION
}
