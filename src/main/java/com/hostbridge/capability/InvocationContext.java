package com.hostbridge.capability;

import com.hostbridge.permission.PermissionGate;
import com.hostbridge.platform.Platform;
import com.hostbridge.subscription.SubscriptionManager;

/**
 * Bridge-scoped collaborators a handler may need besides its adapter.
 */
public record InvocationContext(
    String surfaceId,
    Platform platform,
    PermissionGate permissions,
    SubscriptionManager subscriptions
) {}
