package com.hostbridge.permission;

import java.util.concurrent.CompletableFuture;

/**
 * Stock {@link PermissionProvider} implementations.
 */
public final class PermissionProviders {
    
    private PermissionProviders() {
    }
    
    /**
     * Desktop OS families have no runtime prompt for these permissions; everything reads as granted.
     */
    public static PermissionProvider alwaysGranted() {
        return new PermissionProvider() {
            @Override
            public PermissionState currentState(PermissionKind kind) {
                return PermissionState.GRANTED;
            }
            
            @Override
            public CompletableFuture<PermissionState> prompt(PermissionKind kind) {
                return CompletableFuture.completedFuture(PermissionState.GRANTED);
            }
        };
    }
}
