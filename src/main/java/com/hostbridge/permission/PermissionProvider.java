package com.hostbridge.permission;

import java.util.concurrent.CompletableFuture;

/**
 * OS-side permission access, supplied by the host application.
 */
public interface PermissionProvider {
    
    /**
     * Reads the current OS status without prompting. Must be cheap.
     */
    PermissionState currentState(PermissionKind kind);
    
    /**
     * Shows the OS permission prompt and completes with the user's answer.
     * A dismissed prompt completes with the state the OS reports afterwards.
     */
    CompletableFuture<PermissionState> prompt(PermissionKind kind);
}
