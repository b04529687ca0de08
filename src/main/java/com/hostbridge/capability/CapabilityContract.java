package com.hostbridge.capability;

import com.hostbridge.permission.PermissionKind;
import com.hostbridge.platform.Platform;

import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of one capability.
 * 
 * @param requiredPermission the gating permission, null for ungated capabilities
 * @param platformSupport platforms where the capability is performed; anywhere else
 *        calls fail with CapabilityUnavailable
 */
public record CapabilityContract(
    String name,
    InvocationKind kind,
    ArgumentSchema arguments,
    ResultShape resultShape,
    PermissionKind requiredPermission,
    Set<Platform> platformSupport
) {
    public CapabilityContract {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Capability name cannot be null or empty");
        }
        if (kind == null || resultShape == null) {
            throw new IllegalArgumentException("Capability '" + name + "' needs an invocation kind and a result shape");
        }
        arguments = arguments == null ? ArgumentSchema.EMPTY : arguments;
        platformSupport = Set.copyOf(platformSupport);
    }
    
    public Optional<PermissionKind> permission() {
        return Optional.ofNullable(requiredPermission);
    }
    
    public boolean isGated() {
        return requiredPermission != null;
    }
    
    public boolean supports(Platform platform) {
        return platformSupport.contains(platform);
    }
}
