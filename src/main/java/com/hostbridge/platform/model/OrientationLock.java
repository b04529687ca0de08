package com.hostbridge.platform.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Orientation lock requested through screen.orientation.lock().
 */
public enum OrientationLock {
    PORTRAIT(EnumSet.of(DeviceOrientation.PORTRAIT_UP, DeviceOrientation.PORTRAIT_DOWN)),
    LANDSCAPE(EnumSet.of(DeviceOrientation.LANDSCAPE_LEFT, DeviceOrientation.LANDSCAPE_RIGHT)),
    ANY(DeviceOrientation.all());
    
    private final Set<DeviceOrientation> allowed;
    
    OrientationLock(Set<DeviceOrientation> allowed) {
        this.allowed = allowed;
    }
    
    public Set<DeviceOrientation> allowed() {
        return EnumSet.copyOf(allowed);
    }
    
    /**
     * Maps a web OrientationLockType ("portrait-primary", "landscape", "any", "natural", ...).
     */
    public static Optional<OrientationLock> fromWebValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("portrait")) {
            return Optional.of(PORTRAIT);
        }
        if (normalized.startsWith("landscape")) {
            return Optional.of(LANDSCAPE);
        }
        if (normalized.equals("any") || normalized.equals("natural")) {
            return Optional.of(ANY);
        }
        return Optional.empty();
    }
}
