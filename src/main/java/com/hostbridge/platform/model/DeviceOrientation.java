package com.hostbridge.platform.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Physical orientations the OS can be restricted to.
 */
public enum DeviceOrientation {
    PORTRAIT_UP,
    PORTRAIT_DOWN,
    LANDSCAPE_LEFT,
    LANDSCAPE_RIGHT;
    
    public static Set<DeviceOrientation> all() {
        return EnumSet.allOf(DeviceOrientation.class);
    }
}
