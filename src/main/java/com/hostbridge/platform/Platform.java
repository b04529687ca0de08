package com.hostbridge.platform;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Operating systems a bridge can run on.
 */
public enum Platform {
    ANDROID("android", OsFamily.MOBILE),
    IOS("ios", OsFamily.MOBILE),
    MACOS("macos", OsFamily.DESKTOP),
    WINDOWS("windows", OsFamily.DESKTOP),
    LINUX("linux", OsFamily.DESKTOP);
    
    public static final Set<Platform> ALL = EnumSet.allOf(Platform.class);
    public static final Set<Platform> MOBILE = EnumSet.of(ANDROID, IOS);
    
    private final String id;
    private final OsFamily family;
    
    Platform(String id, OsFamily family) {
        this.id = id;
        this.family = family;
    }
    
    public String id() {
        return id;
    }
    
    public OsFamily family() {
        return family;
    }
    
    public static Optional<Platform> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform.id.equals(normalized)) {
                return Optional.of(platform);
            }
        }
        return Optional.empty();
    }
    
    /**
     * Detects the running platform from JVM system properties.
     */
    public static Platform detect() {
        String vendor = System.getProperty("java.vendor", "").toLowerCase(Locale.ROOT);
        String vmName = System.getProperty("java.vm.name", "").toLowerCase(Locale.ROOT);
        if (vendor.contains("android") || vmName.contains("dalvik")) {
            return ANDROID;
        }
        
        String osName = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (osName.contains("ios")) {
            return IOS;
        }
        if (osName.contains("mac") || osName.contains("darwin")) {
            return MACOS;
        }
        if (osName.contains("win")) {
            return WINDOWS;
        }
        return LINUX;
    }
}
