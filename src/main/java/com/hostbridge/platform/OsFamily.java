package com.hostbridge.platform;

/**
 * OS families with one adapter implementation each.
 */
public enum OsFamily {
    MOBILE,
    DESKTOP
}
