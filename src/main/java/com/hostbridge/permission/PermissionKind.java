package com.hostbridge.permission;

/**
 * OS permissions observable by script content.
 */
public enum PermissionKind {
    LOCATION("location"),
    NOTIFICATIONS("notifications");
    
    private final String id;
    
    PermissionKind(String id) {
        this.id = id;
    }
    
    public String id() {
        return id;
    }
}
