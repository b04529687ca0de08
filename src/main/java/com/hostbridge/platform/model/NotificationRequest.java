package com.hostbridge.platform.model;

/**
 * A notification posted by content.
 */
public record NotificationRequest(String title, String body, String icon, String tag) {
    
    public static final String DEFAULT_TITLE = "Notification";
    
    public NotificationRequest {
        title = title == null || title.isEmpty() ? DEFAULT_TITLE : title;
        body = body == null ? "" : body;
    }
}
