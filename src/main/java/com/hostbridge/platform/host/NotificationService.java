package com.hostbridge.platform.host;

import com.hostbridge.platform.model.NotificationRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Local OS notifications.
 */
public interface NotificationService {
    
    /**
     * Posts a notification. Reusing an id replaces the earlier notification.
     */
    CompletableFuture<Void> show(int id, NotificationRequest request);
}
