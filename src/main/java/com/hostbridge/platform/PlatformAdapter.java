package com.hostbridge.platform;

import com.hostbridge.permission.PermissionProvider;
import com.hostbridge.platform.host.HostServices;
import com.hostbridge.platform.host.PositionListener;
import com.hostbridge.platform.model.BatteryStatus;
import com.hostbridge.platform.model.NetworkStatus;
import com.hostbridge.platform.model.NotificationRequest;
import com.hostbridge.platform.model.OrientationLock;
import com.hostbridge.platform.model.Position;
import com.hostbridge.platform.model.PositionOptions;
import com.hostbridge.platform.model.ScreenOrientation;
import com.hostbridge.platform.model.ShareRequest;
import com.hostbridge.subscription.Cancellation;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Performs the actual OS call of each capability.
 * 
 * One implementation per {@link OsFamily}. Every operation is asynchronous;
 * the futures complete on whatever thread the OS calls back on.
 */
public interface PlatformAdapter {
    
    Platform platform();
    
    /**
     * Permission access for the running OS.
     */
    PermissionProvider permissions();
    
    CompletableFuture<Void> writeClipboard(String text);
    
    /**
     * @return the clipboard text, empty when the clipboard holds no text
     */
    CompletableFuture<String> readClipboard();
    
    CompletableFuture<Void> share(ShareRequest request);
    
    CompletableFuture<Void> showNotification(NotificationRequest request);
    
    CompletableFuture<Position> currentPosition(PositionOptions options);
    
    Cancellation watchPosition(PositionOptions options, PositionListener listener);
    
    CompletableFuture<Void> vibrate(List<Long> patternMillis);
    
    CompletableFuture<BatteryStatus> battery();
    
    CompletableFuture<NetworkStatus> network();
    
    CompletableFuture<Void> lockOrientation(OrientationLock lock);
    
    CompletableFuture<Void> unlockOrientation();
    
    CompletableFuture<ScreenOrientation> orientation();
    
    /**
     * Creates the adapter of the platform's OS family.
     */
    static PlatformAdapter create(Platform platform, HostServices services) {
        return switch (platform.family()) {
            case MOBILE -> new MobilePlatformAdapter(platform, services);
            case DESKTOP -> new DesktopPlatformAdapter(platform, services);
        };
    }
}
