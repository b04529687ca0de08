package com.hostbridge.platform;

import com.hostbridge.platform.host.HostServices;
import com.hostbridge.platform.host.PositionListener;
import com.hostbridge.platform.model.BatteryStatus;
import com.hostbridge.platform.model.NetworkStatus;
import com.hostbridge.platform.model.NotificationRequest;
import com.hostbridge.platform.model.Position;
import com.hostbridge.platform.model.PositionOptions;
import com.hostbridge.platform.model.ShareRequest;
import com.hostbridge.subscription.Cancellation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Operations that behave the same on every OS family.
 */
abstract class AbstractPlatformAdapter implements PlatformAdapter {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractPlatformAdapter.class);
    
    // Android notification ids are ints; stay well inside the positive range
    private static final int MAX_NOTIFICATION_ID = 1 << 30;
    
    protected final Platform platform;
    protected final HostServices services;
    private final AtomicInteger nextNotificationId = new AtomicInteger(1);
    
    protected AbstractPlatformAdapter(Platform platform, HostServices services) {
        this.platform = platform;
        this.services = services;
    }
    
    @Override
    public Platform platform() {
        return platform;
    }
    
    @Override
    public CompletableFuture<Void> writeClipboard(String text) {
        return services.clipboard().setText(text);
    }
    
    @Override
    public CompletableFuture<String> readClipboard() {
        return services.clipboard().getText().thenApply(text -> text == null ? "" : text);
    }
    
    @Override
    public CompletableFuture<Void> share(ShareRequest request) {
        return services.share().share(request.shareText(), request.title());
    }
    
    @Override
    public CompletableFuture<Void> showNotification(NotificationRequest request) {
        int id = nextNotificationId.getAndUpdate(current -> current >= MAX_NOTIFICATION_ID ? 1 : current + 1);
        LOGGER.debug("Posting notification {} on {}", id, platform.id());
        return services.notifications().show(id, request);
    }
    
    @Override
    public CompletableFuture<Position> currentPosition(PositionOptions options) {
        return services.location().currentPosition(options);
    }
    
    @Override
    public Cancellation watchPosition(PositionOptions options, PositionListener listener) {
        return services.location().watch(options, listener);
    }
    
    @Override
    public CompletableFuture<BatteryStatus> battery() {
        return services.battery().status();
    }
    
    @Override
    public CompletableFuture<NetworkStatus> network() {
        return services.connectivity().connectionType().thenApply(NetworkStatus::new);
    }
}
