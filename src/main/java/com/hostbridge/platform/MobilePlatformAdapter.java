package com.hostbridge.platform;

import com.hostbridge.permission.PermissionProvider;
import com.hostbridge.platform.host.HapticService;
import com.hostbridge.platform.host.HostServices;
import com.hostbridge.platform.host.OrientationService;
import com.hostbridge.platform.model.DeviceOrientation;
import com.hostbridge.platform.model.OrientationLock;
import com.hostbridge.platform.model.ScreenOrientation;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter for Android and iOS. Haptics, orientation control and runtime
 * permission prompts are all present on these platforms.
 */
public class MobilePlatformAdapter extends AbstractPlatformAdapter {
    
    private final HapticService haptics;
    private final OrientationService orientation;
    private final PermissionProvider permissions;
    
    public MobilePlatformAdapter(Platform platform, HostServices services) {
        super(platform, services);
        if (platform.family() != OsFamily.MOBILE) {
            throw new IllegalArgumentException("Not a mobile platform: " + platform);
        }
        this.haptics = services.haptics()
            .orElseThrow(() -> new IllegalStateException("Haptic service is required on " + platform.id()));
        this.orientation = services.orientation()
            .orElseThrow(() -> new IllegalStateException("Orientation service is required on " + platform.id()));
        this.permissions = services.permissions()
            .orElseThrow(() -> new IllegalStateException("Permission provider is required on " + platform.id()));
    }
    
    @Override
    public PermissionProvider permissions() {
        return permissions;
    }
    
    @Override
    public CompletableFuture<Void> vibrate(List<Long> patternMillis) {
        return haptics.vibrate(patternMillis);
    }
    
    @Override
    public CompletableFuture<Void> lockOrientation(OrientationLock lock) {
        return orientation.setPreferredOrientations(lock.allowed());
    }
    
    @Override
    public CompletableFuture<Void> unlockOrientation() {
        return orientation.setPreferredOrientations(DeviceOrientation.all());
    }
    
    @Override
    public CompletableFuture<ScreenOrientation> orientation() {
        return orientation.current();
    }
}
