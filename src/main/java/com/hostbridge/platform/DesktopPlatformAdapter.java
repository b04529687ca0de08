package com.hostbridge.platform;

import com.hostbridge.permission.PermissionProvider;
import com.hostbridge.permission.PermissionProviders;
import com.hostbridge.platform.host.HostServices;
import com.hostbridge.platform.model.OrientationLock;
import com.hostbridge.platform.model.ScreenOrientation;
import com.hostbridge.rpc.BridgeException;
import com.hostbridge.rpc.ErrorKind;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter for macOS, Windows and Linux.
 * 
 * Desktops have no vibration motor: vibrate() succeeds without doing anything
 * unless the host wired a haptic service (e.g. a trackpad). Orientation lock is
 * outside the desktop platform support and never reaches this adapter.
 */
public class DesktopPlatformAdapter extends AbstractPlatformAdapter {
    
    private final PermissionProvider permissions;
    
    public DesktopPlatformAdapter(Platform platform, HostServices services) {
        super(platform, services);
        if (platform.family() != OsFamily.DESKTOP) {
            throw new IllegalArgumentException("Not a desktop platform: " + platform);
        }
        this.permissions = services.permissions().orElseGet(PermissionProviders::alwaysGranted);
    }
    
    @Override
    public PermissionProvider permissions() {
        return permissions;
    }
    
    @Override
    public CompletableFuture<Void> vibrate(List<Long> patternMillis) {
        return services.haptics()
            .map(haptics -> haptics.vibrate(patternMillis))
            .orElseGet(() -> CompletableFuture.completedFuture(null));
    }
    
    @Override
    public CompletableFuture<Void> lockOrientation(OrientationLock lock) {
        return unavailable("screenOrientation.lock");
    }
    
    @Override
    public CompletableFuture<Void> unlockOrientation() {
        return unavailable("screenOrientation.unlock");
    }
    
    @Override
    public CompletableFuture<ScreenOrientation> orientation() {
        return services.orientation()
            .map(service -> service.current())
            .orElseGet(() -> CompletableFuture.completedFuture(ScreenOrientation.LANDSCAPE_PRIMARY));
    }
    
    private <T> CompletableFuture<T> unavailable(String capability) {
        return CompletableFuture.failedFuture(
            new BridgeException(ErrorKind.CAPABILITY_UNAVAILABLE, capability + " is not available on " + platform.id()));
    }
}
