package com.hostbridge.platform.host;

import com.hostbridge.platform.model.DeviceOrientation;
import com.hostbridge.platform.model.ScreenOrientation;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Screen rotation control.
 */
public interface OrientationService {
    
    CompletableFuture<Void> setPreferredOrientations(Set<DeviceOrientation> orientations);
    
    CompletableFuture<ScreenOrientation> current();
}
