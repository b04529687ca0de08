package com.hostbridge.platform.host;

import com.hostbridge.platform.model.Position;
import com.hostbridge.platform.model.PositionOptions;
import com.hostbridge.subscription.Cancellation;

import java.util.concurrent.CompletableFuture;

/**
 * GPS / network location provider.
 */
public interface LocationService {
    
    CompletableFuture<Position> currentPosition(PositionOptions options);
    
    /**
     * Starts continuous position updates on an OS thread.
     * 
     * @return stops the updates
     */
    Cancellation watch(PositionOptions options, PositionListener listener);
}
