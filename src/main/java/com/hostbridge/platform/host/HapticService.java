package com.hostbridge.platform.host;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Vibration motor.
 */
public interface HapticService {
    
    /**
     * Plays an on/off pattern in milliseconds, starting with "on".
     * An empty pattern stops any ongoing vibration.
     */
    CompletableFuture<Void> vibrate(List<Long> patternMillis);
}
