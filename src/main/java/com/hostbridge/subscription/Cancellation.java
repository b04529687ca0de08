package com.hostbridge.subscription;

/**
 * Stops a running watch at its source.
 */
@FunctionalInterface
public interface Cancellation {
    
    void cancel();
    
    static Cancellation none() {
        return () -> { };
    }
}
