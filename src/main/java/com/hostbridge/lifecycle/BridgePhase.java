package com.hostbridge.lifecycle;

/**
 * Lifecycle phases of one bridge instance.
 * 
 * Phases advance monotonically and never regress.
 */
public enum BridgePhase {
    /**
     * Registry and tables are built. The facade is not installed yet.
     */
    CREATED,
    
    /**
     * The facade is installed in the content surface and calls are accepted.
     */
    ACTIVE,
    
    /**
     * Teardown has begun. New calls fail with BridgeDisposed.
     */
    DISPOSING,
    
    /**
     * Every subscription is cancelled and every outstanding call has its result.
     */
    DISPOSED;
    
    public boolean isAfter(BridgePhase other) {
        return this.ordinal() > other.ordinal();
    }
    
    public boolean isAtOrAfter(BridgePhase other) {
        return this.ordinal() >= other.ordinal();
    }
}
