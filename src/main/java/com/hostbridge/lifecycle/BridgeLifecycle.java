package com.hostbridge.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Phase controller of one bridge instance.
 * 
 * This is the single source of truth for the bridge's phase.
 * All phase transitions must go through this controller.
 */
public class BridgeLifecycle {
    private static final Logger LOGGER = LoggerFactory.getLogger(BridgeLifecycle.class);
    
    private final String surfaceId;
    private final AtomicReference<BridgePhase> currentPhase;
    
    public BridgeLifecycle(String surfaceId) {
        this.surfaceId = surfaceId;
        this.currentPhase = new AtomicReference<>(BridgePhase.CREATED);
    }
    
    public String getSurfaceId() {
        return surfaceId;
    }
    
    public BridgePhase getCurrentPhase() {
        return currentPhase.get();
    }
    
    /**
     * Advances to the given phase if the transition is valid.
     * 
     * @param nextPhase the phase to advance to
     * @throws IllegalStateException if the transition is invalid
     */
    public void advanceTo(BridgePhase nextPhase) {
        BridgePhase current = getCurrentPhase();
        
        if (nextPhase == current) {
            LOGGER.warn("Bridge {} attempted to advance to the same phase: {}", surfaceId, nextPhase);
            return;
        }
        
        if (!nextPhase.isAfter(current)) {
            String errorMsg = String.format(
                "Invalid phase transition for bridge %s: %s -> %s. Phases must advance monotonically.",
                surfaceId, current, nextPhase
            );
            LOGGER.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }
        
        if (currentPhase.compareAndSet(current, nextPhase)) {
            LOGGER.debug("Bridge {} phase transition: {} -> {}", surfaceId, current, nextPhase);
        } else {
            throw new IllegalStateException(
                String.format("Concurrent phase modification detected on bridge %s. Expected %s, but was %s",
                    surfaceId, current, getCurrentPhase())
            );
        }
    }
    
    /**
     * Moves to DISPOSING unless teardown already began.
     * 
     * @return true for the caller that started teardown
     */
    public boolean beginDisposal() {
        while (true) {
            BridgePhase current = getCurrentPhase();
            if (current.isAtOrAfter(BridgePhase.DISPOSING)) {
                return false;
            }
            if (currentPhase.compareAndSet(current, BridgePhase.DISPOSING)) {
                LOGGER.debug("Bridge {} phase transition: {} -> {}", surfaceId, current, BridgePhase.DISPOSING);
                return true;
            }
        }
    }
    
    public boolean isTornDown() {
        return getCurrentPhase().isAtOrAfter(BridgePhase.DISPOSING);
    }
}
