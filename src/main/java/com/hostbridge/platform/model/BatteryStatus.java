package com.hostbridge.platform.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Battery reading.
 * 
 * @param levelPercent 0 to 100
 */
public record BatteryStatus(int levelPercent, ChargingState state) {
    
    public BatteryStatus {
        if (levelPercent < 0 || levelPercent > 100) {
            throw new IllegalArgumentException("Battery level out of range: " + levelPercent);
        }
        state = state == null ? ChargingState.UNKNOWN : state;
    }
    
    public boolean charging() {
        return state == ChargingState.CHARGING || state == ChargingState.FULL;
    }
    
    /**
     * Shapes the reading like a web BatteryManager.
     * The OS gives no time estimates, so unknown times are null (Infinity on the script side).
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("level", levelPercent / 100.0);
        payload.put("charging", charging());
        payload.put("chargingTime", state == ChargingState.FULL ? 0.0 : null);
        payload.put("dischargingTime", null);
        payload.put("state", state.webValue());
        return payload;
    }
}
