package com.hostbridge.platform.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single position fix. Optional readings are null when the device does not report them.
 */
public record Position(
    double latitude,
    double longitude,
    double accuracy,
    Double altitude,
    Double altitudeAccuracy,
    Double heading,
    Double speed,
    long timestamp
) {
    
    public static Position of(double latitude, double longitude, double accuracy, long timestamp) {
        return new Position(latitude, longitude, accuracy, null, null, null, null, timestamp);
    }
    
    /**
     * Shapes the fix like a web GeolocationPosition.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> coords = new LinkedHashMap<>();
        coords.put("latitude", latitude);
        coords.put("longitude", longitude);
        coords.put("accuracy", accuracy);
        coords.put("altitude", finiteOrNull(altitude));
        coords.put("altitudeAccuracy", finiteOrNull(altitudeAccuracy));
        coords.put("heading", finiteOrNull(heading));
        coords.put("speed", finiteOrNull(speed));
        
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("coords", coords);
        payload.put("timestamp", timestamp);
        return payload;
    }
    
    // Devices report NaN heading while stationary; JSON has no NaN
    private static Double finiteOrNull(Double reading) {
        return reading == null || reading.isNaN() || reading.isInfinite() ? null : reading;
    }
}
