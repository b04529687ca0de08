package com.hostbridge.platform.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Current screen orientation as a web OrientationType and angle.
 */
public record ScreenOrientation(String type, int angle) {
    
    public static final ScreenOrientation PORTRAIT_PRIMARY = new ScreenOrientation("portrait-primary", 0);
    public static final ScreenOrientation LANDSCAPE_PRIMARY = new ScreenOrientation("landscape-primary", 0);
    
    public static ScreenOrientation of(DeviceOrientation orientation) {
        return switch (orientation) {
            case PORTRAIT_UP -> PORTRAIT_PRIMARY;
            case PORTRAIT_DOWN -> new ScreenOrientation("portrait-secondary", 180);
            case LANDSCAPE_LEFT -> new ScreenOrientation("landscape-primary", 90);
            case LANDSCAPE_RIGHT -> new ScreenOrientation("landscape-secondary", 270);
        };
    }
    
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        payload.put("angle", angle);
        return payload;
    }
}
