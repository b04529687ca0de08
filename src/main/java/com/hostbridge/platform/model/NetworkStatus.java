package com.hostbridge.platform.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Network reading shaped like a web NetworkInformation object.
 */
public record NetworkStatus(ConnectionType type) {
    
    static final int ESTIMATED_RTT_MILLIS = 50;
    
    public NetworkStatus {
        type = type == null ? ConnectionType.UNKNOWN : type;
    }
    
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type.webValue());
        payload.put("effectiveType", type.effectiveType());
        payload.put("downlink", type.downlinkMbps());
        payload.put("rtt", ESTIMATED_RTT_MILLIS);
        payload.put("saveData", false);
        return payload;
    }
}
