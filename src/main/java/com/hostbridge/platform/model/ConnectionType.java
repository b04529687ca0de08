package com.hostbridge.platform.model;

/**
 * Active network transport, with the estimates reported to content.
 */
public enum ConnectionType {
    WIFI("wifi", "4g", 50.0),
    CELLULAR("cellular", "4g", 10.0),
    ETHERNET("ethernet", "4g", 100.0),
    NONE("none", "slow-2g", 0.0),
    UNKNOWN("unknown", "4g", 10.0);
    
    private final String webValue;
    private final String effectiveType;
    private final double downlinkMbps;
    
    ConnectionType(String webValue, String effectiveType, double downlinkMbps) {
        this.webValue = webValue;
        this.effectiveType = effectiveType;
        this.downlinkMbps = downlinkMbps;
    }
    
    public String webValue() {
        return webValue;
    }
    
    public String effectiveType() {
        return effectiveType;
    }
    
    public double downlinkMbps() {
        return downlinkMbps;
    }
}
