package com.hostbridge.platform.model;

public enum ChargingState {
    CHARGING("charging"),
    DISCHARGING("discharging"),
    FULL("full"),
    UNKNOWN("unknown");
    
    private final String webValue;
    
    ChargingState(String webValue) {
        this.webValue = webValue;
    }
    
    public String webValue() {
        return webValue;
    }
}
