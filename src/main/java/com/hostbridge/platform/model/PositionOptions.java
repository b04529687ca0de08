package com.hostbridge.platform.model;

import java.util.Map;

/**
 * Options of getCurrentPosition and watchPosition.
 * 
 * @param timeoutMillis upper bound for one fix, null for none
 * @param maximumAgeMillis oldest cached fix that is acceptable, 0 for a fresh fix
 */
public record PositionOptions(
    boolean enableHighAccuracy,
    Long timeoutMillis,
    long maximumAgeMillis
) {
    
    public static final PositionOptions DEFAULT = new PositionOptions(false, null, 0L);
    
    /**
     * Reads options from sanitized call arguments. Numbers arrive as Double.
     */
    public static PositionOptions fromArguments(Map<String, Object> arguments) {
        boolean highAccuracy = Boolean.TRUE.equals(arguments.get("enableHighAccuracy"));
        Long timeout = arguments.get("timeout") instanceof Number number ? number.longValue() : null;
        long maximumAge = arguments.get("maximumAge") instanceof Number number ? number.longValue() : 0L;
        return new PositionOptions(highAccuracy, timeout, maximumAge);
    }
}
