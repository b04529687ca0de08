package com.hostbridge.platform.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadModelTest {
    
    @Test
    void testBatteryPayload() {
        Map<String, Object> charging = new BatteryStatus(100, ChargingState.FULL).toPayload();
        assertEquals(1.0, charging.get("level"));
        assertEquals(true, charging.get("charging"));
        assertEquals(0.0, charging.get("chargingTime"));
        assertEquals("full", charging.get("state"));
        
        Map<String, Object> draining = new BatteryStatus(35, null).toPayload();
        assertEquals(false, draining.get("charging"));
        assertNull(draining.get("chargingTime"));
        assertTrue(draining.containsKey("dischargingTime"));
        assertEquals("unknown", draining.get("state"));
    }
    
    @Test
    void testBatteryLevelRange() {
        assertThrows(IllegalArgumentException.class, () -> new BatteryStatus(101, ChargingState.CHARGING));
        assertThrows(IllegalArgumentException.class, () -> new BatteryStatus(-1, ChargingState.CHARGING));
    }
    
    @Test
    void testNetworkPayload() {
        Map<String, Object> payload = new NetworkStatus(ConnectionType.NONE).toPayload();
        
        assertEquals("none", payload.get("type"));
        assertEquals("slow-2g", payload.get("effectiveType"));
        assertEquals(0.0, payload.get("downlink"));
        assertEquals(false, payload.get("saveData"));
        assertEquals("unknown", new NetworkStatus(null).toPayload().get("type"));
    }
    
    @Test
    @SuppressWarnings("unchecked")
    void testPositionPayload() {
        Position position = new Position(1.5, -2.5, 12.0, 30.0, null, 90.0, null, 1234L);
        
        Map<String, Object> payload = position.toPayload();
        Map<String, Object> coords = (Map<String, Object>) payload.get("coords");
        
        assertEquals(1234L, payload.get("timestamp"));
        assertEquals(1.5, coords.get("latitude"));
        assertEquals(30.0, coords.get("altitude"));
        assertTrue(coords.containsKey("speed"));
        assertNull(coords.get("speed"));
    }
    
    @Test
    @SuppressWarnings("unchecked")
    void testNonFiniteReadingsBecomeNull() {
        Position position = new Position(1.0, 2.0, 3.0, Double.POSITIVE_INFINITY, null, Double.NaN, 0.0, 5L);
        
        Map<String, Object> coords = (Map<String, Object>) position.toPayload().get("coords");
        
        assertNull(coords.get("heading"));
        assertNull(coords.get("altitude"));
        assertEquals(0.0, coords.get("speed"));
    }
    
    @Test
    void testPositionOptionsFromArguments() {
        PositionOptions options = PositionOptions.fromArguments(
            Map.of("enableHighAccuracy", true, "timeout", 2500.0, "maximumAge", 60000.0));
        
        assertTrue(options.enableHighAccuracy());
        assertEquals(2500L, options.timeoutMillis());
        assertEquals(60000L, options.maximumAgeMillis());
        assertEquals(PositionOptions.DEFAULT, PositionOptions.fromArguments(Map.of()));
    }
    
    @Test
    void testOrientationLockParsing() {
        assertEquals(OrientationLock.PORTRAIT, OrientationLock.fromWebValue("portrait-secondary").orElseThrow());
        assertEquals(OrientationLock.LANDSCAPE, OrientationLock.fromWebValue(" Landscape ").orElseThrow());
        assertEquals(OrientationLock.ANY, OrientationLock.fromWebValue("natural").orElseThrow());
        assertTrue(OrientationLock.fromWebValue("upside-down").isEmpty());
        assertTrue(OrientationLock.fromWebValue(null).isEmpty());
    }
    
    @Test
    void testScreenOrientationOfDevice() {
        assertEquals(new ScreenOrientation("landscape-secondary", 270),
            ScreenOrientation.of(DeviceOrientation.LANDSCAPE_RIGHT));
        assertEquals(ScreenOrientation.PORTRAIT_PRIMARY, ScreenOrientation.of(DeviceOrientation.PORTRAIT_UP));
    }
    
    @Test
    void testShareText() {
        assertEquals("Hello\nhttps://example.org", new ShareRequest("Hello", "", "https://example.org").shareText());
        assertTrue(new ShareRequest(null, null, null).isEmpty());
    }
}
