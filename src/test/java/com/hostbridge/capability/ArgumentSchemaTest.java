package com.hostbridge.capability;

import com.hostbridge.rpc.InvalidArgumentsException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentSchemaTest {
    
    private static ArgumentSchema schemaOf(Capability capability) {
        return capability.contract().arguments();
    }
    
    @Test
    void testRequiredFieldMissing() {
        InvalidArgumentsException e = assertThrows(InvalidArgumentsException.class,
            () -> schemaOf(Capability.CLIPBOARD_WRITE).validate(Map.of()));
        assertTrue(e.getMessage().contains("'text'"));
    }
    
    @Test
    void testWrongType() {
        InvalidArgumentsException e = assertThrows(InvalidArgumentsException.class,
            () -> schemaOf(Capability.CLIPBOARD_WRITE).validate(Map.of("text", 42.0)));
        assertTrue(e.getMessage().contains("STRING"));
    }
    
    @Test
    void testUnknownKeysAreIgnored() {
        assertDoesNotThrow(() -> schemaOf(Capability.CLIPBOARD_WRITE).validate(Map.of("text", "hi", "extra", true)));
        assertDoesNotThrow(() -> ArgumentSchema.EMPTY.validate(Map.of("anything", 1.0)));
    }
    
    @Test
    void testShareNeedsAtLeastOnePart() {
        ArgumentSchema share = schemaOf(Capability.SHARE);
        
        assertThrows(InvalidArgumentsException.class, () -> share.validate(Map.of()));
        assertThrows(InvalidArgumentsException.class, () -> share.validate(Map.of("title", "", "text", "")));
        assertDoesNotThrow(() -> share.validate(Map.of("url", "https://example.org")));
    }
    
    @Test
    void testVibratePattern() {
        ArgumentSchema vibrate = schemaOf(Capability.VIBRATE);
        
        assertDoesNotThrow(() -> vibrate.validate(Map.of("pattern", 200.0)));
        assertDoesNotThrow(() -> vibrate.validate(Map.of("pattern", List.of(100.0, 50.0, 100.0))));
        assertDoesNotThrow(() -> vibrate.validate(Map.of("pattern", List.of())));
        assertThrows(InvalidArgumentsException.class, () -> vibrate.validate(Map.of("pattern", -1.0)));
        assertThrows(InvalidArgumentsException.class, () -> vibrate.validate(Map.of("pattern", List.of(100.0, "long"))));
    }
    
    @Test
    void testPositionOptions() {
        ArgumentSchema options = schemaOf(Capability.GEOLOCATION_GET_CURRENT_POSITION);
        
        assertDoesNotThrow(() -> options.validate(Map.of()));
        assertDoesNotThrow(() -> options.validate(Map.of("enableHighAccuracy", true, "timeout", 5000.0)));
        assertThrows(InvalidArgumentsException.class, () -> options.validate(Map.of("timeout", -5.0)));
        assertThrows(InvalidArgumentsException.class, () -> options.validate(Map.of("enableHighAccuracy", "yes")));
    }
    
    @Test
    void testOrientationLockValues() {
        ArgumentSchema lock = schemaOf(Capability.SCREEN_ORIENTATION_LOCK);
        
        assertDoesNotThrow(() -> lock.validate(Map.of("orientation", "landscape-primary")));
        assertDoesNotThrow(() -> lock.validate(Map.of("orientation", "natural")));
        InvalidArgumentsException e = assertThrows(InvalidArgumentsException.class,
            () -> lock.validate(Map.of("orientation", "sideways")));
        assertTrue(e.getMessage().startsWith("Argument 'orientation'"));
    }
    
    @Test
    void testNullValueCountsAsMissing() {
        Map<String, Object> args = new HashMap<>();
        args.put("watchId", null);
        
        assertThrows(InvalidArgumentsException.class, () -> schemaOf(Capability.GEOLOCATION_CLEAR_WATCH).validate(args));
    }
    
    @Test
    void testWatchIdMustBeIntegral() {
        ArgumentSchema clear = schemaOf(Capability.GEOLOCATION_CLEAR_WATCH);
        
        assertDoesNotThrow(() -> clear.validate(Map.of("watchId", 3.0)));
        assertThrows(InvalidArgumentsException.class, () -> clear.validate(Map.of("watchId", 1.5)));
        assertThrows(InvalidArgumentsException.class, () -> clear.validate(Map.of("watchId", -1.0)));
        assertThrows(InvalidArgumentsException.class, () -> clear.validate(Map.of("watchId", Double.NaN)));
    }
    
    @Test
    void testConstraintNeedsDeclaredField() {
        assertThrows(IllegalStateException.class,
            () -> ArgumentSchema.builder().constrain("missing", value -> true, "is fine"));
    }
}
