package com.hostbridge.facade;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScriptFacadeTest {
    
    @Test
    void testPlaceholdersAreFilled() {
        String script = new ScriptFacade("myBridge").render();
        
        assertTrue(script.contains("var NAMESPACE = 'myBridge';"));
        assertTrue(script.contains("var PROTOCOL = 1;"));
        assertTrue(script.contains("global." + ScriptFacade.TRANSPORT_BINDING));
        assertFalse(script.contains("__NAMESPACE__"));
        assertFalse(script.contains("__PROTOCOL__"));
        assertFalse(script.contains("__TRANSPORT__"));
    }
    
    @Test
    void testInstallsWebApis() {
        String script = new ScriptFacade("hostBridge").render();
        
        assertTrue(script.contains("navigator.clipboard"));
        assertTrue(script.contains("navigator.geolocation"));
        assertTrue(script.contains("navigator.getBattery"));
        assertTrue(script.contains("screen.orientation"));
        assertTrue(script.contains("global.Notification"));
    }
}
