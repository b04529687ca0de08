package com.hostbridge.permission;

import org.junit.jupiter.api.Test;

import static com.hostbridge.permission.PermissionState.Source.POLL;
import static com.hostbridge.permission.PermissionState.Source.PROMPT;
import static org.junit.jupiter.api.Assertions.*;

class PermissionStateTest {
    
    @Test
    void testNotDeterminedIsOnlyInitial() {
        for (PermissionState state : PermissionState.values()) {
            if (state != PermissionState.NOT_DETERMINED) {
                assertFalse(state.canTransitionTo(PermissionState.NOT_DETERMINED, PROMPT), state.name());
                assertFalse(state.canTransitionTo(PermissionState.NOT_DETERMINED, POLL), state.name());
            }
        }
        assertTrue(PermissionState.NOT_DETERMINED.canTransitionTo(PermissionState.GRANTED, PROMPT));
        assertTrue(PermissionState.NOT_DETERMINED.canTransitionTo(PermissionState.RESTRICTED, POLL));
    }
    
    @Test
    void testDeniedOnlyGrantedThroughPrompt() {
        assertTrue(PermissionState.DENIED.canTransitionTo(PermissionState.GRANTED, PROMPT));
        assertFalse(PermissionState.DENIED.canTransitionTo(PermissionState.GRANTED, POLL));
        assertFalse(PermissionState.DENIED.canTransitionTo(PermissionState.RESTRICTED, POLL));
    }
    
    @Test
    void testGrantedCanBeRevoked() {
        assertTrue(PermissionState.GRANTED.canTransitionTo(PermissionState.DENIED, POLL));
        assertTrue(PermissionState.GRANTED.canTransitionTo(PermissionState.RESTRICTED, POLL));
    }
    
    @Test
    void testRestrictedCanResolve() {
        assertTrue(PermissionState.RESTRICTED.canTransitionTo(PermissionState.GRANTED, POLL));
        assertTrue(PermissionState.RESTRICTED.canTransitionTo(PermissionState.DENIED, PROMPT));
    }
    
    @Test
    void testWebValues() {
        assertEquals("default", PermissionState.NOT_DETERMINED.webValue());
        assertEquals("granted", PermissionState.GRANTED.webValue());
        assertEquals("denied", PermissionState.DENIED.webValue());
        assertEquals("denied", PermissionState.RESTRICTED.webValue());
    }
}
