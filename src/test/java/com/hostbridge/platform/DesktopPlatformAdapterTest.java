package com.hostbridge.platform;

import com.hostbridge.permission.PermissionKind;
import com.hostbridge.permission.PermissionState;
import com.hostbridge.platform.model.ConnectionType;
import com.hostbridge.platform.model.OrientationLock;
import com.hostbridge.platform.model.ScreenOrientation;
import com.hostbridge.rpc.BridgeException;
import com.hostbridge.rpc.ErrorKind;
import com.hostbridge.support.FakeHost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class DesktopPlatformAdapterTest {
    
    private FakeHost host;
    private PlatformAdapter adapter;
    
    @BeforeEach
    void setUp() {
        host = new FakeHost();
        adapter = PlatformAdapter.create(Platform.LINUX, host.desktopServices());
    }
    
    @Test
    void testFactoryPicksDesktopAdapter() {
        assertInstanceOf(DesktopPlatformAdapter.class, adapter);
        assertThrows(IllegalArgumentException.class,
            () -> new DesktopPlatformAdapter(Platform.ANDROID, host.desktopServices()));
    }
    
    @Test
    void testPermissionsReadAsGrantedWithoutProvider() {
        assertEquals(PermissionState.GRANTED, adapter.permissions().currentState(PermissionKind.LOCATION));
        assertEquals(PermissionState.GRANTED, adapter.permissions().prompt(PermissionKind.NOTIFICATIONS).join());
    }
    
    @Test
    void testHostPermissionProviderIsUsedWhenPresent() {
        PlatformAdapter withProvider = PlatformAdapter.create(Platform.MACOS, host.mobileServices());
        
        assertSame(host.permissions, withProvider.permissions());
    }
    
    @Test
    void testVibrateIsNoOpWithoutHaptics() {
        assertDoesNotThrow(() -> adapter.vibrate(List.of(200L)).join());
        assertTrue(host.vibrations.isEmpty());
    }
    
    @Test
    void testOrientationLockIsUnavailable() {
        CompletionException e = assertThrows(CompletionException.class,
            () -> adapter.lockOrientation(OrientationLock.PORTRAIT).join());
        BridgeException cause = assertInstanceOf(BridgeException.class, e.getCause());
        assertEquals(ErrorKind.CAPABILITY_UNAVAILABLE, cause.getKind());
        
        assertThrows(CompletionException.class, () -> adapter.unlockOrientation().join());
    }
    
    @Test
    void testOrientationDefaultsToLandscape() {
        assertEquals(ScreenOrientation.LANDSCAPE_PRIMARY, adapter.orientation().join());
    }
    
    @Test
    void testNetworkStatus() {
        host.connection = ConnectionType.ETHERNET;
        
        assertEquals("ethernet", adapter.network().join().toPayload().get("type"));
    }
}
