package com.hostbridge.platform;

import com.hostbridge.platform.model.DeviceOrientation;
import com.hostbridge.platform.model.NotificationRequest;
import com.hostbridge.platform.model.OrientationLock;
import com.hostbridge.platform.model.ShareRequest;
import com.hostbridge.support.FakeHost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MobilePlatformAdapterTest {
    
    private FakeHost host;
    private PlatformAdapter adapter;
    
    @BeforeEach
    void setUp() {
        host = new FakeHost();
        adapter = PlatformAdapter.create(Platform.IOS, host.mobileServices());
    }
    
    @Test
    void testFactoryPicksMobileAdapter() {
        assertInstanceOf(MobilePlatformAdapter.class, adapter);
        assertEquals(Platform.IOS, adapter.platform());
        assertSame(host.permissions, adapter.permissions());
    }
    
    @Test
    void testMobileServicesAreRequired() {
        assertThrows(IllegalStateException.class,
            () -> new MobilePlatformAdapter(Platform.ANDROID, host.desktopServices()));
        assertThrows(IllegalArgumentException.class,
            () -> new MobilePlatformAdapter(Platform.LINUX, host.mobileServices()));
    }
    
    @Test
    void testNotificationIdsIncrease() {
        adapter.showNotification(new NotificationRequest("First", null, null, null)).join();
        adapter.showNotification(new NotificationRequest(null, "body", null, null)).join();
        
        assertEquals(List.of(1, 2), host.notificationIds);
        assertEquals("First", host.notifications.get(0).title());
        assertEquals(NotificationRequest.DEFAULT_TITLE, host.notifications.get(1).title());
        assertEquals("", host.notifications.get(0).body());
    }
    
    @Test
    void testOrientationLockMapping() {
        adapter.lockOrientation(OrientationLock.LANDSCAPE).join();
        assertEquals(EnumSet.of(DeviceOrientation.LANDSCAPE_LEFT, DeviceOrientation.LANDSCAPE_RIGHT),
            host.preferredOrientations.get());
        
        adapter.lockOrientation(OrientationLock.PORTRAIT).join();
        assertEquals(EnumSet.of(DeviceOrientation.PORTRAIT_UP, DeviceOrientation.PORTRAIT_DOWN),
            host.preferredOrientations.get());
        
        adapter.unlockOrientation().join();
        assertEquals(DeviceOrientation.all(), host.preferredOrientations.get());
    }
    
    @Test
    void testVibrateUsesHaptics() {
        adapter.vibrate(List.of(100L, 50L, 100L)).join();
        
        assertEquals(List.of(List.of(100L, 50L, 100L)), host.vibrations);
    }
    
    @Test
    void testShareJoinsParts() {
        adapter.share(new ShareRequest("Title", null, "https://example.org")).join();
        
        assertEquals(List.of("Title\nhttps://example.org"), host.shared);
    }
    
    @Test
    void testEmptyClipboardReadsEmpty() {
        assertEquals("", adapter.readClipboard().join());
        
        adapter.writeClipboard("copied").join();
        assertEquals("copied", adapter.readClipboard().join());
    }
}
