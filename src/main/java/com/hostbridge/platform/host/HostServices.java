package com.hostbridge.platform.host;

import com.hostbridge.permission.PermissionProvider;

import java.util.Optional;

/**
 * The OS services a host application hands to the bridge.
 * 
 * Which services are mandatory depends on the adapter the runtime picks for
 * the running OS family; haptics and orientation are optional on desktop.
 */
public final class HostServices {
    
    private final ClipboardService clipboard;
    private final ShareService share;
    private final NotificationService notifications;
    private final LocationService location;
    private final HapticService haptics;
    private final BatteryService battery;
    private final ConnectivityService connectivity;
    private final OrientationService orientation;
    private final PermissionProvider permissions;
    
    private HostServices(Builder builder) {
        this.clipboard = builder.clipboard;
        this.share = builder.share;
        this.notifications = builder.notifications;
        this.location = builder.location;
        this.haptics = builder.haptics;
        this.battery = builder.battery;
        this.connectivity = builder.connectivity;
        this.orientation = builder.orientation;
        this.permissions = builder.permissions;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public ClipboardService clipboard() { return clipboard; }
    public ShareService share() { return share; }
    public NotificationService notifications() { return notifications; }
    public LocationService location() { return location; }
    public Optional<HapticService> haptics() { return Optional.ofNullable(haptics); }
    public BatteryService battery() { return battery; }
    public ConnectivityService connectivity() { return connectivity; }
    public Optional<OrientationService> orientation() { return Optional.ofNullable(orientation); }
    public Optional<PermissionProvider> permissions() { return Optional.ofNullable(permissions); }
    
    public static class Builder {
        private ClipboardService clipboard;
        private ShareService share;
        private NotificationService notifications;
        private LocationService location;
        private HapticService haptics;
        private BatteryService battery;
        private ConnectivityService connectivity;
        private OrientationService orientation;
        private PermissionProvider permissions;
        
        public Builder clipboard(ClipboardService clipboard) {
            this.clipboard = clipboard;
            return this;
        }
        
        public Builder share(ShareService share) {
            this.share = share;
            return this;
        }
        
        public Builder notifications(NotificationService notifications) {
            this.notifications = notifications;
            return this;
        }
        
        public Builder location(LocationService location) {
            this.location = location;
            return this;
        }
        
        public Builder haptics(HapticService haptics) {
            this.haptics = haptics;
            return this;
        }
        
        public Builder battery(BatteryService battery) {
            this.battery = battery;
            return this;
        }
        
        public Builder connectivity(ConnectivityService connectivity) {
            this.connectivity = connectivity;
            return this;
        }
        
        public Builder orientation(OrientationService orientation) {
            this.orientation = orientation;
            return this;
        }
        
        public Builder permissions(PermissionProvider permissions) {
            this.permissions = permissions;
            return this;
        }
        
        public HostServices build() {
            if (clipboard == null || share == null || notifications == null
                    || location == null || battery == null || connectivity == null) {
                throw new IllegalStateException(
                    "Clipboard, share, notification, location, battery and connectivity services are required");
            }
            return new HostServices(this);
        }
    }
}
