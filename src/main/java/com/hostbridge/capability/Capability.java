package com.hostbridge.capability;

import com.hostbridge.permission.PermissionKind;
import com.hostbridge.platform.Platform;
import com.hostbridge.platform.model.OrientationLock;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.hostbridge.capability.ArgumentType.BOOLEAN;
import static com.hostbridge.capability.ArgumentType.NUMBER;
import static com.hostbridge.capability.ArgumentType.NUMBER_OR_NUMBER_LIST;
import static com.hostbridge.capability.ArgumentType.STRING;

/**
 * The fixed set of capabilities script content can call, each keyed to its contract.
 */
public enum Capability {
    CLIPBOARD_WRITE(oneShot("clipboard.write",
        ArgumentSchema.builder().required("text", STRING).build(),
        ResultShape.BOOLEAN, null, Platform.ALL)),
    
    CLIPBOARD_READ(oneShot("clipboard.read",
        ArgumentSchema.EMPTY, ResultShape.TEXT, null, Platform.ALL)),
    
    SHARE(oneShot("share",
        ArgumentSchema.builder()
            .optional("title", STRING)
            .optional("text", STRING)
            .optional("url", STRING)
            .atLeastOneOf("title", "text", "url")
            .build(),
        ResultShape.BOOLEAN, null, Platform.ALL)),
    
    NOTIFICATION_REQUEST_PERMISSION(oneShot("notification.requestPermission",
        ArgumentSchema.EMPTY, ResultShape.PERMISSION_STATE, null, Platform.ALL)),
    
    NOTIFICATION_SHOW(oneShot("notification.show",
        ArgumentSchema.builder()
            .optional("title", STRING)
            .optional("body", STRING)
            .optional("icon", STRING)
            .optional("tag", STRING)
            .build(),
        ResultShape.BOOLEAN, PermissionKind.NOTIFICATIONS, Platform.ALL)),
    
    GEOLOCATION_GET_CURRENT_POSITION(oneShot("geolocation.getCurrentPosition",
        positionOptions(), ResultShape.POSITION, PermissionKind.LOCATION, Platform.ALL)),
    
    GEOLOCATION_WATCH_POSITION(new CapabilityContract("geolocation.watchPosition", InvocationKind.WATCH,
        positionOptions(), ResultShape.SUBSCRIPTION_ID, PermissionKind.LOCATION, Platform.ALL)),
    
    GEOLOCATION_CLEAR_WATCH(oneShot("geolocation.clearWatch",
        ArgumentSchema.builder()
            .required("watchId", NUMBER)
            .constrain("watchId", Capability::isSubscriptionId, "must be a non-negative integer")
            .build(),
        ResultShape.BOOLEAN, null, Platform.ALL)),
    
    VIBRATE(oneShot("vibrate",
        ArgumentSchema.builder()
            .required("pattern", NUMBER_OR_NUMBER_LIST)
            .constrain("pattern", Capability::isNonNegativePattern, "must only hold non-negative durations")
            .build(),
        ResultShape.BOOLEAN, null, Platform.ALL)),
    
    BATTERY_GET(oneShot("battery.get",
        ArgumentSchema.EMPTY, ResultShape.BATTERY_STATUS, null, Platform.ALL)),
    
    NETWORK_GET(oneShot("network.get",
        ArgumentSchema.EMPTY, ResultShape.NETWORK_STATUS, null, Platform.ALL)),
    
    SCREEN_ORIENTATION_LOCK(oneShot("screenOrientation.lock",
        ArgumentSchema.builder()
            .required("orientation", STRING)
            .constrain("orientation", value -> OrientationLock.fromWebValue((String) value).isPresent(),
                "must be a portrait, landscape, any or natural orientation")
            .build(),
        ResultShape.BOOLEAN, null, Platform.MOBILE)),
    
    SCREEN_ORIENTATION_UNLOCK(oneShot("screenOrientation.unlock",
        ArgumentSchema.EMPTY, ResultShape.BOOLEAN, null, Platform.MOBILE)),
    
    SCREEN_ORIENTATION_GET(oneShot("screenOrientation.get",
        ArgumentSchema.EMPTY, ResultShape.ORIENTATION, null, Platform.ALL));
    
    private final CapabilityContract contract;
    
    Capability(CapabilityContract contract) {
        this.contract = contract;
    }
    
    public CapabilityContract contract() {
        return contract;
    }
    
    public String wireName() {
        return contract.name();
    }
    
    public static Optional<Capability> fromWireName(String name) {
        for (Capability capability : values()) {
            if (capability.wireName().equals(name)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }
    
    private static CapabilityContract oneShot(String name, ArgumentSchema arguments, ResultShape resultShape,
                                              PermissionKind permission, Set<Platform> platforms) {
        return new CapabilityContract(name, InvocationKind.ONE_SHOT, arguments, resultShape, permission, platforms);
    }
    
    private static ArgumentSchema positionOptions() {
        return ArgumentSchema.builder()
            .optional("enableHighAccuracy", BOOLEAN)
            .optional("timeout", NUMBER)
            .constrain("timeout", value -> ((Number) value).doubleValue() >= 0, "must not be negative")
            .optional("maximumAge", NUMBER)
            .constrain("maximumAge", value -> ((Number) value).doubleValue() >= 0, "must not be negative")
            .build();
    }
    
    private static boolean isSubscriptionId(Object value) {
        double id = ((Number) value).doubleValue();
        return id >= 0 && id == Math.rint(id) && id <= Long.MAX_VALUE;
    }
    
    private static boolean isNonNegativePattern(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue() >= 0;
        }
        return ((List<?>) value).stream().allMatch(element -> ((Number) element).doubleValue() >= 0);
    }
}
