package com.hostbridge.capability;

import com.hostbridge.permission.PermissionKind;
import com.hostbridge.permission.PermissionState;
import com.hostbridge.platform.PlatformAdapter;
import com.hostbridge.platform.host.PositionListener;
import com.hostbridge.platform.model.BatteryStatus;
import com.hostbridge.platform.model.NetworkStatus;
import com.hostbridge.platform.model.NotificationRequest;
import com.hostbridge.platform.model.OrientationLock;
import com.hostbridge.platform.model.Position;
import com.hostbridge.platform.model.PositionOptions;
import com.hostbridge.platform.model.ScreenOrientation;
import com.hostbridge.platform.model.ShareRequest;
import com.hostbridge.rpc.ErrorKind;
import com.hostbridge.rpc.InvalidArgumentsException;
import com.hostbridge.subscription.EventSink;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Static table binding every {@link Capability} to a {@link PlatformAdapter} call.
 */
public final class CapabilityTable {
    
    private CapabilityTable() {
    }
    
    /**
     * Builds the registry of one bridge instance.
     */
    public static CapabilityRegistry build(PlatformAdapter adapter) {
        return CapabilityRegistry.builder(adapter.platform())
            .register(Capability.CLIPBOARD_WRITE.contract(), (context, args) ->
                adapter.writeClipboard(string(args, "text")).thenApply(done -> true))
            .register(Capability.CLIPBOARD_READ.contract(), (context, args) ->
                adapter.readClipboard())
            .register(Capability.SHARE.contract(), (context, args) ->
                adapter.share(new ShareRequest(string(args, "title"), string(args, "text"), string(args, "url")))
                    .thenApply(done -> true))
            .register(Capability.NOTIFICATION_REQUEST_PERMISSION.contract(), (context, args) ->
                context.permissions().request(PermissionKind.NOTIFICATIONS).thenApply(PermissionState::webValue))
            .register(Capability.NOTIFICATION_SHOW.contract(), (context, args) ->
                adapter.showNotification(new NotificationRequest(
                        string(args, "title"), string(args, "body"), string(args, "icon"), string(args, "tag")))
                    .thenApply(done -> true))
            .register(Capability.GEOLOCATION_GET_CURRENT_POSITION.contract(), (context, args) ->
                currentPosition(adapter, PositionOptions.fromArguments(args)))
            .registerWatch(Capability.GEOLOCATION_WATCH_POSITION.contract(), (context, args, sink) ->
                adapter.watchPosition(PositionOptions.fromArguments(args), positionListener(sink)))
            .register(Capability.GEOLOCATION_CLEAR_WATCH.contract(), (context, args) -> {
                context.subscriptions().cancel(((Number) args.get("watchId")).longValue());
                return CompletableFuture.completedFuture(true);
            })
            .register(Capability.VIBRATE.contract(), (context, args) ->
                adapter.vibrate(pattern(args.get("pattern"))).thenApply(done -> true))
            .register(Capability.BATTERY_GET.contract(), (context, args) ->
                adapter.battery().thenApply(BatteryStatus::toPayload))
            .register(Capability.NETWORK_GET.contract(), (context, args) ->
                adapter.network().thenApply(NetworkStatus::toPayload))
            .register(Capability.SCREEN_ORIENTATION_LOCK.contract(), (context, args) -> {
                String requested = string(args, "orientation");
                OrientationLock lock = OrientationLock.fromWebValue(requested)
                    .orElseThrow(() -> new InvalidArgumentsException("Unsupported orientation: " + requested));
                return adapter.lockOrientation(lock).thenApply(done -> true);
            })
            .register(Capability.SCREEN_ORIENTATION_UNLOCK.contract(), (context, args) ->
                adapter.unlockOrientation().thenApply(done -> true))
            .register(Capability.SCREEN_ORIENTATION_GET.contract(), (context, args) ->
                adapter.orientation().thenApply(ScreenOrientation::toPayload))
            .build();
    }
    
    private static CompletableFuture<Map<String, Object>> currentPosition(PlatformAdapter adapter, PositionOptions options) {
        CompletableFuture<Position> fix = adapter.currentPosition(options);
        if (options.timeoutMillis() != null) {
            // copy so the adapter's own future is left untouched
            fix = fix.copy().orTimeout(options.timeoutMillis(), TimeUnit.MILLISECONDS);
        }
        return fix.thenApply(Position::toPayload);
    }
    
    private static PositionListener positionListener(EventSink sink) {
        return new PositionListener() {
            @Override
            public void onPosition(Position position) {
                sink.emit(position.toPayload());
            }
            
            @Override
            public void onError(Throwable error) {
                sink.fail(ErrorKind.OPERATION_FAILED, String.valueOf(error.getMessage()));
            }
        };
    }
    
    private static String string(Map<String, Object> args, String name) {
        Object value = args.get(name);
        return value == null ? null : value.toString();
    }
    
    private static List<Long> pattern(Object value) {
        if (value instanceof Number number) {
            long duration = number.longValue();
            return duration == 0 ? List.of() : List.of(duration);
        }
        return ((List<?>) value).stream().map(element -> ((Number) element).longValue()).toList();
    }
}
