package com.hostbridge.support;

import com.hostbridge.permission.PermissionKind;
import com.hostbridge.permission.PermissionProvider;
import com.hostbridge.permission.PermissionState;
import com.hostbridge.platform.host.ClipboardService;
import com.hostbridge.platform.host.HostServices;
import com.hostbridge.platform.host.LocationService;
import com.hostbridge.platform.host.OrientationService;
import com.hostbridge.platform.host.PositionListener;
import com.hostbridge.platform.model.BatteryStatus;
import com.hostbridge.platform.model.ChargingState;
import com.hostbridge.platform.model.ConnectionType;
import com.hostbridge.platform.model.DeviceOrientation;
import com.hostbridge.platform.model.NotificationRequest;
import com.hostbridge.platform.model.Position;
import com.hostbridge.platform.model.PositionOptions;
import com.hostbridge.platform.model.ScreenOrientation;
import com.hostbridge.subscription.Cancellation;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory host services for tests.
 */
public class FakeHost {
    
    public final AtomicReference<String> clipboard = new AtomicReference<>();
    public final List<String> shared = new CopyOnWriteArrayList<>();
    public final List<NotificationRequest> notifications = new CopyOnWriteArrayList<>();
    public final List<Integer> notificationIds = new CopyOnWriteArrayList<>();
    public final List<List<Long>> vibrations = new CopyOnWriteArrayList<>();
    public final AtomicReference<Set<DeviceOrientation>> preferredOrientations = new AtomicReference<>(DeviceOrientation.all());
    public final FakeLocation location = new FakeLocation();
    public final ScriptedPermissions permissions = new ScriptedPermissions();
    
    public volatile BatteryStatus battery = new BatteryStatus(80, ChargingState.DISCHARGING);
    public volatile ConnectionType connection = ConnectionType.WIFI;
    public volatile ScreenOrientation orientation = ScreenOrientation.PORTRAIT_PRIMARY;
    
    /**
     * Services for a mobile platform: everything, including haptics and orientation.
     */
    public HostServices mobileServices() {
        return baseServices()
            .haptics(pattern -> {
                vibrations.add(pattern);
                return CompletableFuture.completedFuture(null);
            })
            .orientation(new OrientationService() {
                @Override
                public CompletableFuture<Void> setPreferredOrientations(Set<DeviceOrientation> orientations) {
                    preferredOrientations.set(Set.copyOf(orientations));
                    return CompletableFuture.completedFuture(null);
                }
                
                @Override
                public CompletableFuture<ScreenOrientation> current() {
                    return CompletableFuture.completedFuture(orientation);
                }
            })
            .permissions(permissions)
            .build();
    }
    
    /**
     * Services for a desktop platform: no haptics, no orientation, no permission provider.
     */
    public HostServices desktopServices() {
        return baseServices().build();
    }
    
    private HostServices.Builder baseServices() {
        return HostServices.builder()
            .clipboard(new ClipboardService() {
                @Override
                public CompletableFuture<Void> setText(String text) {
                    clipboard.set(text);
                    return CompletableFuture.completedFuture(null);
                }
                
                @Override
                public CompletableFuture<String> getText() {
                    return CompletableFuture.completedFuture(clipboard.get());
                }
            })
            .share((text, subject) -> {
                shared.add(text);
                return CompletableFuture.completedFuture(null);
            })
            .notifications((id, request) -> {
                notificationIds.add(id);
                notifications.add(request);
                return CompletableFuture.completedFuture(null);
            })
            .location(location)
            .battery(() -> CompletableFuture.completedFuture(battery))
            .connectivity(() -> CompletableFuture.completedFuture(connection));
    }
    
    /**
     * Location service whose fixes are pushed by the test.
     */
    public static class FakeLocation implements LocationService {
        
        private final List<PositionListener> watchers = new CopyOnWriteArrayList<>();
        public final AtomicInteger currentPositionCalls = new AtomicInteger();
        public volatile CompletableFuture<Position> nextFix =
            CompletableFuture.completedFuture(Position.of(52.52, 13.405, 5.0, 1_700_000_000_000L));
        
        @Override
        public CompletableFuture<Position> currentPosition(PositionOptions options) {
            currentPositionCalls.incrementAndGet();
            return nextFix;
        }
        
        @Override
        public Cancellation watch(PositionOptions options, PositionListener listener) {
            watchers.add(listener);
            return () -> watchers.remove(listener);
        }
        
        public void emit(Position position) {
            for (PositionListener watcher : watchers) {
                watcher.onPosition(position);
            }
        }
        
        public void emitError(Throwable error) {
            for (PositionListener watcher : watchers) {
                watcher.onError(error);
            }
        }
        
        public int activeWatchers() {
            return watchers.size();
        }
    }
    
    /**
     * Permission provider with a settable OS status and prompt answer.
     * Prompts can be held open to test coalescing.
     */
    public static class ScriptedPermissions implements PermissionProvider {
        
        private final Map<PermissionKind, PermissionState> osStates = new EnumMap<>(PermissionKind.class);
        private final Map<PermissionKind, PermissionState> answers = new EnumMap<>(PermissionKind.class);
        private final List<CompletableFuture<PermissionState>> heldPrompts = new CopyOnWriteArrayList<>();
        private final AtomicInteger promptCount = new AtomicInteger();
        private volatile boolean holdPrompts = false;
        
        public synchronized void setOsState(PermissionKind kind, PermissionState state) {
            osStates.put(kind, state);
        }
        
        public synchronized void answerWith(PermissionKind kind, PermissionState answer) {
            answers.put(kind, answer);
        }
        
        public void holdPrompts() {
            holdPrompts = true;
        }
        
        /**
         * Completes every held prompt with the scripted answer.
         */
        public void releasePrompts(PermissionKind kind) {
            PermissionState answer = answerFor(kind);
            for (CompletableFuture<PermissionState> prompt : heldPrompts) {
                heldPrompts.remove(prompt);
                applyAnswer(kind, answer);
                prompt.complete(answer);
            }
        }
        
        public int getPromptCount() {
            return promptCount.get();
        }
        
        public int getHeldPromptCount() {
            return heldPrompts.size();
        }
        
        @Override
        public synchronized PermissionState currentState(PermissionKind kind) {
            return osStates.getOrDefault(kind, PermissionState.NOT_DETERMINED);
        }
        
        @Override
        public CompletableFuture<PermissionState> prompt(PermissionKind kind) {
            promptCount.incrementAndGet();
            if (holdPrompts) {
                CompletableFuture<PermissionState> held = new CompletableFuture<>();
                heldPrompts.add(held);
                return held;
            }
            PermissionState answer = answerFor(kind);
            applyAnswer(kind, answer);
            return CompletableFuture.completedFuture(answer);
        }
        
        private synchronized PermissionState answerFor(PermissionKind kind) {
            return answers.getOrDefault(kind, PermissionState.GRANTED);
        }
        
        private synchronized void applyAnswer(PermissionKind kind, PermissionState answer) {
            if (answer != PermissionState.NOT_DETERMINED) {
                osStates.put(kind, answer);
            }
        }
    }
}
