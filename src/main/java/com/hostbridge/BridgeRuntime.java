package com.hostbridge;

import com.hostbridge.capability.CapabilityTable;
import com.hostbridge.config.BridgeConfig;
import com.hostbridge.config.ConfigLoadException;
import com.hostbridge.config.ConfigService;
import com.hostbridge.config.ConfigValidationException;
import com.hostbridge.facade.ContentSurface;
import com.hostbridge.permission.PermissionGate;
import com.hostbridge.platform.Platform;
import com.hostbridge.platform.PlatformAdapter;
import com.hostbridge.platform.host.HostServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide owner of the bridge machinery.
 *
 * Holds the configuration, the platform adapter, the permission gate shared by
 * all bridges and the scheduler used for call timeouts. Opens one
 * {@link HostBridge} per content surface.
 */
public class BridgeRuntime implements AutoCloseable {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(BridgeRuntime.class);
    
    private final BridgeConfig config;
    private final PlatformAdapter adapter;
    private final PermissionGate permissions;
    private final ScheduledExecutorService scheduler;
    private final Map<String, HostBridge> bridges = new ConcurrentHashMap<>();
    private volatile boolean closed = false;
    
    public BridgeRuntime(BridgeConfig config, PlatformAdapter adapter) {
        this.config = config;
        this.adapter = adapter;
        this.permissions = new PermissionGate(adapter.permissions());
        this.scheduler = Executors.newScheduledThreadPool(2, daemonThreads());
        LOGGER.info("Bridge runtime started on {} (call timeout {} ms)",
            adapter.platform().id(), config.callTimeout().toMillis());
    }
    
    /**
     * Creates a runtime for the configured (or detected) platform.
     */
    public static BridgeRuntime create(BridgeConfig config, HostServices services) {
        Platform platform = config.resolvePlatform();
        return new BridgeRuntime(config, PlatformAdapter.create(platform, services));
    }
    
    /**
     * Creates a runtime from a JSON config file; a missing file means defaults.
     *
     * @throws ConfigLoadException if the file cannot be read
     * @throws ConfigValidationException if a value is invalid
     */
    public static BridgeRuntime create(Path configFile, HostServices services)
            throws ConfigLoadException, ConfigValidationException {
        return create(new ConfigService().load(configFile), services);
    }
    
    /**
     * Opens and attaches the bridge of a surface.
     *
     * @throws IllegalStateException if the runtime is closed or the surface already has a bridge
     */
    public HostBridge open(ContentSurface surface) {
        if (closed) {
            throw new IllegalStateException("Bridge runtime is closed");
        }
        
        HostBridge bridge = new HostBridge(surface, config, CapabilityTable.build(adapter), permissions, scheduler);
        if (bridges.putIfAbsent(surface.id(), bridge) != null) {
            throw new IllegalStateException("Surface " + surface.id() + " already has a bridge");
        }
        if (closed) {
            release(surface.id());
            throw new IllegalStateException("Bridge runtime is closed");
        }
        bridge.attach();
        return bridge;
    }
    
    /**
     * Disposes the bridge of a closed surface.
     *
     * @return true if the surface had a bridge
     */
    public boolean release(String surfaceId) {
        HostBridge bridge = bridges.remove(surfaceId);
        if (bridge == null) {
            return false;
        }
        bridge.dispose();
        return true;
    }
    
    public Optional<HostBridge> bridge(String surfaceId) {
        return Optional.ofNullable(bridges.get(surfaceId));
    }
    
    public int getBridgeCount() {
        return bridges.size();
    }
    
    public BridgeConfig getConfig() {
        return config;
    }
    
    public Platform getPlatform() {
        return adapter.platform();
    }
    
    public PermissionGate getPermissions() {
        return permissions;
    }
    
    /**
     * Disposes every bridge, then stops the permission gate and the scheduler.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        
        for (String surfaceId : List.copyOf(bridges.keySet())) {
            release(surfaceId);
        }
        permissions.close();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Bridge runtime closed");
    }
    
    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "hostbridge-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
