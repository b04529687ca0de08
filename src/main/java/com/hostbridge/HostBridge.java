package com.hostbridge;

import com.hostbridge.capability.CapabilityRegistry;
import com.hostbridge.capability.InvocationContext;
import com.hostbridge.config.BridgeConfig;
import com.hostbridge.facade.ConsoleForwarder;
import com.hostbridge.facade.ContentSurface;
import com.hostbridge.facade.ScriptFacade;
import com.hostbridge.lifecycle.BridgeLifecycle;
import com.hostbridge.lifecycle.BridgePhase;
import com.hostbridge.permission.PermissionGate;
import com.hostbridge.rpc.ArgumentSanitizer;
import com.hostbridge.rpc.CallDispatcher;
import com.hostbridge.rpc.CallRequest;
import com.hostbridge.rpc.CallResult;
import com.hostbridge.rpc.ErrorKind;
import com.hostbridge.rpc.InboundMessage;
import com.hostbridge.rpc.OutboundChannel;
import com.hostbridge.rpc.PendingCallRegistry;
import com.hostbridge.rpc.WireCodec;
import com.hostbridge.rpc.WireFormatException;
import com.hostbridge.subscription.SubscriptionEvent;
import com.hostbridge.subscription.SubscriptionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

/**
 * The bridge of one content surface.
 *
 * Owns the surface's capability registry, subscription table and pending-call
 * table. Created by {@link BridgeRuntime#open}, torn down with {@link #dispose()}.
 */
public class HostBridge implements AutoCloseable {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(HostBridge.class);
    
    private final ContentSurface surface;
    private final BridgeLifecycle lifecycle;
    private final CapabilityRegistry registry;
    private final SubscriptionManager subscriptions;
    private final PendingCallRegistry pendingCalls;
    private final CallDispatcher dispatcher;
    private final WireCodec codec;
    private final ScriptFacade facade;
    private final ConsoleForwarder console;
    
    HostBridge(ContentSurface surface,
               BridgeConfig config,
               CapabilityRegistry registry,
               PermissionGate permissions,
               ScheduledExecutorService scheduler) {
        this.surface = surface;
        this.lifecycle = new BridgeLifecycle(surface.id());
        this.registry = registry;
        this.subscriptions = new SubscriptionManager();
        this.codec = new WireCodec(config.maxPayloadBytes());
        this.facade = new ScriptFacade(config.facadeNamespace());
        this.console = new ConsoleForwarder(surface.id());
        
        OutboundChannel outbound = new SurfaceChannel();
        this.pendingCalls = new PendingCallRegistry(scheduler, config.callTimeout(), outbound);
        InvocationContext context = new InvocationContext(surface.id(), registry.getPlatform(), permissions, subscriptions);
        this.dispatcher = new CallDispatcher(registry, ArgumentSanitizer.fromConfig(config), pendingCalls,
            context, outbound, lifecycle, scheduler);
    }
    
    /**
     * Connects to the surface and installs the facade into its current content.
     */
    public void attach() {
        lifecycle.advanceTo(BridgePhase.ACTIVE);
        surface.setListener(new ContentSurface.Listener() {
            @Override
            public void onMessage(String message) {
                receive(message);
            }
            
            @Override
            public void onContentReloaded() {
                HostBridge.this.onContentReloaded();
            }
        });
        surface.injectScript(facade.render());
        LOGGER.info("Bridge attached to surface {} ({} capabilities)", surface.id(), registry.size());
    }
    
    /**
     * Handles one raw message posted by the content.
     */
    public void receive(String message) {
        InboundMessage decoded;
        try {
            decoded = codec.decode(message);
        } catch (WireFormatException e) {
            rejectMalformed(e);
            return;
        }
        
        if (decoded instanceof InboundMessage.Call call) {
            dispatch(call.request());
        } else if (decoded instanceof InboundMessage.Console record) {
            console.forward(record);
        }
    }
    
    /**
     * Dispatches a call; the result is also posted to the surface.
     */
    public CompletableFuture<CallResult> dispatch(CallRequest request) {
        return dispatcher.dispatch(request);
    }
    
    /**
     * The content navigated or reloaded: its facade, pending promises and
     * listeners are gone, so every subscription is cancelled, every outstanding
     * call fails, and the facade is installed into the new content.
     */
    public void onContentReloaded() {
        if (lifecycle.isTornDown()) {
            return;
        }
        int cancelled = subscriptions.cancelAll();
        int failed = pendingCalls.failAll(ErrorKind.BRIDGE_DISPOSED, "Content was reloaded");
        surface.injectScript(facade.render());
        LOGGER.info("Surface {} reloaded: cancelled {} subscriptions, failed {} calls", surface.id(), cancelled, failed);
    }
    
    /**
     * Tears the bridge down. Idempotent.
     *
     * Once this returns no subscription is active and no further event is
     * delivered; outstanding calls have failed with BridgeDisposed.
     */
    public void dispose() {
        if (!lifecycle.beginDisposal()) {
            return;
        }
        int cancelled = subscriptions.disposeAll();
        int failed = pendingCalls.failAll(ErrorKind.BRIDGE_DISPOSED, "Bridge was disposed");
        lifecycle.advanceTo(BridgePhase.DISPOSED);
        LOGGER.info("Bridge for surface {} disposed: cancelled {} subscriptions, failed {} calls",
            surface.id(), cancelled, failed);
    }
    
    @Override
    public void close() {
        dispose();
    }
    
    private void rejectMalformed(WireFormatException e) {
        if (!e.hasCorrelationId()) {
            LOGGER.warn("Dropping malformed message from surface {}: {}", surface.id(), e.getMessage());
            return;
        }
        String id = e.getCorrelationId();
        if (pendingCalls.register(id, "<malformed>").isEmpty()) {
            LOGGER.warn("Dropping malformed message reusing outstanding id {} from surface {}", id, surface.id());
            return;
        }
        LOGGER.warn("Rejecting malformed call {} from surface {}: {}", id, surface.id(), e.getMessage());
        pendingCalls.complete(CallResult.failure(id, ErrorKind.INVALID_ARGUMENTS, e.getMessage()));
    }
    
    public String getSurfaceId() {
        return surface.id();
    }
    
    public BridgePhase getPhase() {
        return lifecycle.getCurrentPhase();
    }
    
    public CapabilityRegistry getRegistry() {
        return registry;
    }
    
    public SubscriptionManager getSubscriptions() {
        return subscriptions;
    }
    
    public int getPendingCallCount() {
        return pendingCalls.getPendingCount();
    }
    
    private class SurfaceChannel implements OutboundChannel {
        
        @Override
        public void deliverResult(CallResult result) {
            surface.postMessage(codec.encodeResult(result));
        }
        
        @Override
        public void deliverEvent(SubscriptionEvent event) {
            try {
                surface.postMessage(codec.encodeEvent(event));
            } catch (RuntimeException e) {
                LOGGER.error("Failed to deliver event of subscription {} to surface {}",
                    event.subscriptionId(), surface.id(), e);
            }
        }
    }
}
