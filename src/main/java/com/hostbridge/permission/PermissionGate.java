package com.hostbridge.permission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide permission state machine shared by every bridge instance.
 * 
 * All state mutations run on a single gate thread, which is what makes
 * prompt coalescing work: while a prompt for a kind is in flight, every other
 * request for that kind joins it instead of opening a second OS dialog.
 * Reads of the cached state are lock-free.
 */
public class PermissionGate implements AutoCloseable {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(PermissionGate.class);
    
    private final PermissionProvider provider;
    private final ExecutorService writer;
    
    // Written on the gate thread only
    private final Map<PermissionKind, PermissionState> states = new ConcurrentHashMap<>();
    
    // Touched on the gate thread only
    private final Map<PermissionKind, CompletableFuture<PermissionState>> inFlight = new EnumMap<>(PermissionKind.class);
    
    public PermissionGate(PermissionProvider provider) {
        this.provider = provider;
        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "hostbridge-permission-gate");
            thread.setDaemon(true);
            return thread;
        });
        for (PermissionKind kind : PermissionKind.values()) {
            states.put(kind, PermissionState.NOT_DETERMINED);
        }
    }
    
    /**
     * Reads the cached state. Never blocks and never prompts.
     */
    public PermissionState check(PermissionKind kind) {
        return states.get(kind);
    }
    
    /**
     * Prompts the user for a permission.
     * Concurrent requests for the same kind share one OS prompt.
     * 
     * @return future completed with the state after the prompt
     */
    public CompletableFuture<PermissionState> request(PermissionKind kind) {
        return CompletableFuture.supplyAsync(() -> promptOrJoin(kind), writer)
            .thenCompose(prompt -> prompt);
    }
    
    /**
     * Resolves the state a gated call runs under.
     * 
     * Polls the OS for external revocation first; GRANTED, DENIED and RESTRICTED
     * resolve immediately, NOT_DETERMINED goes through {@link #request}.
     */
    public CompletableFuture<PermissionState> ensure(PermissionKind kind) {
        return CompletableFuture.supplyAsync(() -> {
            PermissionState current = poll(kind);
            if (current == PermissionState.NOT_DETERMINED) {
                return promptOrJoin(kind);
            }
            return CompletableFuture.completedFuture(current);
        }, writer).thenCompose(state -> state);
    }
    
    /**
     * Reads the OS status and applies it to the cache.
     * Runs on the gate thread.
     */
    private PermissionState poll(PermissionKind kind) {
        PermissionState polled;
        try {
            polled = provider.currentState(kind);
        } catch (Exception e) {
            LOGGER.warn("Permission status poll failed for {}, keeping cached state", kind.id(), e);
            return states.get(kind);
        }
        if (polled != null) {
            apply(kind, polled, PermissionState.Source.POLL);
        }
        return states.get(kind);
    }
    
    /**
     * Runs on the gate thread.
     */
    private CompletableFuture<PermissionState> promptOrJoin(PermissionKind kind) {
        CompletableFuture<PermissionState> existing = inFlight.get(kind);
        if (existing != null) {
            LOGGER.debug("Joining in-flight {} permission prompt", kind.id());
            return existing;
        }
        
        CompletableFuture<PermissionState> shared = new CompletableFuture<>();
        inFlight.put(kind, shared);
        LOGGER.info("Prompting for {} permission", kind.id());
        
        CompletableFuture<PermissionState> prompt;
        try {
            prompt = provider.prompt(kind);
        } catch (RuntimeException e) {
            prompt = CompletableFuture.failedFuture(e);
        }
        if (prompt == null) {
            prompt = CompletableFuture.failedFuture(
                new IllegalStateException("Permission provider returned no prompt for " + kind.id()));
        }
        
        prompt.whenCompleteAsync((answer, error) -> {
            inFlight.remove(kind);
            if (error != null) {
                LOGGER.warn("Permission prompt for {} failed", kind.id(), error);
                shared.completeExceptionally(error);
                return;
            }
            PermissionState resolved = answer != null ? answer : PermissionState.NOT_DETERMINED;
            apply(kind, resolved, PermissionState.Source.PROMPT);
            LOGGER.info("Permission {} resolved to {}", kind.id(), resolved);
            shared.complete(resolved);
        }, writer);
        
        return shared;
    }
    
    /**
     * Runs on the gate thread.
     */
    private void apply(PermissionKind kind, PermissionState next, PermissionState.Source source) {
        PermissionState current = states.get(kind);
        if (current == next) {
            return;
        }
        if (!current.canTransitionTo(next, source)) {
            LOGGER.debug("Ignoring {} transition {} -> {} for {}", source, current, next, kind.id());
            return;
        }
        states.put(kind, next);
        if (current == PermissionState.GRANTED) {
            LOGGER.info("Permission {} revoked by the OS: {}", kind.id(), next);
        } else {
            LOGGER.debug("Permission {} changed {} -> {}", kind.id(), current, next);
        }
    }
    
    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(1, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
