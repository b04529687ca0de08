package com.hostbridge.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Registry of outstanding calls of one bridge instance.
 * Handles timeouts and guarantees exactly one delivery per correlation id.
 * 
 * A call is removed from the table before its result is delivered, so
 * whichever of the real result and the timeout gets there first wins and
 * the other is dropped.
 */
public class PendingCallRegistry {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(PendingCallRegistry.class);
    
    private final Map<String, PendingCall> pending = new ConcurrentHashMap<>();
    private final ScheduledExecutorService timeoutExecutor;
    private final Duration timeout;
    private final OutboundChannel outbound;
    
    public PendingCallRegistry(ScheduledExecutorService timeoutExecutor, Duration timeout, OutboundChannel outbound) {
        this.timeoutExecutor = timeoutExecutor;
        this.timeout = timeout;
        this.outbound = outbound;
    }
    
    /**
     * Registers an outstanding call.
     * 
     * @return the future completed with the delivered result, or empty if the
     *         correlation id is already outstanding
     */
    public Optional<CompletableFuture<CallResult>> register(String id, String capability) {
        PendingCall call = new PendingCall(capability, new CompletableFuture<>());
        PendingCall existing = pending.putIfAbsent(id, call);
        if (existing != null) {
            LOGGER.warn("Correlation id {} is already outstanding for {}", id, existing.capability);
            return Optional.empty();
        }
        
        LOGGER.debug("Registered pending call: {} ({})", id, capability);
        return Optional.of(call.future);
    }
    
    /**
     * Starts the timeout clock of an outstanding call.
     * Called once the adapter is about to be invoked.
     */
    public void armTimeout(String id) {
        PendingCall call = pending.get(id);
        if (call == null) {
            return;
        }
        
        call.timeoutTask = timeoutExecutor.schedule(() -> {
            String message = "Call to " + call.capability + " timed out after " + timeout.toMillis() + " ms";
            if (complete(CallResult.failure(id, new BridgeTimeoutException(message)))) {
                LOGGER.debug("Call timed out: {}", id);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
    
    /**
     * Delivers the result of an outstanding call.
     * 
     * @return true if delivered, false if the call already had its result
     */
    public boolean complete(CallResult result) {
        PendingCall call = pending.remove(result.correlationId());
        if (call == null) {
            LOGGER.debug("Discarding result for call that is no longer outstanding: {}", result.correlationId());
            return false;
        }
        
        if (call.timeoutTask != null) {
            call.timeoutTask.cancel(false);
        }
        
        call.future.complete(deliver(result));
        return true;
    }
    
    /**
     * Posts a result. A success that cannot be posted is replaced by an
     * OperationFailed result for the same id, so the caller still hears back.
     * 
     * @return the result that was posted (or attempted last)
     */
    private CallResult deliver(CallResult result) {
        try {
            outbound.deliverResult(result);
            return result;
        } catch (RuntimeException e) {
            LOGGER.error("Failed to deliver result for call: {}", result.correlationId(), e);
            if (!result.success()) {
                return result;
            }
        }
        
        CallResult fallback = CallResult.failure(result.correlationId(), ErrorKind.OPERATION_FAILED,
            "Result could not be delivered");
        try {
            outbound.deliverResult(fallback);
        } catch (RuntimeException e) {
            LOGGER.error("Failed to deliver fallback result for call: {}", result.correlationId(), e);
        }
        return fallback;
    }
    
    /**
     * Fails every outstanding call with the given kind (navigation or teardown).
     * 
     * @return number of calls failed
     */
    public int failAll(ErrorKind kind, String message) {
        int failed = 0;
        for (String id : List.copyOf(pending.keySet())) {
            if (complete(CallResult.failure(id, kind, message))) {
                failed++;
            }
        }
        return failed;
    }
    
    public boolean isPending(String id) {
        return pending.containsKey(id);
    }
    
    public int getPendingCount() {
        return pending.size();
    }
    
    private static class PendingCall {
        final String capability;
        final CompletableFuture<CallResult> future;
        volatile ScheduledFuture<?> timeoutTask;
        
        PendingCall(String capability, CompletableFuture<CallResult> future) {
            this.capability = capability;
            this.future = future;
        }
    }
}
