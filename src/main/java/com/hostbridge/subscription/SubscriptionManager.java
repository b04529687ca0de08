package com.hostbridge.subscription;

import com.hostbridge.rpc.BridgeException;
import com.hostbridge.rpc.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Table of the outstanding watches of one bridge instance.
 * Tracks subscriptions by id, supports idempotent cancellation and
 * guarantees cleanup on bridge teardown.
 */
public class SubscriptionManager {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionManager.class);
    
    private final Map<Long, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    
    /**
     * Starts a subscription.
     * 
     * @param capability the capability name the watch belongs to
     * @param source opens the underlying event source
     * @param callback receives the subscription's events, tagged with its id, until it is cancelled
     * @return the subscription id
     * @throws BridgeException with {@code BridgeDisposed} after {@link #disposeAll()}, or the
     *         source's own failure if it cannot be opened
     */
    public long start(String capability, WatchSource source, Consumer<SubscriptionEvent> callback) throws BridgeException {
        long id = nextId.getAndIncrement();
        Subscription subscription = new Subscription(id, capability);
        subscriptions.put(id, subscription);
        
        // Published before the check: either disposeAll() sweeps this entry or we see the flag
        if (disposed.get()) {
            discard(id, subscription);
            throw new BridgeException(ErrorKind.BRIDGE_DISPOSED, "Subscriptions are disposed");
        }
        
        Cancellation sourceCancellation;
        try {
            sourceCancellation = source.open(subscription.gate(callback));
        } catch (BridgeException e) {
            discard(id, subscription);
            throw e;
        } catch (RuntimeException e) {
            discard(id, subscription);
            throw new BridgeException(ErrorKind.OPERATION_FAILED, "Failed to start " + capability + ": " + e.getMessage(), e);
        }
        subscription.bind(sourceCancellation != null ? sourceCancellation : Cancellation.none());
        
        // disposeAll() may have swept the table while the source was opening
        if (disposed.get()) {
            cancel(id);
            throw new BridgeException(ErrorKind.BRIDGE_DISPOSED, "Subscriptions are disposed");
        }
        
        LOGGER.debug("Started subscription {} for {}", id, capability);
        return id;
    }
    
    /**
     * Cancels a subscription. Unknown and already-cancelled ids are a no-op.
     * 
     * @return true if an active subscription was cancelled by this call
     */
    public boolean cancel(long id) {
        Subscription subscription = subscriptions.remove(id);
        if (subscription == null) {
            LOGGER.debug("Cancel ignored for unknown or finished subscription: {}", id);
            return false;
        }
        
        boolean cancelled = subscription.cancel();
        if (cancelled) {
            LOGGER.debug("Cancelled subscription {} ({})", id, subscription.getCapability());
        }
        return cancelled;
    }
    
    /**
     * Cancels every active subscription but keeps accepting new ones.
     * Used when the content surface navigates.
     * 
     * @return number of subscriptions cancelled
     */
    public int cancelAll() {
        int cancelled = 0;
        for (Long id : List.copyOf(subscriptions.keySet())) {
            if (cancel(id)) {
                cancelled++;
            }
        }
        return cancelled;
    }
    
    /**
     * Cancels every active subscription and refuses new ones.
     * Safe while sources are mid-delivery; returns once no callback can fire anymore.
     * 
     * @return number of subscriptions cancelled
     */
    public int disposeAll() {
        if (!disposed.compareAndSet(false, true)) {
            LOGGER.debug("Subscription table already disposed");
            return 0;
        }
        
        int cancelled = cancelAll();
        LOGGER.debug("Disposed subscription table, {} subscriptions cancelled", cancelled);
        return cancelled;
    }
    
    public boolean isActive(long id) {
        Subscription subscription = subscriptions.get(id);
        return subscription != null && subscription.isActive();
    }
    
    public int getActiveCount() {
        return subscriptions.size();
    }
    
    public boolean isDisposed() {
        return disposed.get();
    }
    
    private void discard(long id, Subscription subscription) {
        subscriptions.remove(id);
        subscription.cancel();
    }
}
