package com.hostbridge.subscription;

import com.hostbridge.rpc.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * A long-lived watch owned by one bridge instance.
 * 
 * Deliveries and cancellation share a lock: once {@link #cancel()} returns,
 * no event reaches the callback, even if the source was mid-delivery.
 */
public final class Subscription {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(Subscription.class);
    private static final Cancellation CANCELLED = Cancellation.none();
    
    private final long id;
    private final String capability;
    private final AtomicBoolean active = new AtomicBoolean(true);
    private final AtomicReference<Cancellation> cancellation = new AtomicReference<>();
    private final Object deliveryLock = new Object();
    
    Subscription(long id, String capability) {
        this.id = id;
        this.capability = capability;
    }
    
    public long getId() {
        return id;
    }
    
    public String getCapability() {
        return capability;
    }
    
    public boolean isActive() {
        return active.get();
    }
    
    /**
     * Builds the sink handed to the event source. Events are tagged with this
     * subscription's id and only reach the callback while it is active.
     */
    EventSink gate(Consumer<SubscriptionEvent> target) {
        return new EventSink() {
            @Override
            public void emit(Object payload) {
                deliver(SubscriptionEvent.of(id, payload));
            }
            
            @Override
            public void fail(ErrorKind kind, String message) {
                deliver(SubscriptionEvent.error(id, kind, message));
            }
            
            private void deliver(SubscriptionEvent event) {
                synchronized (deliveryLock) {
                    if (active.get()) {
                        target.accept(event);
                    }
                }
            }
        };
    }
    
    /**
     * Hands over the source's cancellation thunk.
     * If the subscription was cancelled while the source was opening, the source is stopped right away.
     */
    void bind(Cancellation sourceCancellation) {
        if (!cancellation.compareAndSet(null, sourceCancellation)) {
            runQuietly(sourceCancellation);
        }
    }
    
    /**
     * Deactivates the subscription and stops its source.
     * 
     * @return true if this call did the cancelling, false if it was already inactive
     */
    boolean cancel() {
        if (!active.compareAndSet(true, false)) {
            return false;
        }
        
        // Wait out a delivery that passed the active check before we flipped it
        synchronized (deliveryLock) {
            LOGGER.trace("Subscription {} deactivated", id);
        }
        
        Cancellation sourceCancellation = cancellation.getAndSet(CANCELLED);
        if (sourceCancellation != null) {
            runQuietly(sourceCancellation);
        }
        return true;
    }
    
    private void runQuietly(Cancellation sourceCancellation) {
        try {
            sourceCancellation.cancel();
        } catch (Exception e) {
            LOGGER.error("Source cancellation failed for subscription {} ({})", id, capability, e);
        }
    }
    
    @Override
    public String toString() {
        return "Subscription{id=" + id + ", capability='" + capability + "', active=" + active.get() + '}';
    }
}
