package com.hostbridge.rpc;

import com.hostbridge.capability.CapabilityContract;
import com.hostbridge.capability.CapabilityRegistry;
import com.hostbridge.capability.InvocationContext;
import com.hostbridge.capability.RegisteredCapability;
import com.hostbridge.lifecycle.BridgeLifecycle;
import com.hostbridge.permission.PermissionKind;
import com.hostbridge.permission.PermissionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Routes capability calls of one bridge instance.
 *
 * Checks run in a fixed order: bridge state, capability lookup, argument
 * validation, permission, platform availability. Only then is the handler
 * invoked, under the call timeout. Whatever happens, each accepted call
 * produces exactly one {@link CallResult} on the outbound channel.
 */
public class CallDispatcher {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(CallDispatcher.class);
    
    private final CapabilityRegistry registry;
    private final ArgumentSanitizer sanitizer;
    private final PendingCallRegistry pendingCalls;
    private final InvocationContext context;
    private final OutboundChannel outbound;
    private final BridgeLifecycle lifecycle;
    private final Executor continuations;
    
    /**
     * @param continuations runs the part of a call that follows a permission
     *        prompt, so handlers never execute on the permission gate's thread
     */
    public CallDispatcher(CapabilityRegistry registry,
                          ArgumentSanitizer sanitizer,
                          PendingCallRegistry pendingCalls,
                          InvocationContext context,
                          OutboundChannel outbound,
                          BridgeLifecycle lifecycle,
                          Executor continuations) {
        this.registry = registry;
        this.sanitizer = sanitizer;
        this.pendingCalls = pendingCalls;
        this.context = context;
        this.outbound = outbound;
        this.lifecycle = lifecycle;
        this.continuations = continuations;
    }
    
    /**
     * Dispatches a call.
     *
     * The returned future completes with the same result that is pushed to the
     * outbound channel. A request reusing an outstanding correlation id is
     * rejected locally and nothing is delivered for it, so the original call
     * keeps its single result.
     */
    public CompletableFuture<CallResult> dispatch(CallRequest request) {
        String id = request.correlationId();
        Optional<CompletableFuture<CallResult>> registered = pendingCalls.register(id, request.capability());
        if (registered.isEmpty()) {
            return CompletableFuture.completedFuture(CallResult.failure(id, ErrorKind.INVALID_ARGUMENTS,
                "Correlation id " + id + " is already outstanding"));
        }
        
        try {
            admit(request);
        } catch (BridgeException e) {
            fail(id, request.capability(), e);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error dispatching {} ({})", request.capability(), id, e);
            fail(id, request.capability(), e);
        }
        return registered.get();
    }
    
    /**
     * Runs the checks that need no suspension, then the permission step.
     */
    private void admit(CallRequest request) throws BridgeException {
        if (lifecycle.isTornDown()) {
            throw new BridgeException(ErrorKind.BRIDGE_DISPOSED, "Bridge for surface " + lifecycle.getSurfaceId() + " is disposed");
        }
        
        RegisteredCapability capability = registry.resolve(request.capability());
        Map<String, Object> arguments = sanitizer.sanitizeArguments(request.arguments());
        capability.contract().arguments().validate(arguments);
        
        Optional<PermissionKind> permission = capability.contract().permission();
        if (permission.isEmpty()) {
            perform(request.correlationId(), capability, arguments);
            return;
        }
        
        PermissionKind kind = permission.get();
        context.permissions().ensure(kind).whenCompleteAsync((state, error) -> {
            if (error != null) {
                fail(request.correlationId(), capability.name(), error);
            } else if (state != PermissionState.GRANTED) {
                fail(request.correlationId(), capability.name(), new BridgeException(ErrorKind.PERMISSION_DENIED,
                    "Permission '" + kind.id() + "' is " + describe(state)));
            } else {
                try {
                    perform(request.correlationId(), capability, arguments);
                } catch (BridgeException e) {
                    fail(request.correlationId(), capability.name(), e);
                } catch (RuntimeException e) {
                    LOGGER.error("Unexpected error performing {} ({})", capability.name(), request.correlationId(), e);
                    fail(request.correlationId(), capability.name(), e);
                }
            }
        }, continuations);
    }
    
    private void perform(String id, RegisteredCapability capability, Map<String, Object> arguments) throws BridgeException {
        if (!pendingCalls.isPending(id)) {
            // failed by teardown or navigation while the permission prompt was open
            return;
        }
        if (lifecycle.isTornDown()) {
            throw new BridgeException(ErrorKind.BRIDGE_DISPOSED, "Bridge for surface " + lifecycle.getSurfaceId() + " is disposed");
        }
        
        CapabilityContract contract = capability.contract();
        if (!capability.available()) {
            throw new BridgeException(ErrorKind.CAPABILITY_UNAVAILABLE,
                contract.name() + " is not available on " + context.platform().id());
        }
        
        if (capability.isWatch()) {
            startWatch(id, capability, arguments);
            return;
        }
        
        pendingCalls.armTimeout(id);
        LOGGER.debug("Invoking {} ({})", contract.name(), id);
        CompletableFuture<?> operation = capability.handler().invoke(context, arguments);
        if (operation == null) {
            throw new BridgeException(ErrorKind.OPERATION_FAILED, contract.name() + " returned no result");
        }
        operation.whenComplete((value, error) -> {
            if (error != null) {
                fail(id, contract.name(), error);
            } else if (!pendingCalls.complete(CallResult.success(id, value))) {
                LOGGER.debug("Late completion of {} ({}) discarded", contract.name(), id);
            }
        });
    }
    
    private void startWatch(String id, RegisteredCapability capability, Map<String, Object> arguments) throws BridgeException {
        long subscriptionId = context.subscriptions().start(capability.name(),
            sink -> capability.watchHandler().subscribe(context, arguments, sink),
            outbound::deliverEvent);
        
        if (!pendingCalls.complete(CallResult.success(id, subscriptionId))) {
            // the call was failed while the source was opening; nobody will learn the id
            context.subscriptions().cancel(subscriptionId);
        }
    }
    
    private void fail(String id, String capability, Throwable error) {
        CallResult failure = toFailure(id, error);
        if (failure.errorKind() == ErrorKind.OPERATION_FAILED) {
            LOGGER.warn("Call to {} ({}) failed: {}", capability, id, failure.message());
        } else {
            LOGGER.debug("Call to {} ({}) rejected: {} {}", capability, id, failure.errorKind().wireName(), failure.message());
        }
        pendingCalls.complete(failure);
    }
    
    /**
     * Maps any throwable raised by a check or a handler onto the error taxonomy.
     */
    static CallResult toFailure(String id, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof BridgeException bridgeException) {
            return CallResult.failure(id, bridgeException);
        }
        if (cause instanceof TimeoutException) {
            return CallResult.failure(id, ErrorKind.TIMEOUT, "Operation timed out");
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return CallResult.failure(id, ErrorKind.OPERATION_FAILED, message);
    }
    
    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
    
    private static String describe(PermissionState state) {
        return switch (state) {
            case DENIED -> "denied";
            case RESTRICTED -> "restricted by the system";
            case NOT_DETERMINED -> "not granted (prompt dismissed)";
            case GRANTED -> "granted";
        };
    }
}
