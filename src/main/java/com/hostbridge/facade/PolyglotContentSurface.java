package com.hostbridge.facade;

import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.graalvm.polyglot.proxy.ProxyObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Headless content surface backed by a sandboxed GraalVM JavaScript context.
 *
 * The context is confined to one thread; every evaluation and every outbound
 * message is queued onto it. Content gets no host access, IO, threads or
 * environment, only the transport object.
 */
public class PolyglotContentSurface implements ContentSurface, AutoCloseable {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(PolyglotContentSurface.class);
    
    private final String id;
    private final ExecutorService contextThread;
    private volatile Listener listener;
    
    // touched only on the context thread
    private Context context;
    private Map<String, Object> transport;
    
    public PolyglotContentSurface(String id) {
        this.id = id;
        this.contextThread = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "hostbridge-surface-" + id);
            thread.setDaemon(true);
            return thread;
        });
        submit(this::openContext).join();
    }
    
    @Override
    public String id() {
        return id;
    }
    
    @Override
    public void setListener(Listener listener) {
        this.listener = listener;
    }
    
    @Override
    public void injectScript(String script) {
        evaluate(script).exceptionally(error -> {
            LOGGER.error("Failed to inject script into surface {}", id, error);
            return null;
        });
    }
    
    @Override
    public void postMessage(String message) {
        submit(() -> {
            Object receiver = transport.get("receive");
            if (!(receiver instanceof Value receive) || !receive.canExecute()) {
                LOGGER.debug("Surface {} has no facade receiver, dropping message", id);
                return null;
            }
            try {
                receive.executeVoid(message);
            } catch (PolyglotException e) {
                LOGGER.warn("Content of surface {} failed to handle a message: {}", id, e.getMessage());
            }
            return null;
        }).exceptionally(error -> {
            LOGGER.debug("Message to surface {} not delivered: {}", id, error.getMessage());
            return null;
        });
    }
    
    /**
     * Evaluates content script.
     *
     * @return the completion value rendered as text, or null for null and undefined
     */
    public CompletableFuture<String> evaluate(String source) {
        return submit(() -> {
            Value value = context.eval("js", source);
            return value.isNull() ? null : value.toString();
        });
    }
    
    /**
     * Discards the current content and starts with a fresh context, as a navigation would.
     */
    public CompletableFuture<Void> reload() {
        return submit(() -> {
            closeContext();
            openContext();
            return null;
        }).thenRun(() -> {
            Listener current = listener;
            if (current != null) {
                current.onContentReloaded();
            }
        });
    }
    
    private Void openContext() {
        context = Context.newBuilder("js")
            .allowHostAccess(HostAccess.NONE)
            .allowHostClassLookup(className -> false)
            .allowIO(false)
            .allowCreateThread(false)
            .allowNativeAccess(false)
            .allowEnvironmentAccess(EnvironmentAccess.NONE)
            .option("engine.WarnInterpreterOnly", "false")
            .build();
        
        transport = new HashMap<>();
        transport.put("post", (ProxyExecutable) args -> {
            if (args.length == 1 && args[0].isString()) {
                Listener current = listener;
                if (current != null) {
                    current.onMessage(args[0].asString());
                }
            }
            return null;
        });
        context.getBindings("js").putMember(ScriptFacade.TRANSPORT_BINDING, ProxyObject.fromMap(transport));
        LOGGER.debug("Opened script context for surface {}", id);
        return null;
    }
    
    private void closeContext() {
        if (context != null) {
            context.close(true);
            context = null;
            transport = null;
        }
    }
    
    private <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            contextThread.execute(() -> {
                try {
                    result.complete(task.call());
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("Surface " + id + " is closed", e));
        }
        return result;
    }
    
    @Override
    public void close() {
        submit(() -> {
            closeContext();
            return null;
        }).exceptionally(error -> {
            LOGGER.warn("Failed to close script context of surface {}", id, error);
            return null;
        });
        contextThread.shutdown();
        try {
            if (!contextThread.awaitTermination(5, TimeUnit.SECONDS)) {
                contextThread.shutdownNow();
            }
        } catch (InterruptedException e) {
            contextThread.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.debug("Closed surface {}", id);
    }
}
