package com.hostbridge.facade;

/**
 * The embedded rendering surface whose content talks to a bridge.
 *
 * A surface exposes a transport object under {@link ScriptFacade#TRANSPORT_BINDING}
 * to its content: a {@code post(string)} function that hands messages to the
 * {@link Listener}. The injected facade stores its {@code receive(string)}
 * function on the same object; {@link #postMessage} calls it.
 */
public interface ContentSurface {
    
    /**
     * Stable identifier of the surface, used for logging and bridge lookup.
     */
    String id();
    
    /**
     * Evaluates a script in the current content, before or alongside the content's own scripts.
     */
    void injectScript(String script);
    
    /**
     * Delivers one outbound protocol message to the content.
     */
    void postMessage(String message);
    
    /**
     * Registers the receiver of the surface's events. Replaces any previous listener.
     */
    void setListener(Listener listener);
    
    /**
     * Events raised by a surface.
     */
    interface Listener {
        
        /**
         * A protocol message posted by the content.
         */
        void onMessage(String message);
        
        /**
         * The surface navigated or reloaded; the previous content and its facade are gone.
         */
        void onContentReloaded();
    }
}
