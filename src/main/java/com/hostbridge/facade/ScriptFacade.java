package com.hostbridge.facade;

import com.hostbridge.rpc.WireCodec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Renders the script injected into content to expose the capabilities.
 *
 * The script is a template resource; the namespace of the raw channel and the
 * protocol version are filled in per bridge.
 */
public class ScriptFacade {
    
    /**
     * Global name of the transport object a {@link ContentSurface} provides.
     */
    public static final String TRANSPORT_BINDING = "__hostBridgeTransport";
    
    static final String TEMPLATE_RESOURCE = "hostbridge/facade.js";
    
    private static final String TEMPLATE = loadTemplate();
    
    private final String script;
    
    public ScriptFacade(String namespace) {
        this.script = TEMPLATE
            .replace("__NAMESPACE__", namespace)
            .replace("__TRANSPORT__", TRANSPORT_BINDING)
            .replace("__PROTOCOL__", Integer.toString(WireCodec.PROTOCOL_VERSION));
    }
    
    /**
     * @return the script to pass to {@link ContentSurface#injectScript}
     */
    public String render() {
        return script;
    }
    
    private static String loadTemplate() {
        try (InputStream in = ScriptFacade.class.getClassLoader().getResourceAsStream(TEMPLATE_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Facade template not found on classpath: " + TEMPLATE_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read facade template " + TEMPLATE_RESOURCE, e);
        }
    }
}
