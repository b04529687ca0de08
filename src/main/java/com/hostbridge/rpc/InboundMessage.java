package com.hostbridge.rpc;

import java.util.List;

/**
 * A decoded script to bridge message.
 */
public interface InboundMessage {
    
    /**
     * A capability call.
     */
    record Call(CallRequest request) implements InboundMessage {}
    
    /**
     * A console record forwarded from the content.
     */
    record Console(String level, List<String> args) implements InboundMessage {
        public Console {
            args = List.copyOf(args);
        }
    }
}
