package com.hostbridge.rpc;

import java.util.Map;

/**
 * One inbound capability invocation from script content.
 * 
 * Consumed exactly once by {@link CallDispatcher}.
 */
public record CallRequest(
    String correlationId,
    String capability,
    Map<String, Object> arguments
) {
    public CallRequest {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("Correlation id cannot be null or empty");
        }
        if (capability == null) {
            throw new IllegalArgumentException("Capability name cannot be null");
        }
        arguments = arguments == null ? Map.of() : arguments;
    }
}
