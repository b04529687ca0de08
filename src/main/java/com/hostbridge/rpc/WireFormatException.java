package com.hostbridge.rpc;

/**
 * Exception thrown when an inbound message cannot be decoded.
 */
public class WireFormatException extends Exception {
    
    private final String correlationId;
    
    public WireFormatException(String message, String correlationId) {
        super(message);
        this.correlationId = correlationId;
    }
    
    public WireFormatException(String message, String correlationId, Throwable cause) {
        super(message, cause);
        this.correlationId = correlationId;
    }
    
    /**
     * The correlation id recovered from the broken message, or null when none could be read.
     */
    public String getCorrelationId() {
        return correlationId;
    }
    
    public boolean hasCorrelationId() {
        return correlationId != null;
    }
    
    @Override
    public String toString() {
        return "WireFormatException{" +
               "correlationId='" + correlationId + '\'' +
               ", message='" + getMessage() + '\'' +
               '}';
    }
}
