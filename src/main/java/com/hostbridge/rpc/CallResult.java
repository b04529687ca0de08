package com.hostbridge.rpc;

/**
 * Outcome of a {@link CallRequest}, correlated by id.
 * 
 * Either a success carrying a value (possibly null) or a failure carrying an
 * {@link ErrorKind} and a message.
 */
public record CallResult(
    String correlationId,
    boolean success,
    Object value,
    ErrorKind errorKind,
    String message
) {
    
    public static CallResult success(String correlationId, Object value) {
        return new CallResult(correlationId, true, value, null, null);
    }
    
    public static CallResult failure(String correlationId, ErrorKind kind, String message) {
        return new CallResult(correlationId, false, null, kind, message);
    }
    
    public static CallResult failure(String correlationId, BridgeException error) {
        return failure(correlationId, error.getKind(), error.getMessage());
    }
    
    public boolean isFailure(ErrorKind kind) {
        return !success && errorKind == kind;
    }
}
