package com.hostbridge.rpc;

/**
 * Exception carrying the {@link ErrorKind} a capability call failed with.
 */
public class BridgeException extends Exception {
    
    private final ErrorKind kind;
    
    public BridgeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
    
    public BridgeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
    
    public ErrorKind getKind() {
        return kind;
    }
    
    @Override
    public String toString() {
        return "BridgeException{" +
               "kind=" + kind.wireName() +
               ", message='" + getMessage() + '\'' +
               '}';
    }
}
