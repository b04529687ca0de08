package com.hostbridge.rpc;

/**
 * Exception thrown when a one-shot capability call times out.
 */
public class BridgeTimeoutException extends BridgeException {
    
    public BridgeTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message);
    }
    
    public BridgeTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
