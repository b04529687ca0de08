package com.hostbridge.rpc;

/**
 * Exception thrown when call arguments fail sanitization or schema validation.
 */
public class InvalidArgumentsException extends BridgeException {
    
    public InvalidArgumentsException(String message) {
        super(ErrorKind.INVALID_ARGUMENTS, message);
    }
    
    public InvalidArgumentsException(String message, Throwable cause) {
        super(ErrorKind.INVALID_ARGUMENTS, message, cause);
    }
}
