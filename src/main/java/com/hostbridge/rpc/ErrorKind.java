package com.hostbridge.rpc;

/**
 * Failure taxonomy shared by every capability call.
 * 
 * The wire name is what script content sees as {@code error.kind}.
 */
public enum ErrorKind {
    UNKNOWN_CAPABILITY("UnknownCapability"),
    INVALID_ARGUMENTS("InvalidArguments"),
    PERMISSION_DENIED("PermissionDenied"),
    /** The platform lacks the feature. Not worth retrying. */
    CAPABILITY_UNAVAILABLE("CapabilityUnavailable"),
    OPERATION_FAILED("OperationFailed"),
    TIMEOUT("Timeout"),
    BRIDGE_DISPOSED("BridgeDisposed");
    
    private final String wireName;
    
    ErrorKind(String wireName) {
        this.wireName = wireName;
    }
    
    public String wireName() {
        return wireName;
    }
}
