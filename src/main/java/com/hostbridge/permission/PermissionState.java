package com.hostbridge.permission;

/**
 * Cached OS permission state.
 * 
 * NOT_DETERMINED is only ever the initial state. DENIED turns into GRANTED
 * only through an explicit prompt; GRANTED can be revoked by the OS at any time.
 */
public enum PermissionState {
    NOT_DETERMINED,
    GRANTED,
    DENIED,
    RESTRICTED;
    
    /**
     * Where the new state was observed.
     */
    public enum Source {
        /** Outcome of an OS permission prompt. */
        PROMPT,
        /** Status read from the OS before a gated call. */
        POLL
    }
    
    /**
     * Checks whether moving from this state to {@code next} is a legal transition.
     */
    public boolean canTransitionTo(PermissionState next, Source source) {
        if (next == this) {
            return true;
        }
        return switch (this) {
            case NOT_DETERMINED -> next != NOT_DETERMINED;
            case GRANTED -> next == DENIED || next == RESTRICTED;
            case DENIED -> next == GRANTED && source == Source.PROMPT;
            case RESTRICTED -> next == GRANTED || next == DENIED;
        };
    }
    
    /**
     * The value script content sees, following the web Notification API.
     */
    public String webValue() {
        return switch (this) {
            case NOT_DETERMINED -> "default";
            case GRANTED -> "granted";
            case DENIED, RESTRICTED -> "denied";
        };
    }
}
