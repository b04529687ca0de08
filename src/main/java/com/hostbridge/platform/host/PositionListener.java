package com.hostbridge.platform.host;

import com.hostbridge.platform.model.Position;

/**
 * Callbacks of a continuous location watch.
 */
public interface PositionListener {
    
    void onPosition(Position position);
    
    /**
     * A failed fix. The watch keeps running.
     */
    void onError(Throwable error);
}
