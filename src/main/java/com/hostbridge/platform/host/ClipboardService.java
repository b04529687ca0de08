package com.hostbridge.platform.host;

import java.util.concurrent.CompletableFuture;

/**
 * System clipboard, plain text only.
 */
public interface ClipboardService {
    
    CompletableFuture<Void> setText(String text);
    
    /**
     * @return future completed with the clipboard text, or null when it holds no text
     */
    CompletableFuture<String> getText();
}
