package com.hostbridge.platform.host;

import java.util.concurrent.CompletableFuture;

/**
 * Native share sheet.
 */
public interface ShareService {
    
    CompletableFuture<Void> share(String text, String subject);
}
