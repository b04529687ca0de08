package com.hostbridge.facade;

import com.hostbridge.rpc.InboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Writes console records of content to the host log.
 */
public class ConsoleForwarder {
    
    static final String CONTENT_LOGGER = "hostbridge.content";
    
    private static final int MAX_RECORD_LENGTH = 4096;
    
    private final Logger logger;
    private final String surfaceId;
    
    public ConsoleForwarder(String surfaceId) {
        this(LoggerFactory.getLogger(CONTENT_LOGGER), surfaceId);
    }
    
    ConsoleForwarder(Logger logger, String surfaceId) {
        this.logger = logger;
        this.surfaceId = surfaceId;
    }
    
    public void forward(InboundMessage.Console record) {
        String text = String.join(" ", record.args());
        if (text.length() > MAX_RECORD_LENGTH) {
            text = text.substring(0, MAX_RECORD_LENGTH) + "...";
        }
        
        switch (record.level().toLowerCase(Locale.ROOT)) {
            case "error" -> logger.error("[{}] {}", surfaceId, text);
            case "warn" -> logger.warn("[{}] {}", surfaceId, text);
            case "debug" -> logger.debug("[{}] {}", surfaceId, text);
            case "trace" -> logger.trace("[{}] {}", surfaceId, text);
            default -> logger.info("[{}] {}", surfaceId, text);
        }
    }
}
