package com.hostbridge.platform.model;

import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Content handed to the native share sheet.
 */
public record ShareRequest(String title, String text, String url) {
    
    /**
     * Non-empty parts joined by newlines, title first.
     */
    public String shareText() {
        return Stream.of(title, text, url)
            .filter(Objects::nonNull)
            .filter(part -> !part.isEmpty())
            .collect(Collectors.joining("\n"));
    }
    
    public boolean isEmpty() {
        return shareText().isEmpty();
    }
}
