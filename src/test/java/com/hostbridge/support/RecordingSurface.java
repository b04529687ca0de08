package com.hostbridge.support;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.hostbridge.facade.ContentSurface;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Content surface that records injected scripts and posted messages.
 * Tests play the content side by calling {@link #send}.
 */
public class RecordingSurface implements ContentSurface {
    
    private final String id;
    public final List<String> injectedScripts = new CopyOnWriteArrayList<>();
    public final List<String> posted = new CopyOnWriteArrayList<>();
    private volatile Listener listener;
    
    public RecordingSurface(String id) {
        this.id = id;
    }
    
    @Override
    public String id() {
        return id;
    }
    
    @Override
    public void injectScript(String script) {
        injectedScripts.add(script);
    }
    
    @Override
    public void postMessage(String message) {
        posted.add(message);
    }
    
    @Override
    public void setListener(Listener listener) {
        this.listener = listener;
    }
    
    public void send(String message) {
        listener.onMessage(message);
    }
    
    public void call(String id, String capability, String argsJson) {
        send("{\"protocol\":1,\"type\":\"call\",\"id\":\"" + id + "\",\"capability\":\"" + capability
            + "\",\"args\":" + argsJson + "}");
    }
    
    public void reload() {
        listener.onContentReloaded();
    }
    
    public List<JsonObject> messages(String type) {
        return posted.stream()
            .map(message -> JsonParser.parseString(message).getAsJsonObject())
            .filter(message -> type.equals(message.get("type").getAsString()))
            .collect(Collectors.toList());
    }
    
    /**
     * The result posted for a correlation id, or null if none was posted yet.
     */
    public JsonObject result(String correlationId) {
        List<JsonObject> results = results(correlationId);
        return results.isEmpty() ? null : results.get(0);
    }
    
    public List<JsonObject> results(String correlationId) {
        return messages("result").stream()
            .filter(message -> correlationId.equals(message.get("id").getAsString()))
            .collect(Collectors.toList());
    }
}
