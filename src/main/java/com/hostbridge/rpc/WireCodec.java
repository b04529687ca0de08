package com.hostbridge.rpc;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.hostbridge.subscription.SubscriptionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of the bridge protocol.
 *
 * Every message is an object carrying {@code protocol} and {@code type}.
 * Inbound types are {@code call} and {@code console}; outbound types are
 * {@code result} and {@code event}.
 */
public class WireCodec {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(WireCodec.class);
    
    public static final int PROTOCOL_VERSION = 1;
    
    private static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
    
    private final int maxPayloadBytes;
    
    public WireCodec(int maxPayloadBytes) {
        this.maxPayloadBytes = maxPayloadBytes;
    }
    
    /**
     * Decodes an inbound message.
     *
     * @throws WireFormatException if the message is oversized, malformed or of an
     *         unsupported protocol version; carries the correlation id when one could be read
     */
    public InboundMessage decode(String json) throws WireFormatException {
        if (json == null) {
            throw new WireFormatException("Message is null", null);
        }
        int size = json.getBytes(StandardCharsets.UTF_8).length;
        if (size > maxPayloadBytes) {
            throw new WireFormatException("Message of " + size + " bytes exceeds limit of " + maxPayloadBytes, null);
        }
        
        JsonObject data;
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject()) {
                throw new WireFormatException("Message is not a JSON object", null);
            }
            data = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new WireFormatException("Invalid JSON: " + e.getMessage(), null, e);
        }
        
        String id = optionalString(data, "id");
        
        JsonElement protocol = data.get("protocol");
        if (protocol == null || !isNumber(protocol) || protocol.getAsDouble() != PROTOCOL_VERSION) {
            throw new WireFormatException("Unsupported protocol version: " + protocol, id);
        }
        
        String type = optionalString(data, "type");
        if (type == null) {
            throw new WireFormatException("Message has no type", id);
        }
        
        return switch (type) {
            case "call" -> decodeCall(data, id);
            case "console" -> decodeConsole(data);
            default -> throw new WireFormatException("Unknown message type: " + type, id);
        };
    }
    
    private InboundMessage decodeCall(JsonObject data, String id) throws WireFormatException {
        if (id == null || id.isBlank()) {
            throw new WireFormatException("Call has no correlation id", null);
        }
        String capability = optionalString(data, "capability");
        if (capability == null) {
            throw new WireFormatException("Call has no capability name", id);
        }
        
        JsonElement args = data.get("args");
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (args != null && !args.isJsonNull()) {
            if (!args.isJsonObject()) {
                throw new WireFormatException("Call arguments must be an object", id);
            }
            for (Map.Entry<String, JsonElement> entry : args.getAsJsonObject().entrySet()) {
                arguments.put(entry.getKey(), toJava(entry.getValue()));
            }
        }
        return new InboundMessage.Call(new CallRequest(id, capability, arguments));
    }
    
    private InboundMessage decodeConsole(JsonObject data) throws WireFormatException {
        String level = optionalString(data, "level");
        if (level == null) {
            throw new WireFormatException("Console record has no level", null);
        }
        
        List<String> args = new ArrayList<>();
        JsonElement raw = data.get("args");
        if (raw != null && raw.isJsonArray()) {
            for (JsonElement element : raw.getAsJsonArray()) {
                if (element.isJsonPrimitive()) {
                    args.add(element.getAsString());
                } else {
                    args.add(GSON.toJson(element));
                }
            }
        }
        return new InboundMessage.Console(level, args);
    }
    
    /**
     * Encodes the single result of a call.
     * A value JSON cannot carry (NaN, Infinity) is encoded as an OperationFailed result instead.
     */
    public String encodeResult(CallResult result) {
        JsonObject response = new JsonObject();
        response.addProperty("protocol", PROTOCOL_VERSION);
        response.addProperty("type", "result");
        response.addProperty("id", result.correlationId());
        
        if (result.success()) {
            try {
                JsonElement value = GSON.toJsonTree(result.value());
                response.addProperty("success", true);
                response.add("result", value);
                return GSON.toJson(response);
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Result of call {} is not encodable: {}", result.correlationId(), e.getMessage());
                response.addProperty("success", false);
                response.add("error", error(ErrorKind.OPERATION_FAILED, "Result is not encodable as JSON"));
                return GSON.toJson(response);
            }
        }
        
        response.addProperty("success", false);
        response.add("error", error(result.errorKind(), result.message()));
        return GSON.toJson(response);
    }
    
    /**
     * Encodes one event of a subscription.
     * A payload JSON cannot carry is encoded as an OperationFailed error event instead.
     */
    public String encodeEvent(SubscriptionEvent event) {
        JsonObject message = new JsonObject();
        message.addProperty("protocol", PROTOCOL_VERSION);
        message.addProperty("type", "event");
        message.addProperty("subscription", event.subscriptionId());
        
        if (event.isError()) {
            message.add("error", error(event.errorKind(), event.message()));
            return GSON.toJson(message);
        }
        
        try {
            message.add("payload", GSON.toJsonTree(event.payload()));
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Event of subscription {} is not encodable: {}", event.subscriptionId(), e.getMessage());
            message.add("error", error(ErrorKind.OPERATION_FAILED, "Event payload is not encodable as JSON"));
        }
        return GSON.toJson(message);
    }
    
    private static JsonObject error(ErrorKind kind, String message) {
        JsonObject error = new JsonObject();
        error.addProperty("kind", kind.wireName());
        error.addProperty("message", message);
        return error;
    }
    
    /**
     * Converts a JSON tree into plain Java values: numbers become {@code Double},
     * arrays {@code List}, objects insertion-ordered {@code Map}.
     */
    static Object toJava(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                return primitive.getAsBoolean();
            }
            if (primitive.isNumber()) {
                return primitive.getAsDouble();
            }
            return primitive.getAsString();
        }
        if (element.isJsonArray()) {
            JsonArray array = element.getAsJsonArray();
            List<Object> list = new ArrayList<>(array.size());
            for (JsonElement item : array) {
                list.add(toJava(item));
            }
            return list;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
            map.put(entry.getKey(), toJava(entry.getValue()));
        }
        return map;
    }
    
    private static String optionalString(JsonObject data, String key) {
        JsonElement value = data.get(key);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            return null;
        }
        return value.getAsString();
    }
    
    private static boolean isNumber(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber();
    }
}
