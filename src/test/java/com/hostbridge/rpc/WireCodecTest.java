package com.hostbridge.rpc;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.hostbridge.subscription.SubscriptionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WireCodecTest {
    
    private WireCodec codec;
    
    @BeforeEach
    void setUp() {
        codec = new WireCodec(1024);
    }
    
    private static JsonObject parse(String json) {
        return JsonParser.parseString(json).getAsJsonObject();
    }
    
    @Test
    void testDecodeCall() throws WireFormatException {
        InboundMessage message = codec.decode(
            "{\"protocol\":1,\"type\":\"call\",\"id\":\"7\",\"capability\":\"vibrate\",\"args\":{\"pattern\":[100,50],\"nested\":{\"on\":true}}}");
        
        InboundMessage.Call call = assertInstanceOf(InboundMessage.Call.class, message);
        CallRequest request = call.request();
        assertEquals("7", request.correlationId());
        assertEquals("vibrate", request.capability());
        assertEquals(List.of(100.0, 50.0), request.arguments().get("pattern"));
        assertEquals(Map.of("on", true), request.arguments().get("nested"));
    }
    
    @Test
    void testDecodeCallWithoutArgs() throws WireFormatException {
        InboundMessage.Call call = (InboundMessage.Call) codec.decode(
            "{\"protocol\":1,\"type\":\"call\",\"id\":\"a\",\"capability\":\"battery.get\"}");
        
        assertTrue(call.request().arguments().isEmpty());
    }
    
    @Test
    void testDecodeConsole() throws WireFormatException {
        InboundMessage message = codec.decode(
            "{\"protocol\":1,\"type\":\"console\",\"level\":\"error\",\"args\":[\"boom\",3,{\"a\":1}]}");
        
        InboundMessage.Console console = assertInstanceOf(InboundMessage.Console.class, message);
        assertEquals("error", console.level());
        assertEquals(List.of("boom", "3", "{\"a\":1}"), console.args());
    }
    
    @Test
    @DisplayName("A broken call keeps its correlation id so it can be answered")
    void testMalformedCallKeepsId() {
        WireFormatException noCapability = assertThrows(WireFormatException.class,
            () -> codec.decode("{\"protocol\":1,\"type\":\"call\",\"id\":\"9\"}"));
        assertEquals("9", noCapability.getCorrelationId());
        
        WireFormatException badArgs = assertThrows(WireFormatException.class,
            () -> codec.decode("{\"protocol\":1,\"type\":\"call\",\"id\":\"10\",\"capability\":\"share\",\"args\":[1]}"));
        assertEquals("10", badArgs.getCorrelationId());
        
        WireFormatException unknownType = assertThrows(WireFormatException.class,
            () -> codec.decode("{\"protocol\":1,\"type\":\"ping\",\"id\":\"11\"}"));
        assertEquals("11", unknownType.getCorrelationId());
    }
    
    @Test
    void testProtocolMismatch() {
        WireFormatException e = assertThrows(WireFormatException.class,
            () -> codec.decode("{\"protocol\":2,\"type\":\"call\",\"id\":\"1\",\"capability\":\"share\"}"));
        assertEquals("1", e.getCorrelationId());
        
        assertThrows(WireFormatException.class,
            () -> codec.decode("{\"type\":\"call\",\"id\":\"1\",\"capability\":\"share\"}"));
    }
    
    @Test
    void testUnreadableMessagesHaveNoId() {
        assertFalse(assertThrows(WireFormatException.class, () -> codec.decode("{not json")).hasCorrelationId());
        assertFalse(assertThrows(WireFormatException.class, () -> codec.decode("[1,2]")).hasCorrelationId());
        assertFalse(assertThrows(WireFormatException.class, () -> codec.decode(null)).hasCorrelationId());
        assertFalse(assertThrows(WireFormatException.class,
            () -> codec.decode("{\"protocol\":1,\"type\":\"call\",\"id\":5,\"capability\":\"share\"}")).hasCorrelationId());
    }
    
    @Test
    void testOversizedMessageIsRejected() {
        String text = "x".repeat(2000);
        WireFormatException e = assertThrows(WireFormatException.class, () -> codec.decode(
            "{\"protocol\":1,\"type\":\"call\",\"id\":\"1\",\"capability\":\"clipboard.write\",\"args\":{\"text\":\"" + text + "\"}}"));
        
        assertFalse(e.hasCorrelationId());
        assertTrue(e.getMessage().contains("exceeds"));
    }
    
    @Test
    void testSizeLimitCountsUtf8Bytes() {
        WireCodec small = new WireCodec(80);
        String emoji = "😀".repeat(10);
        
        assertThrows(WireFormatException.class, () -> small.decode(
            "{\"protocol\":1,\"type\":\"console\",\"level\":\"log\",\"args\":[\"" + emoji + "\"]}"));
    }
    
    @Test
    void testEncodeSuccess() {
        Map<String, Object> battery = new LinkedHashMap<>();
        battery.put("level", 0.5);
        battery.put("chargingTime", null);
        
        JsonObject encoded = parse(codec.encodeResult(CallResult.success("3", battery)));
        
        assertEquals(1, encoded.get("protocol").getAsInt());
        assertEquals("result", encoded.get("type").getAsString());
        assertEquals("3", encoded.get("id").getAsString());
        assertTrue(encoded.get("success").getAsBoolean());
        assertTrue(encoded.getAsJsonObject("result").get("chargingTime").isJsonNull());
        assertFalse(encoded.has("error"));
    }
    
    @Test
    void testEncodeNullSuccessValue() {
        JsonObject encoded = parse(codec.encodeResult(CallResult.success("4", null)));
        
        assertTrue(encoded.has("result"));
        assertTrue(encoded.get("result").isJsonNull());
    }
    
    @Test
    void testEncodeFailure() {
        JsonObject encoded = parse(codec.encodeResult(
            CallResult.failure("5", ErrorKind.PERMISSION_DENIED, "location permission is denied")));
        
        assertFalse(encoded.get("success").getAsBoolean());
        assertFalse(encoded.has("result"));
        JsonObject error = encoded.getAsJsonObject("error");
        assertEquals("PermissionDenied", error.get("kind").getAsString());
        assertEquals("location permission is denied", error.get("message").getAsString());
    }
    
    @Test
    void testEncodeEvents() {
        JsonObject payload = parse(codec.encodeEvent(SubscriptionEvent.of(12L, Map.of("timestamp", 5L))));
        assertEquals("event", payload.get("type").getAsString());
        assertEquals(12L, payload.get("subscription").getAsLong());
        assertEquals(5L, payload.getAsJsonObject("payload").get("timestamp").getAsLong());
        
        JsonObject error = parse(codec.encodeEvent(SubscriptionEvent.error(12L, ErrorKind.OPERATION_FAILED, "lost fix")));
        assertFalse(error.has("payload"));
        assertEquals("OperationFailed", error.getAsJsonObject("error").get("kind").getAsString());
    }
    
    @Test
    void testTextIsNotHtmlEscaped() {
        String encoded = codec.encodeResult(CallResult.success("6", "<b>&</b>"));
        
        assertTrue(encoded.contains("<b>&</b>"));
    }
    
    @Test
    @DisplayName("A result holding NaN is answered as OperationFailed under the same id")
    void testNonFiniteResultBecomesFailure() {
        Map<String, Object> coords = new LinkedHashMap<>();
        coords.put("heading", Double.NaN);
        
        JsonObject payload = parse(codec.encodeResult(CallResult.success("8", Map.of("coords", coords))));
        
        assertEquals("8", payload.get("id").getAsString());
        assertFalse(payload.get("success").getAsBoolean());
        assertFalse(payload.has("result"));
        assertEquals("OperationFailed", payload.getAsJsonObject("error").get("kind").getAsString());
    }
    
    @Test
    void testNonFiniteEventBecomesErrorEvent() {
        JsonObject payload = parse(codec.encodeEvent(SubscriptionEvent.of(4L, Map.of("speed", Double.POSITIVE_INFINITY))));
        
        assertEquals(4L, payload.get("subscription").getAsLong());
        assertFalse(payload.has("payload"));
        assertEquals("OperationFailed", payload.getAsJsonObject("error").get("kind").getAsString());
    }
}
