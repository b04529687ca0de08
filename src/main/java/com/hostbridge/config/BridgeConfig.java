package com.hostbridge.config;

import com.hostbridge.platform.Platform;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable bridge settings, read once when a runtime is created.
 *
 * @param callTimeout deadline for a single adapter invocation
 * @param maxPayloadBytes largest inbound message accepted by the wire codec
 * @param maxArgumentDepth deepest nesting of argument values
 * @param maxStringLength longest accepted string argument
 * @param maxCollectionSize largest accepted list or object argument
 * @param facadeNamespace global name under which the facade exposes its raw channel
 * @param platform explicit platform override, empty to detect at startup
 */
public record BridgeConfig(
    Duration callTimeout,
    int maxPayloadBytes,
    int maxArgumentDepth,
    int maxStringLength,
    int maxCollectionSize,
    String facadeNamespace,
    Optional<Platform> platform
) {
    
    public static final String CALL_TIMEOUT_MILLIS = "callTimeoutMillis";
    public static final String MAX_PAYLOAD_BYTES = "maxPayloadBytes";
    public static final String MAX_ARGUMENT_DEPTH = "maxArgumentDepth";
    public static final String MAX_STRING_LENGTH = "maxStringLength";
    public static final String MAX_COLLECTION_SIZE = "maxCollectionSize";
    public static final String FACADE_NAMESPACE = "facadeNamespace";
    public static final String PLATFORM = "platform";
    
    /**
     * Schema of the recognised keys. Every key except {@code platform} has a default.
     */
    public static final ConfigSchema SCHEMA = ConfigSchema.builder()
        .field(CALL_TIMEOUT_MILLIS, integer(10_000, 50, 600_000))
        .field(MAX_PAYLOAD_BYTES, integer(65_536, 1_024, 4_194_304))
        .field(MAX_ARGUMENT_DEPTH, integer(16, 1, 64))
        .field(MAX_STRING_LENGTH, integer(32_768, 1, 1_048_576))
        .field(MAX_COLLECTION_SIZE, integer(1_024, 1, 100_000))
        .field(FACADE_NAMESPACE, new ConfigSchema.FieldDefinition.Builder()
            .type(ConfigSchema.FieldType.STRING)
            .defaultValue("hostBridge")
            .pattern("[A-Za-z_$][A-Za-z0-9_$]*")
            .build())
        .field(PLATFORM, new ConfigSchema.FieldDefinition.Builder()
            .type(ConfigSchema.FieldType.STRING)
            .oneOf(Set.of("android", "ios", "macos", "windows", "linux"))
            .build())
        .build();
    
    public BridgeConfig {
        Objects.requireNonNull(callTimeout, "callTimeout");
        Objects.requireNonNull(facadeNamespace, "facadeNamespace");
        Objects.requireNonNull(platform, "platform");
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
    }
    
    /**
     * Returns the configuration used when no source supplies any values.
     */
    public static BridgeConfig defaults() {
        return new BridgeConfig(Duration.ofMillis(10_000), 65_536, 16, 32_768, 1_024, "hostBridge", Optional.empty());
    }
    
    /**
     * Builds a config from values that already passed {@link #SCHEMA} validation.
     */
    static BridgeConfig fromValidated(Map<String, Object> values) {
        Object platformId = values.get(PLATFORM);
        return new BridgeConfig(
            Duration.ofMillis(((Number) values.get(CALL_TIMEOUT_MILLIS)).longValue()),
            ((Number) values.get(MAX_PAYLOAD_BYTES)).intValue(),
            ((Number) values.get(MAX_ARGUMENT_DEPTH)).intValue(),
            ((Number) values.get(MAX_STRING_LENGTH)).intValue(),
            ((Number) values.get(MAX_COLLECTION_SIZE)).intValue(),
            (String) values.get(FACADE_NAMESPACE),
            platformId == null ? Optional.empty() : Platform.fromId((String) platformId)
        );
    }
    
    /**
     * Returns the configured platform, or the detected one when none is set.
     */
    public Platform resolvePlatform() {
        return platform.orElseGet(Platform::detect);
    }
    
    public BridgeConfig withCallTimeout(Duration timeout) {
        return new BridgeConfig(timeout, maxPayloadBytes, maxArgumentDepth, maxStringLength,
            maxCollectionSize, facadeNamespace, platform);
    }
    
    public BridgeConfig withPlatform(Platform override) {
        return new BridgeConfig(callTimeout, maxPayloadBytes, maxArgumentDepth, maxStringLength,
            maxCollectionSize, facadeNamespace, Optional.of(override));
    }
    
    private static ConfigSchema.FieldDefinition integer(int defaultValue, int min, int max) {
        return new ConfigSchema.FieldDefinition.Builder()
            .type(ConfigSchema.FieldType.INTEGER)
            .defaultValue(defaultValue)
            .range(min, max)
            .build();
    }
}
