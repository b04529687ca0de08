package com.hostbridge.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads {@link BridgeConfig} from JSON sources.
 * 
 * Values are validated against {@link BridgeConfig#SCHEMA}; missing keys take
 * their defaults and unrecognised keys are logged and ignored.
 */
public class ConfigService {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    /**
     * Loads configuration from a file. A missing file yields the defaults.
     * 
     * @param configFile path to a JSON object
     * @return the validated configuration
     * @throws ConfigLoadException if the file exists but cannot be read or parsed
     * @throws ConfigValidationException if a value violates the schema
     */
    public BridgeConfig load(Path configFile) throws ConfigLoadException, ConfigValidationException {
        if (!Files.exists(configFile)) {
            LOGGER.debug("No bridge config at {}, using defaults", configFile);
            return fromValues(new HashMap<>());
        }
        
        try {
            JsonNode root = MAPPER.readTree(Files.readString(configFile));
            BridgeConfig config = fromValues(readObject(root, configFile.toString()));
            LOGGER.info("Loaded bridge config from {}", configFile);
            return config;
        } catch (IOException e) {
            throw new ConfigLoadException(
                String.format("Failed to load bridge config from '%s'", configFile), e
            );
        }
    }
    
    /**
     * Loads configuration from a classpath resource. A missing resource yields the defaults.
     */
    public BridgeConfig loadResource(String resourceName) throws ConfigLoadException, ConfigValidationException {
        try (InputStream in = ConfigService.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                LOGGER.debug("No bridge config resource {}, using defaults", resourceName);
                return fromValues(new HashMap<>());
            }
            return fromValues(readObject(MAPPER.readTree(in), resourceName));
        } catch (IOException e) {
            throw new ConfigLoadException(
                String.format("Failed to load bridge config resource '%s'", resourceName), e
            );
        }
    }
    
    /**
     * Validates raw values and builds the configuration.
     * 
     * @param values raw key/value pairs; the map is not modified
     */
    public BridgeConfig fromValues(Map<String, Object> values) throws ConfigValidationException {
        Map<String, Object> config = new HashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (BridgeConfig.SCHEMA.isKnown(entry.getKey())) {
                config.put(entry.getKey(), entry.getValue());
            } else {
                LOGGER.warn("Ignoring unknown bridge config key '{}'", entry.getKey());
            }
        }
        
        BridgeConfig.SCHEMA.validate(config);
        return BridgeConfig.fromValidated(config);
    }
    
    private Map<String, Object> readObject(JsonNode root, String source) throws ConfigLoadException {
        if (root == null || !root.isObject()) {
            throw new ConfigLoadException(
                String.format("Bridge config '%s' must be a JSON object", source)
            );
        }
        
        Map<String, Object> values = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), convertScalar(field.getValue()));
        }
        return values;
    }
    
    /**
     * Converts a scalar node. Nested structures are returned unchanged so the
     * schema rejects them with a type error.
     */
    private Object convertScalar(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        } else if (node.isIntegralNumber()) {
            return node.asLong();
        } else if (node.isNumber()) {
            return node.asDouble();
        } else if (node.isBoolean()) {
            return node.asBoolean();
        } else if (node.isNull()) {
            return null;
        }
        return node;
    }
}
