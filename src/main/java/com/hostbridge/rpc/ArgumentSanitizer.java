package com.hostbridge.rpc;

import com.hostbridge.config.BridgeConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Argument sanitization for values arriving from script content.
 *
 * Copies the argument tree into plain Java values while enforcing the depth,
 * string-length and collection-size limits from {@link BridgeConfig}.
 * Failures name the offending path, e.g. {@code args.pattern[3]}.
 *
 * Number Type Policy:
 * - numbers are normalized to Double and must be finite
 * - capability handlers narrow to int/long where they need to
 */
public class ArgumentSanitizer {
    
    private static final String ROOT = "args";
    
    private final int maxDepth;
    private final int maxStringLength;
    private final int maxCollectionSize;
    
    public ArgumentSanitizer(int maxDepth, int maxStringLength, int maxCollectionSize) {
        this.maxDepth = maxDepth;
        this.maxStringLength = maxStringLength;
        this.maxCollectionSize = maxCollectionSize;
    }
    
    public static ArgumentSanitizer fromConfig(BridgeConfig config) {
        return new ArgumentSanitizer(config.maxArgumentDepth(), config.maxStringLength(), config.maxCollectionSize());
    }
    
    /**
     * Sanitizes a call's argument object.
     *
     * @param arguments raw arguments, null is treated as empty
     * @return a new insertion-ordered map holding only sanitized values
     * @throws InvalidArgumentsException if a limit is exceeded or a value type is not allowed
     */
    public Map<String, Object> sanitizeArguments(Map<String, ?> arguments) throws InvalidArgumentsException {
        if (arguments == null) {
            return new LinkedHashMap<>();
        }
        return copyMap(arguments, ROOT, 0);
    }
    
    public Object sanitize(Object value) throws InvalidArgumentsException {
        return copy(value, ROOT, 0);
    }
    
    private Object copy(Object value, String path, int depth) throws InvalidArgumentsException {
        if (depth > maxDepth) {
            throw new InvalidArgumentsException(path + " is nested deeper than " + maxDepth);
        }
        
        if (value == null || value instanceof Boolean) {
            return value;
        }
        if (value instanceof String text) {
            if (text.length() > maxStringLength) {
                throw new InvalidArgumentsException(path + " is longer than " + maxStringLength + " characters");
            }
            return text;
        }
        if (value instanceof Number number) {
            double normalized = number.doubleValue();
            if (!Double.isFinite(normalized)) {
                throw new InvalidArgumentsException(path + " is not a finite number");
            }
            return normalized;
        }
        if (value instanceof Map<?, ?> map) {
            return copyMap(map, path, depth);
        }
        if (value instanceof List<?> list) {
            return copyList(list, path, depth);
        }
        
        throw new InvalidArgumentsException(path + " has unsupported type " + value.getClass().getSimpleName());
    }
    
    private Map<String, Object> copyMap(Map<?, ?> map, String path, int depth) throws InvalidArgumentsException {
        requireSize(map.size(), path);
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new InvalidArgumentsException(path + " has a non-string key: " + entry.getKey());
            }
            result.put(key, copy(entry.getValue(), path + "." + key, depth + 1));
        }
        return result;
    }
    
    private List<Object> copyList(List<?> list, String path, int depth) throws InvalidArgumentsException {
        requireSize(list.size(), path);
        List<Object> result = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            result.add(copy(list.get(i), path + "[" + i + "]", depth + 1));
        }
        return result;
    }
    
    private void requireSize(int size, String path) throws InvalidArgumentsException {
        if (size > maxCollectionSize) {
            throw new InvalidArgumentsException(path + " has " + size + " entries, limit is " + maxCollectionSize);
        }
    }
}
