package com.hostbridge.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Configuration schema definition.
 * 
 * Declares the expected keys with their types, defaults and constraints.
 */
public class ConfigSchema {
    
    private final Map<String, FieldDefinition> fields;
    
    private ConfigSchema(Map<String, FieldDefinition> fields) {
        this.fields = Map.copyOf(fields);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Validates configuration values and fills in defaults.
     * 
     * @param config the values read from the source; missing keys receive their default
     * @throws ConfigValidationException if validation fails
     */
    public void validate(Map<String, Object> config) throws ConfigValidationException {
        for (Map.Entry<String, FieldDefinition> entry : fields.entrySet()) {
            String fieldName = entry.getKey();
            FieldDefinition fieldDef = entry.getValue();
            
            Object value = config.get(fieldName);
            
            if (value == null) {
                if (fieldDef.defaultValue() != null) {
                    config.put(fieldName, fieldDef.defaultValue());
                } else if (fieldDef.required()) {
                    throw new ConfigValidationException(
                        String.format("Required field '%s' is missing", fieldName)
                    );
                }
                continue;
            }
            
            fieldDef.validate(fieldName, value);
        }
    }
    
    public boolean isKnown(String fieldName) {
        return fields.containsKey(fieldName);
    }
    
    public Map<String, FieldDefinition> getFields() {
        return fields;
    }
    
    /**
     * Definition of a configuration field.
     */
    public static class FieldDefinition {
        private final FieldType type;
        private final boolean required;
        private final Object defaultValue;
        private final Number minValue;
        private final Number maxValue;
        private final String pattern;
        private final Set<String> allowedValues;
        
        private FieldDefinition(Builder builder) {
            this.type = builder.type;
            this.required = builder.required;
            this.defaultValue = builder.defaultValue;
            this.minValue = builder.minValue;
            this.maxValue = builder.maxValue;
            this.pattern = builder.pattern;
            this.allowedValues = builder.allowedValues;
        }
        
        public void validate(String fieldName, Object value) throws ConfigValidationException {
            if (!type.isValid(value)) {
                throw new ConfigValidationException(
                    String.format("Field '%s' expected %s, got %s",
                        fieldName, type.name(), value.getClass().getSimpleName())
                );
            }
            
            if (value instanceof Number number) {
                double numValue = number.doubleValue();
                if (minValue != null && numValue < minValue.doubleValue()) {
                    throw new ConfigValidationException(
                        String.format("Field '%s' value %s is below minimum %s", fieldName, value, minValue)
                    );
                }
                if (maxValue != null && numValue > maxValue.doubleValue()) {
                    throw new ConfigValidationException(
                        String.format("Field '%s' value %s is above maximum %s", fieldName, value, maxValue)
                    );
                }
            }
            
            if (value instanceof String text) {
                if (pattern != null && !text.matches(pattern)) {
                    throw new ConfigValidationException(
                        String.format("Field '%s' value '%s' does not match pattern '%s'", fieldName, text, pattern)
                    );
                }
                if (allowedValues != null && !allowedValues.contains(text)) {
                    throw new ConfigValidationException(
                        String.format("Field '%s' value '%s' is not one of %s", fieldName, text, allowedValues)
                    );
                }
            }
        }
        
        public FieldType type() { return type; }
        public boolean required() { return required; }
        public Object defaultValue() { return defaultValue; }
        
        public static class Builder {
            private FieldType type;
            private boolean required = false;
            private Object defaultValue;
            private Number minValue;
            private Number maxValue;
            private String pattern;
            private Set<String> allowedValues;
            
            public Builder type(FieldType type) {
                this.type = type;
                return this;
            }
            
            public Builder required(boolean required) {
                this.required = required;
                return this;
            }
            
            public Builder defaultValue(Object defaultValue) {
                this.defaultValue = defaultValue;
                return this;
            }
            
            public Builder range(Number minValue, Number maxValue) {
                this.minValue = minValue;
                this.maxValue = maxValue;
                return this;
            }
            
            public Builder pattern(String pattern) {
                this.pattern = pattern;
                return this;
            }
            
            public Builder oneOf(Set<String> allowedValues) {
                this.allowedValues = Set.copyOf(allowedValues);
                return this;
            }
            
            public FieldDefinition build() {
                if (type == null) {
                    throw new IllegalStateException("Field type is required");
                }
                return new FieldDefinition(this);
            }
        }
    }
    
    public static class Builder {
        private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        
        public Builder field(String name, FieldDefinition definition) {
            fields.put(name, definition);
            return this;
        }
        
        public ConfigSchema build() {
            return new ConfigSchema(fields);
        }
    }
    
    /**
     * Supported field types.
     */
    public enum FieldType {
        STRING,
        INTEGER,
        BOOLEAN;
        
        public boolean isValid(Object value) {
            if (value == null) return false;
            return switch (this) {
                case STRING -> value instanceof String;
                case INTEGER -> value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue());
                case BOOLEAN -> value instanceof Boolean;
            };
        }
    }
}
