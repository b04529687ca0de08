package com.hostbridge.capability;

import com.hostbridge.rpc.InvalidArgumentsException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Argument shape of a capability.
 * 
 * Validation runs on sanitized arguments, before the permission gate.
 * Keys the schema does not name are ignored.
 */
public class ArgumentSchema {
    
    public static final ArgumentSchema EMPTY = builder().build();
    
    private final Map<String, Field> fields;
    private final List<String> atLeastOneOf;
    
    private ArgumentSchema(Builder builder) {
        this.fields = Map.copyOf(builder.fields);
        this.atLeastOneOf = List.copyOf(builder.atLeastOneOf);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Validates call arguments against the schema.
     * 
     * @param arguments sanitized arguments
     * @throws InvalidArgumentsException if a field is missing, mistyped or violates its constraint
     */
    public void validate(Map<String, Object> arguments) throws InvalidArgumentsException {
        for (Map.Entry<String, Field> entry : fields.entrySet()) {
            String name = entry.getKey();
            Field field = entry.getValue();
            Object value = arguments.get(name);
            
            if (value == null) {
                if (field.required) {
                    throw new InvalidArgumentsException(String.format("Required argument '%s' is missing", name));
                }
                continue;
            }
            
            if (!field.type.isValid(value)) {
                throw new InvalidArgumentsException(String.format(
                    "Argument '%s' expected %s, got %s", name, field.type.name(), value.getClass().getSimpleName()));
            }
            
            if (field.constraint != null && !field.constraint.test(value)) {
                throw new InvalidArgumentsException(String.format("Argument '%s' %s", name, field.constraintDescription));
            }
        }
        
        if (!atLeastOneOf.isEmpty() && atLeastOneOf.stream().noneMatch(name -> isPresent(arguments.get(name)))) {
            throw new InvalidArgumentsException("At least one of " + atLeastOneOf + " must be provided");
        }
    }
    
    public Map<String, Field> getFields() {
        return fields;
    }
    
    private static boolean isPresent(Object value) {
        return value != null && !(value instanceof String text && text.isEmpty());
    }
    
    /**
     * Definition of one argument field.
     */
    public static final class Field {
        private final ArgumentType type;
        private final boolean required;
        private final Predicate<Object> constraint;
        private final String constraintDescription;
        
        Field(ArgumentType type, boolean required, Predicate<Object> constraint, String constraintDescription) {
            this.type = type;
            this.required = required;
            this.constraint = constraint;
            this.constraintDescription = constraintDescription;
        }
        
        public ArgumentType type() { return type; }
        public boolean required() { return required; }
    }
    
    public static class Builder {
        private final Map<String, Field> fields = new LinkedHashMap<>();
        private List<String> atLeastOneOf = List.of();
        
        public Builder required(String name, ArgumentType type) {
            fields.put(name, new Field(type, true, null, null));
            return this;
        }
        
        public Builder optional(String name, ArgumentType type) {
            fields.put(name, new Field(type, false, null, null));
            return this;
        }
        
        /**
         * Adds a constraint to an already declared field.
         * 
         * @param description completes "Argument 'name' ..." in the failure message
         */
        public Builder constrain(String name, Predicate<Object> constraint, String description) {
            Field field = fields.get(name);
            if (field == null) {
                throw new IllegalStateException("Field '" + name + "' must be declared before it is constrained");
            }
            fields.put(name, new Field(field.type, field.required, constraint, description));
            return this;
        }
        
        public Builder atLeastOneOf(String... names) {
            this.atLeastOneOf = List.of(names);
            return this;
        }
        
        public ArgumentSchema build() {
            return new ArgumentSchema(this);
        }
    }
}
