package com.hostbridge.capability;

import java.util.List;

/**
 * Types an argument field can take after sanitization.
 */
public enum ArgumentType {
    STRING,
    NUMBER,
    BOOLEAN,
    /** A number or a list of numbers, as in navigator.vibrate(). */
    NUMBER_OR_NUMBER_LIST;
    
    public boolean isValid(Object value) {
        if (value == null) {
            return false;
        }
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case NUMBER_OR_NUMBER_LIST -> value instanceof Number
                || (value instanceof List<?> list && list.stream().allMatch(element -> element instanceof Number));
        };
    }
}
