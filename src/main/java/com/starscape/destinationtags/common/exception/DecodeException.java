package com.starscape.destinationtags.common.exception;

/**
 * Raised when an external code or record cannot be decoded into the engine's types,
 * e.g. an unknown language or category code in an imported tag document.
 */
public class DecodeException extends RuntimeException {
    
    private final String field;
    private final String value;
    
    public DecodeException(String field, String value) {
        this(field, value, "Unknown " + field + " code: " + value);
    }
    
    public DecodeException(String field, String value, String message) {
        super(message);
        this.field = field;
        this.value = value;
    }
    
    public DecodeException(String field, String value, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
        this.value = value;
    }
    
    public String getField() {
        return field;
    }
    
    public String getValue() {
        return value;
    }
}
