package com.koni.ems.domain.exception;

/**
 * Exception thrown when raw register words cannot be decoded into a value of the requested type,
 * e.g. when the number of words does not match the data type.
 * It is a validation failure from the caller's point of view.
 */
public class DecodeException extends ValidationException {
    
    public DecodeException(String message) {
        super(message);
    }
    
    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
