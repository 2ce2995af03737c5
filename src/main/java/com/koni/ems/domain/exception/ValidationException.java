package com.koni.ems.domain.exception;

/**
 * Exception thrown when an incoming payload or parameter does not meet business rules.
 * Malformed readings, unknown measurement fields and out-of-range query parameters end up here.
 */
public class ValidationException extends RuntimeException {
    
    public ValidationException(String message) {
        super(message);
    }
    
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
