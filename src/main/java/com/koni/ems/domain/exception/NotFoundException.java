package com.koni.ems.domain.exception;

/**
 * Exception thrown when a device, its storage relation or the requested data is absent.
 */
public class NotFoundException extends RuntimeException {
    
    public NotFoundException(String message) {
        super(message);
    }
    
    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
