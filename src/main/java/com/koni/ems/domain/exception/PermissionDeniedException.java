package com.koni.ems.domain.exception;

/**
 * Exception thrown when the caller is not allowed to access a device.
 */
public class PermissionDeniedException extends RuntimeException {
    
    public PermissionDeniedException(String message) {
        super(message);
    }
    
    public PermissionDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
