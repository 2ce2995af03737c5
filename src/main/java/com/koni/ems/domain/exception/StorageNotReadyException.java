package com.koni.ems.domain.exception;

/**
 * Exception thrown when a request arrives before storage initialization has completed.
 */
public class StorageNotReadyException extends RuntimeException {
    
    public StorageNotReadyException(String message) {
        super(message);
    }
    
    public StorageNotReadyException(String message, Throwable cause) {
        super(message, cause);
    }
}
