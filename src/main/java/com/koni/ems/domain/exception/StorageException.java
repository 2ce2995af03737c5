package com.koni.ems.domain.exception;

/**
 * Exception thrown when a DDL or DML statement fails for a reason that is not
 * a validation problem, a missing object or a connectivity problem.
 * It is not retried by this service; retry policy belongs to the caller.
 */
public class StorageException extends RuntimeException {
    
    public StorageException(String message) {
        super(message);
    }
    
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
