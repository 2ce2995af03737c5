package com.koni.ems.domain.exception;

/**
 * Exception thrown when the database is unavailable or the connection pool is exhausted.
 * This exception indicates that the persistence layer is temporarily unavailable,
 * and the operation may be retried by the client.
 */
public class DatabaseUnavailableException extends RuntimeException {
    
    public DatabaseUnavailableException(String message) {
        super(message);
    }
    
    public DatabaseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
