package com.koni.ems.domain.exception;

/**
 * Exception thrown when Kafka is unavailable or fails to publish a data point.
 */
public class StreamingUnavailableException extends RuntimeException {
    
    public StreamingUnavailableException(String message) {
        super(message);
    }
    
    public StreamingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
