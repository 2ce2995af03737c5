package com.koni.ems.infrastructure.web.exception;

import com.koni.ems.domain.exception.DatabaseUnavailableException;
import com.koni.ems.domain.exception.NotFoundException;
import com.koni.ems.domain.exception.PermissionDeniedException;
import com.koni.ems.domain.exception.RelationNameCollisionException;
import com.koni.ems.domain.exception.StorageException;
import com.koni.ems.domain.exception.StorageNotReadyException;
import com.koni.ems.domain.exception.StreamingUnavailableException;
import com.koni.ems.domain.exception.ValidationException;
import com.koni.ems.infrastructure.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST API endpoints.
 * Provides consistent error responses and appropriate HTTP status codes.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle validation exceptions, including register decoding failures.
     * Returns 400 Bad Request.
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handle bean validation failures on request bodies.
     * Returns 400 Bad Request listing the violated constraints.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : error.getField())
                .sorted()
                .collect(Collectors.joining(", "));
        log.warn("Request validation error: {}", message);
        return respond(HttpStatus.BAD_REQUEST, message.isEmpty() ? "Invalid request" : message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof ValidationException) {
            return respond(HttpStatus.BAD_REQUEST, cause.getMessage());
        }
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception ex) {
        log.warn("Invalid request parameter: {}", ex.getMessage());
        String message = ex instanceof MethodArgumentTypeMismatchException
                ? "Invalid value for parameter " + ((MethodArgumentTypeMismatchException) ex).getName()
                : ex.getMessage();
        return respond(HttpStatus.BAD_REQUEST, message);
    }

    /**
     * Handle missing permissions. Returns 403 Forbidden.
     */
    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<ErrorResponse> handlePermissionDenied(PermissionDeniedException ex) {
        log.warn("Permission denied: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ex.getMessage());
    }

    /**
     * Handle unknown devices, empty relations and unknown paths. Returns 404 Not Found.
     */
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "Not found");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage());
    }

    /**
     * Handle two device identifiers competing for one relation. Returns 409 Conflict.
     */
    @ExceptionHandler(RelationNameCollisionException.class)
    public ResponseEntity<ErrorResponse> handleRelationNameCollision(RelationNameCollisionException ex) {
        log.warn("Relation name collision: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    /**
     * A concurrent registration won the unique relation name. Returns 409 Conflict.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolation(DataIntegrityViolationException ex) {
        log.warn("Registry constraint violated: {}", ex.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "Device conflicts with an existing registration");
    }

    /**
     * Handle database and streaming unavailability and the startup phase.
     * Returns 503 Service Unavailable; the request can be retried.
     */
    @ExceptionHandler({DatabaseUnavailableException.class, StreamingUnavailableException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(RuntimeException ex) {
        log.error("Dependency unavailable: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable");
    }

    @ExceptionHandler(StorageNotReadyException.class)
    public ResponseEntity<ErrorResponse> handleStorageNotReady(StorageNotReadyException ex) {
        log.debug("Request refused during startup: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorageException(StorageException ex) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Storage failure");
    }

    /**
     * Handle all other unexpected exceptions.
     * Returns 500 Internal Server Error for unhandled exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), message));
    }
}
