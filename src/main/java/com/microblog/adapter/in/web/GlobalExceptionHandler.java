package com.microblog.adapter.in.web;

import com.microblog.infrastructure.context.RequestContext;
import com.microblog.infrastructure.exception.UserNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions that escape the controllers to the JSON error body.
 * Business outcomes never get here; controllers translate their {@code Result} failures directly.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> onInvalidBody(MethodArgumentNotValidException ex) {
        FieldError first = ex.getBindingResult().getFieldError();
        String detail = first == null ? "Validation failed" : first.getField() + ": " + first.getDefaultMessage();
        log.warn("Request body rejected: {}", detail);
        return body(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, detail);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> onUnreadable(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, "Malformed request");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> onIllegalArgument(IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, ex.getMessage());
    }

    @ExceptionHandler(UserNotFoundException.class)
    public ResponseEntity<ErrorResponse> onUnknownUsername(UserNotFoundException ex) {
        log.warn("Lookup by username failed: {}", ex.getUsername());
        return body(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage());
    }

    /**
     * A unique constraint caught a write that raced past the pre-checks,
     * such as two users renaming themselves to the same username at once.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> onConstraint(DataIntegrityViolationException ex) {
        log.warn("Write rejected by constraint: {}", ex.getMostSpecificCause().getMessage());
        return body(HttpStatus.CONFLICT, "CONFLICT", "The request conflicts with existing data");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> onStorageFailure(DataAccessException ex) {
        log.error("Storage call failed", ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_UNAVAILABLE", "Storage is temporarily unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> onUnexpected(Exception ex) {
        log.error("Unhandled exception", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, RequestContext.getRequestId()));
    }
}
