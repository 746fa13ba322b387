package com.floorplan.positioning.controller;

import com.floorplan.positioning.exception.CalibrationRejectedException;
import com.floorplan.positioning.exception.CalibrationRequiredException;
import com.floorplan.positioning.exception.PlanNotLoadedException;
import com.floorplan.positioning.exception.PlanPersistenceException;
import com.floorplan.positioning.exception.SavedPlanNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the plan positioning API.
 * Provides consistent error responses and logging.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String TIMESTAMP = "timestamp";
    private static final String STATUS = "status";
    private static final String ERROR = "error";
    private static final String MESSAGE = "message";

    /**
     * Handles validation errors from @Valid annotations.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            fieldErrors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> errorResponse = errorBody(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed");
        errorResponse.put("fieldErrors", fieldErrors);

        log.warn("Validation error: {}", fieldErrors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    /**
     * Handles constraint violations on query parameters.
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<Map<String, Object>> handleParameterValidation(HandlerMethodValidationException ex) {
        Map<String, String> parameterErrors = new HashMap<>();
        ex.getAllValidationResults().forEach(result -> parameterErrors.put(
            result.getMethodParameter().getParameterName(),
            result.getResolvableErrors().get(0).getDefaultMessage()));

        Map<String, Object> errorResponse = errorBody(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed");
        errorResponse.put("parameterErrors", parameterErrors);

        log.warn("Parameter validation error: {}", parameterErrors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    /**
     * Handles missing, mistyped and unreadable request input.
     */
    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(errorBody(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request: " + ex.getMessage()));
    }

    /**
     * Handles illegal argument exceptions (business validation errors).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Business validation error: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(errorBody(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage()));
    }

    @ExceptionHandler(CalibrationRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleCalibrationRejected(CalibrationRejectedException ex) {
        return ResponseEntity.badRequest()
            .body(errorBody(HttpStatus.BAD_REQUEST, "Calibration Rejected", ex.getMessage()));
    }

    @ExceptionHandler(SavedPlanNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleSavedPlanNotFound(SavedPlanNotFoundException ex) {
        log.warn("Saved plan lookup failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(errorBody(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage()));
    }

    /**
     * Handles requests that need a loaded or calibrated plan.
     */
    @ExceptionHandler({PlanNotLoadedException.class, CalibrationRequiredException.class})
    public ResponseEntity<Map<String, Object>> handleSessionStateConflict(RuntimeException ex) {
        log.warn("Session state conflict: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(errorBody(HttpStatus.CONFLICT, "Conflict", ex.getMessage()));
    }

    @ExceptionHandler(PlanPersistenceException.class)
    public ResponseEntity<Map<String, Object>> handlePersistenceException(PlanPersistenceException ex) {
        log.error("Plan persistence error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "Persistence Error", ex.getMessage()));
    }

    /**
     * Handles all other unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred"));
    }

    private static Map<String, Object> errorBody(HttpStatus status, String error, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put(TIMESTAMP, Instant.now());
        errorResponse.put(STATUS, status.value());
        errorResponse.put(ERROR, error);
        errorResponse.put(MESSAGE, message);
        return errorResponse;
    }
}
