package com.causal.graph.service.api.advice;

import com.causal.graph.service.api.dto.ApiResponse;
import com.causal.graph.service.error.CausalAnalysisException;
import com.causal.graph.service.error.MissingPrerequisiteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 *
 * Provides consistent error responses across all endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(
            MethodArgumentNotValidException ex) {

        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", details);

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Validation failed", "VALIDATION_ERROR", details));
    }

    /**
     * Handles analysis exceptions, mapping the error code to a status.
     */
    @ExceptionHandler(CausalAnalysisException.class)
    public ResponseEntity<ApiResponse<Void>> handleAnalysisException(CausalAnalysisException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case "MALFORMED_GRAPH", "INVALID_ANALYSIS_ID" -> HttpStatus.BAD_REQUEST;
            case "ANALYSIS_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "MISSING_PREREQUISITE" -> HttpStatus.CONFLICT;
            case "INVARIANT_VIOLATION" -> HttpStatus.UNPROCESSABLE_ENTITY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };

        if (status.is5xxServerError()) {
            log.error("Analysis error: {} [{}]", ex.getMessage(), ex.getErrorCode(), ex);
        } else {
            log.warn("Analysis error: {} [{}]", ex.getMessage(), ex.getErrorCode());
        }

        String details = ex instanceof MissingPrerequisiteException missing
                ? missing.getProducingStage()
                : ex.getEntityId();
        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode(), details));
    }

    /**
     * Handles resource not found.
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFoundException(
            NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Resource not found", "NOT_FOUND"));
    }

    /**
     * Handles illegal argument exceptions such as unknown stage names.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(
            IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getMessage(), "INVALID_ARGUMENT"));
    }

    /**
     * Handles all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(
                        "An unexpected error occurred",
                        "INTERNAL_ERROR",
                        ex.getMessage()
                ));
    }
}
