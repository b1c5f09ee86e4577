package com.approvalgate.interfaces.api.exception;

import com.approvalgate.application.ErrorCodes;
import com.approvalgate.interfaces.api.dto.ToolResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the tool API.
 *
 * Failures that escape a handler still leave in the canonical error shape, so
 * the UI and the AI agent never have to parse a different body:
 * - unreadable or invalid request bodies: INVALID_INPUT (400)
 * - anything else: INTERNAL_ERROR (500), with no internal detail
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle validation errors from @Valid annotation.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ToolResponse> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<Map<String, Object>> validationErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("field", error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName());
                entry.put("message", error.getDefaultMessage());
                return entry;
            })
            .collect(Collectors.toList());

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                validationErrors.size(), request.getRequestURI());
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("validationErrors", validationErrors);

        return ResponseEntity.badRequest().body(ToolResponse.error(
            ErrorCodes.INVALID_INPUT,
            "Invalid request parameters",
            "Correct the highlighted fields and try again.",
            details));
    }

    /**
     * Handle malformed JSON bodies.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ToolResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        }

        return ResponseEntity.badRequest().body(ToolResponse.error(
            ErrorCodes.INVALID_INPUT,
            "Request body is missing or is not valid JSON",
            "Send a JSON object body."));
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ToolResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Unhandled exception on {}: {}",
                request.getRequestURI(), ex.getMessage(), ex);
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ToolResponse.error(
            ErrorCodes.INTERNAL_ERROR,
            "An unexpected error occurred. Please contact support.",
            "Please try again later or contact support if the problem persists."));
    }
}
