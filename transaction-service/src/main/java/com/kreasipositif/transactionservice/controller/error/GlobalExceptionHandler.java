package com.kreasipositif.transactionservice.controller.error;

import com.kreasipositif.transactionservice.dto.ErrorResponse;
import com.kreasipositif.transactionservice.exception.InvalidQueryException;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps service and request-binding failures to {@link ErrorResponse} payloads.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<ErrorResponse> handleInvalidQuery(InvalidQueryException ex, HttpServletRequest request) {
        log.warn("Rejected request {}: {}", request.getRequestURI(), ex.getMessage());
        return buildResponse(ex.getMessage(), request, HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_ERROR);
    }

    /**
     * Bean-validation failures on request bodies. Every field error is reported, joined by {@code "; "}.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Rejected body for {}: {}", request.getRequestURI(), message);
        return buildResponse(message, request, HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_ERROR);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidParameters(HandlerMethodValidationException ex,
                                                                 HttpServletRequest request) {
        String message = ex.getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return buildResponse(message, request, HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_ERROR);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        String message = "Invalid value '" + ex.getValue() + "' for parameter " + ex.getName();
        return buildResponse(message, request, HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_ERROR);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildResponse("Malformed request body", request, HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST");
    }

    @ExceptionHandler(BulkheadFullException.class)
    public ResponseEntity<ErrorResponse> handleBulkheadFull(BulkheadFullException ex, HttpServletRequest request) {
        log.warn("Fraud scoring saturated for {}: {}", request.getRequestURI(), ex.getMessage());
        return buildResponse(ex.getMessage(), request, HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_BUSY");
    }

    /**
     * Fallback. Framework exceptions that carry their own status (unknown path, wrong method)
     * keep it; everything else is a 500.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            HttpStatusCode status = framework.getStatusCode();
            return buildResponse(ex.getMessage(), request, status, "REQUEST_ERROR");
        }
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return buildResponse(ex.getMessage(), request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    private ResponseEntity<ErrorResponse> buildResponse(String message,
                                                        HttpServletRequest request,
                                                        HttpStatusCode status,
                                                        String errorCode) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, message, request.getRequestURI());
        return ResponseEntity.status(status).body(response);
    }
}
