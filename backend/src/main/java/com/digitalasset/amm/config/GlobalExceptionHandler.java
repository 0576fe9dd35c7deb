// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.config;

import com.digitalasset.amm.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Global exception handler for all REST controllers.
 *
 * Provides standardized error responses across all endpoints:
 * - ResponseStatusException carrying a domain error ("CODE: message" reason)
 * - Request validation and binding errors (400 Bad Request)
 * - Generic exceptions (500 Internal Server Error)
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern DOMAIN_REASON = Pattern.compile("^([A-Z][A-Z0-9_]*): (.*)$", Pattern.DOTALL);

    /**
     * Handle ResponseStatusException thrown by controllers.
     * Controllers raise these for every rejected domain operation.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(
            ResponseStatusException ex,
            HttpServletRequest request
    ) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        String errorCode = getErrorCodeFromStatus(status);
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();

        Matcher domain = DOMAIN_REASON.matcher(message);
        if (domain.matches()) {
            errorCode = domain.group(1);
            message = domain.group(2);
        }

        ErrorResponse errorResponse = build(errorCode, message, status, request);

        if (status.is5xxServerError()) {
            logger.error("ResponseStatusException: {} {} - {}: {}",
                status.value(), request.getRequestURI(), errorCode, message);
        } else {
            logger.warn("ResponseStatusException: {} {} - {}: {}",
                status.value(), request.getRequestURI(), errorCode, message);
        }

        return ResponseEntity.status(status).body(errorResponse);
    }

    /**
     * Handle validation errors (e.g., @Valid annotation failures).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        Map<String, String> validationErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
            validationErrors.put(error.getField(), error.getDefaultMessage())
        );

        ErrorResponse errorResponse = build("VALIDATION_ERROR", "Request validation failed",
            HttpStatus.BAD_REQUEST, request);
        errorResponse.setDetails(validationErrors);

        logger.warn("Validation error on {}: {}", request.getRequestURI(), validationErrors);

        return ResponseEntity.badRequest().body(errorResponse);
    }

    /**
     * Missing or unparseable query parameters, and unreadable JSON bodies.
     */
    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        String message = ex instanceof HttpMessageNotReadableException
            ? "Malformed request body"
            : ex.getMessage();
        logger.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(build("VALIDATION_ERROR", message, HttpStatus.BAD_REQUEST, request));
    }

    /**
     * Handle all other uncaught exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        // framework errors (unknown path, wrong method) already carry a 4xx status
        if (ex instanceof org.springframework.web.ErrorResponse framework
                && framework.getStatusCode().is4xxClientError()) {
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            logger.warn("Request rejected on {}: {}", request.getRequestURI(), ex.getMessage());
            return ResponseEntity.status(status)
                .body(build(getErrorCodeFromStatus(status), status.getReasonPhrase(), status, request));
        }
        logger.error("Unhandled exception on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        ErrorResponse errorResponse = build("UNEXPECTED_ERROR", "An unexpected error occurred",
            HttpStatus.INTERNAL_SERVER_ERROR, request);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private ErrorResponse build(String errorCode, String message, HttpStatus status, HttpServletRequest request) {
        ErrorResponse errorResponse = new ErrorResponse(errorCode, message, status.value(), request.getRequestURI());
        String requestId = request.getHeader("X-Request-ID");
        if (requestId != null) {
            errorResponse.setRequestId(requestId);
        }
        return errorResponse;
    }

    /**
     * Map HTTP status to error code.
     */
    private String getErrorCodeFromStatus(HttpStatus status) {
        return switch (status) {
            case BAD_REQUEST -> "BAD_REQUEST";
            case UNAUTHORIZED -> "UNAUTHORIZED";
            case NOT_FOUND -> "NOT_FOUND";
            case CONFLICT -> "CONFLICT";
            case UNPROCESSABLE_ENTITY -> "UNPROCESSABLE_ENTITY";
            case INTERNAL_SERVER_ERROR -> "INTERNAL_SERVER_ERROR";
            default -> status.name();
        };
    }
}
