package com.phillippitts.mcpanalytics.presentation.exception;

import com.phillippitts.mcpanalytics.exception.InvalidImportException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Details are only echoed back for client errors.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final String IMPORT_FAILED = "Failed to import analytics";

    /**
     * Client error - import payload rejected before any counter changed (HTTP 400).
     */
    @ExceptionHandler(InvalidImportException.class)
    ResponseEntity<ApiError> handleInvalidImport(InvalidImportException ex) {
        LOG.warn("Invalid analytics import: reason={}", ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                IMPORT_FAILED,
                ex.getReason(),
                Instant.now()
            ));
    }

    /**
     * Client error - body is not valid JSON or has the wrong types (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "MalformedRequest",
                "Request body could not be read",
                "Expected a JSON object with integer fields",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500). Framework errors that carry their own
     * status (unknown path, unsupported method) keep it.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            LOG.debug("Request rejected by framework: {}", ex.getMessage());
            return ResponseEntity
                .status(errorResponse.getStatusCode())
                .body(new ApiError(
                    ex.getClass().getSimpleName(),
                    errorResponse.getBody().getTitle(),
                    errorResponse.getBody().getDetail(),
                    Instant.now()
                ));
        }
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
