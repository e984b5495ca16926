package com.phillippitts.voicejukebox.presentation.exception;

import com.phillippitts.voicejukebox.exception.InvalidQueueOperationException;
import com.phillippitts.voicejukebox.exception.SourceUnreachableException;
import com.phillippitts.voicejukebox.exception.TrackResolutionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping query text and internals away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid queue operation such as a negative offset (HTTP 400).
     */
    @ExceptionHandler(InvalidQueueOperationException.class)
    ResponseEntity<ApiError> handleInvalidQueueOperation(InvalidQueueOperationException ex) {
        LOG.warn("Invalid queue operation: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid queue operation",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - request body failed validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getField)
            .collect(Collectors.joining(", ", "Invalid fields: ", ""));
        LOG.warn("Rejected request: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "ValidationException",
                "Invalid request",
                details,
                Instant.now()
            ));
    }

    /**
     * Client error - unknown enum value or malformed number in a path or query parameter (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        LOG.warn("Rejected parameter '{}'", ex.getName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "TypeMismatch",
                "Invalid request parameter",
                "Unsupported value for '" + ex.getName() + "'",
                Instant.now()
            ));
    }

    /**
     * Transient error - a backend could not produce a track or stream (HTTP 503).
     */
    @ExceptionHandler(TrackResolutionException.class)
    ResponseEntity<ApiError> handleTrackResolution(TrackResolutionException ex) {
        LOG.error("Track resolution failed: ref={}, reason={}", ex.getRef(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Media backend temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Transient error - a backend is unreachable (HTTP 503).
     */
    @ExceptionHandler(SourceUnreachableException.class)
    ResponseEntity<ApiError> handleSourceUnreachable(SourceUnreachableException ex) {
        LOG.error("Backend unreachable: backend={}", ex.getBackend(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Media backend temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
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
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
