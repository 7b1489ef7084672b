package com.liftlog.api;

import com.liftlog.contract.UnknownEventTypeException;
import com.liftlog.contract.ValidationException;
import com.liftlog.engine.RebuildDivergenceException;
import com.liftlog.engine.ReplayCancelledException;
import com.liftlog.engine.WorkoutStateException;
import com.liftlog.store.StorageFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error response handler.
 *
 * All errors follow the machine-readable format:
 * {
 *   "error_code": "VALIDATION_ERROR",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 * Rejected payloads add "field" and "constraint".
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(WorkoutStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleWorkoutState(WorkoutStateException ex) {
        log.warn("Workout state conflict: {}", ex.getMessage());
        return validationResponse("WORKOUT_STATE_CONFLICT", ex);
    }

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ValidationException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        return validationResponse("VALIDATION_ERROR", ex);
    }

    @ExceptionHandler(UnknownEventTypeException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnknownEventType(UnknownEventTypeException ex) {
        log.warn("Unknown event type: {}", ex.getEventType());
        return errorResponse("UNKNOWN_EVENT_TYPE", ex.getMessage());
    }

    @ExceptionHandler(StorageFailureException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleStorageFailure(StorageFailureException ex) {
        log.warn("Storage failure: {}", ex.getMessage());
        return errorResponse("STORAGE_FAILURE", "the event was not stored and may be retried: " + ex.getMessage());
    }

    @ExceptionHandler(RebuildDivergenceException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleDivergence(RebuildDivergenceException ex) {
        Map<String, Object> body = errorResponse("REBUILD_DIVERGENCE", ex.getMessage());
        body.put("diverged_keys", ex.getDivergedKeys());
        return body;
    }

    @ExceptionHandler(ReplayCancelledException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleReplayCancelled(ReplayCancelledException ex) {
        return errorResponse("REPLAY_CANCELLED", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> validationResponse(String errorCode, ValidationException ex) {
        Map<String, Object> body = errorResponse(errorCode, ex.getMessage());
        body.put("field", ex.getField());
        body.put("constraint", ex.getConstraint());
        return body;
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
