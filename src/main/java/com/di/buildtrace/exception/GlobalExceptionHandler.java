package com.di.buildtrace.exception;

import com.di.buildtrace.snapshot.MalformedSnapshotException;
import com.di.buildtrace.snapshot.SnapshotNotFoundException;
import com.di.buildtrace.snapshot.StoreUnavailableException;
import jakarta.validation.ConstraintViolationException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the application.
 *
 * <p>Maps the error taxonomy of report and ingestion requests to HTTP:
 * <ul>
 *   <li>{@link SnapshotNotFoundException} → 404</li>
 *   <li>{@link StoreUnavailableException} → 500</li>
 *   <li>malformed input ({@link MalformedSnapshotException}, bean validation, unreadable JSON,
 *       {@link IllegalArgumentException}) → 400</li>
 *   <li>anything else → 500</li>
 * </ul>
 * Every response carries an {@link ErrorCategory} and the request path from MDC.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SnapshotNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(SnapshotNotFoundException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.warn("[ERROR] {} [{}]", e.getMessage(), category.getName());
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.NOT_FOUND);
        body.addDetail("jobId", e.getJobId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("STORE_UNAVAILABLE", category, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    /**
     * Handles validation errors raised at the ingestion boundary and by request parameters.
     */
    @ExceptionHandler({MalformedSnapshotException.class,
                       IllegalArgumentException.class,
                       ConstraintViolationException.class,
                       HandlerMethodValidationException.class,
                       MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.warn("[ERROR] rejected request: {} [{}]", e.getMessage(), category.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildErrorResponse(category, e, HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.warn("[ERROR] bean validation failed: {} error(s)", e.getErrorCount());
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST);
        e.getFieldErrors().forEach(fe -> body.addDetail(fe.getField(), fe.getDefaultMessage()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /**
     * Unparseable JSON, including a {@code state} object that repeats a key.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.warn("[ERROR] unreadable request body: {}", e.getMostSpecificCause().getMessage());
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST);
        body.setMessage("Malformed request body: " + e.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /**
     * Handles all other unhandled exceptions (catch-all).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        Throwable rootCause = getRootCause(exception);
        log.error("[ERROR] {} {}: {} [{}] rootCause={}",
                eventType,
                exception.getClass().getSimpleName(),
                exception.getMessage(),
                category.getName(),
                rootCause != exception ? rootCause.getClass().getSimpleName() : "-",
                exception);
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setPath(getRequestPath());
        response.setRequestId(MDC.get("requestId"));

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    private String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String path;
        private String requestId;
        private Map<String, Object> details = new HashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
