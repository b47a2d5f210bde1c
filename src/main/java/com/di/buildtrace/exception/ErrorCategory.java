package com.di.buildtrace.exception;

import com.di.buildtrace.snapshot.MalformedSnapshotException;
import com.di.buildtrace.snapshot.SnapshotNotFoundException;
import com.di.buildtrace.snapshot.StoreUnavailableException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for error responses and log lines.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    NOT_FOUND("Snapshot not found", "The requested job snapshot does not exist"),
    STORAGE_ERROR("Storage error", "Snapshot storage could not be reached or read"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    SERIALIZATION_ERROR("Serialization error", "Data serialization or deserialization failure"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof SnapshotNotFoundException, NOT_FOUND);
        MATCHERS.put(t -> t instanceof StoreUnavailableException, STORAGE_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || t instanceof org.springframework.http.converter.HttpMessageNotReadableException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof MalformedSnapshotException
                || t instanceof IllegalArgumentException
                || t instanceof jakarta.validation.ConstraintViolationException
                || t instanceof org.springframework.web.bind.MethodArgumentNotValidException
                || t instanceof org.springframework.web.method.annotation.HandlerMethodValidationException
                || t instanceof org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
    }
}
