package com.di.featurenova.pipeline.error;

import com.di.featurenova.pipeline.source.RecordSourceException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for run failure logging and REST error bodies.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in
 * {@link #MATCHERS}. Pipeline exceptions are classified by type before the matchers run.
 */
public enum ErrorCategory {

    SOURCE_ERROR("Record source error", "Reading the record source failed or returned unusable data"),
    SCHEMA_ERROR("Schema violation", "Required columns are missing from a partition"),
    DRIFT_ERROR("Drift computation error", "A per-column drift test could not be computed"),
    TRANSFORMATION_ERROR("Transformation error", "Non-coercible data or a preprocessor that cannot be fitted"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    RESOURCE_ERROR("Resource error", "File system or memory exhaustion or unavailability"),
    SERIALIZATION_ERROR("Serialization error", "Artifact serialization or deserialization failure"),
    IO_ERROR("I/O error", "Reading or writing an artifact failed"),
    VALIDATION_ERROR("Validation error", "Invalid argument or configuration value"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
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
        MATCHERS.put(t -> t instanceof IngestionException || t instanceof RecordSourceException, SOURCE_ERROR);
        MATCHERS.put(t -> t instanceof SchemaValidationException, SCHEMA_ERROR);
        MATCHERS.put(t -> t instanceof DriftComputationException, DRIFT_ERROR);
        MATCHERS.put(t -> t instanceof TransformationException, TRANSFORMATION_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isIoError, IO_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
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

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || t instanceof java.sql.SQLTimeoutException
                || messageContains(t, "timeout", "timed out");
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.FileSystemException
                || (t instanceof java.io.UncheckedIOException
                        && t.getCause() instanceof java.nio.file.FileSystemException);
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || (t instanceof java.io.UncheckedIOException
                        && t.getCause() instanceof com.fasterxml.jackson.core.JsonProcessingException);
    }

    private static boolean isIoError(Throwable t) {
        return t instanceof java.io.IOException || t instanceof java.io.UncheckedIOException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        if (msg == null) return false;
        String lower = msg.toLowerCase();
        for (String k : keywords) {
            if (lower.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
