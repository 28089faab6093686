package com.di.featurenova.exception;

import com.di.featurenova.pipeline.error.ErrorCategory;
import com.di.featurenova.pipeline.error.IngestionException;
import com.di.featurenova.pipeline.error.PipelineException;
import com.di.featurenova.pipeline.error.SchemaValidationException;
import com.di.featurenova.pipeline.error.TransformationException;
import com.di.featurenova.pipeline.source.RecordSourceException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Maps exceptions escaping the REST surface to a structured
 * {@link ErrorResponse} carrying the {@link ErrorCategory}.
 *
 * <table border="1">
 * <tr><th>Exception</th><th>Status</th></tr>
 * <tr><td>SchemaValidationException, TransformationException</td><td>422</td></tr>
 * <tr><td>IngestionException, RecordSourceException</td><td>502</td></tr>
 * <tr><td>IllegalArgumentException, IllegalStateException, unreadable body</td><td>400</td></tr>
 * <tr><td>NoSuchElementException</td><td>404</td></tr>
 * <tr><td>anything else</td><td>500</td></tr>
 * </table>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({SchemaValidationException.class, TransformationException.class})
    public ResponseEntity<ErrorResponse> handleUnprocessable(PipelineException e, HttpServletRequest request) {
        return respond("DATA_EXCEPTION", e, HttpStatus.UNPROCESSABLE_ENTITY, request);
    }

    @ExceptionHandler({IngestionException.class, RecordSourceException.class})
    public ResponseEntity<ErrorResponse> handleSource(RuntimeException e, HttpServletRequest request) {
        return respond("SOURCE_EXCEPTION", e, HttpStatus.BAD_GATEWAY, request);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class,
                       HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest request) {
        return respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NoSuchElementException e, HttpServletRequest request) {
        return respond("NOT_FOUND", e, HttpStatus.NOT_FOUND, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception e, HttpServletRequest request) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, Exception e, HttpStatus status,
                                                  HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        if (status.is5xxServerError()) {
            log.error("[{}] {} [{}] runId={}: {}", eventType, e.getClass().getSimpleName(), category.getName(),
                    MDC.get("runId"), e.getMessage(), e);
        } else {
            log.warn("[{}] {} [{}]: {}", eventType, e.getClass().getSimpleName(), category.getName(), e.getMessage());
        }
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status, request.getRequestURI()));
    }

    static ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status,
                                            String path) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(path);
        response.addDetail("exceptionType", exception.getClass().getName());
        if (exception instanceof PipelineException pe) {
            response.addDetail("stage", pe.getStage());
            pe.getContext().forEach(response::addDetail);
        }
        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
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
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            details.put(key, value);
        }
    }
}
