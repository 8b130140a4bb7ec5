package com.di.flightwarehouse.exception;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the pipeline trigger API to structured error responses.
 *
 * <p><strong>Status mapping:</strong>
 * <ul>
 *   <li>{@link StructuralPipelineException} - 502, a source or sink the stage depends on failed</li>
 *   <li>{@link QualityGateException} - 422, the data loaded but failed the gate</li>
 *   <li>{@link PipelineAlreadyRunningException} - 409</li>
 *   <li>{@link IllegalArgumentException} - 400 (e.g. unknown stage name)</li>
 *   <li>anything else - 500</li>
 * </ul>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(StructuralPipelineException.class)
    public ResponseEntity<ErrorResponse> handleStructural(StructuralPipelineException e) {
        ErrorResponse body = buildErrorResponse(e, HttpStatus.BAD_GATEWAY, "STRUCTURAL_FAILURE");
        if (e.getFileName() != null) {
            body.addDetail("fileName", e.getFileName());
        }
        if (e.getChunkIndex() != null) {
            body.addDetail("chunkIndex", e.getChunkIndex());
        }
        if (e.getRowIndex() != null) {
            body.addDetail("rowIndex", e.getRowIndex());
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(QualityGateException.class)
    public ResponseEntity<ErrorResponse> handleQualityGate(QualityGateException e) {
        ErrorResponse body = buildErrorResponse(e, HttpStatus.UNPROCESSABLE_ENTITY, "QUALITY_GATE");
        body.addDetail("failedChecks", e.getReport().failedCheckNames());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(PipelineAlreadyRunningException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyRunning(PipelineAlreadyRunningException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(buildErrorResponse(e, HttpStatus.CONFLICT, "ALREADY_RUNNING"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(buildErrorResponse(e, HttpStatus.BAD_REQUEST, "BAD_REQUEST"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(e, HttpStatus.INTERNAL_SERVER_ERROR, "UNHANDLED_EXCEPTION"));
    }

    private ErrorResponse buildErrorResponse(Throwable exception, HttpStatus status, String eventType) {
        ErrorCategory category = ErrorCategory.categorize(exception);
        if (status.is5xxServerError()) {
            log.error("[API] {} runId={} category={}: {}", eventType, MDC.get("runId"), category, exception.getMessage(), exception);
        } else {
            log.warn("[API] {} category={}: {}", eventType, category, exception.getMessage());
        }

        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.addDetail("exceptionType", exception.getClass().getName());

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
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
