package com.example.healthrag;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @Data
    @Builder
    public static class ErrorResponse {
        private String code;
        private String message;
        private OffsetDateTime timestamp;
        private Map<String, Object> details;
    }

    @ExceptionHandler(EmbeddingUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleEmbeddingUnavailable(EmbeddingUnavailableException e) {
        log.warn("Embedding unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "EMBEDDING_UNAVAILABLE", e.getMessage(), null);
    }

    @ExceptionHandler(GenerationUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleGenerationUnavailable(GenerationUnavailableException e) {
        log.warn("Text generation unavailable: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "GENERATION_UNAVAILABLE", e.getMessage(), null);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException e) {
        log.error("Store unavailable", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", e.getMessage(), null);
    }

    @ExceptionHandler(CacheUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleCacheUnavailable(CacheUnavailableException e) {
        log.warn("Cache unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "CACHE_UNAVAILABLE", e.getMessage(), null);
    }

    @ExceptionHandler(DimensionMismatchException.class)
    public ResponseEntity<ErrorResponse> handleDimensionMismatch(DimensionMismatchException e) {
        log.error("Embedding dimension mismatch", e);
        Map<String, Object> details = new HashMap<>();
        details.put("expected", e.getExpected());
        details.put("actual", e.getActual());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "DIMENSION_MISMATCH", e.getMessage(), details);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", e.getMessage(), null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be read", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unhandled exception", e);
        Map<String, Object> details = new HashMap<>();
        details.put("exception", e.getClass().getSimpleName());
        details.put("message", e.getMessage());
        if (e.getCause() != null) details.put("cause", e.getCause().getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", details);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message, Map<String, Object> details) {
        ErrorResponse body = ErrorResponse.builder()
                .code(code)
                .message(message)
                .timestamp(OffsetDateTime.now())
                .details(details)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
