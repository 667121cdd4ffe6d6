package com.ai.tutor.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * GlobalExceptionHandler provides centralized exception handling across all
 * controllers, ensuring consistent error responses are returned to the client.
 *
 * Only errors a student can act on (missing topic, engine unavailable) carry a
 * specific message; format irregularities from the engine never reach here
 * because the pipeline absorbs them into fallback payloads.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(TopicNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleTopicNotFound(TopicNotFoundException ex) {
        log.warn("Topic lookup failed: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.NOT_FOUND, ex.getMessage(), "TOPIC_NOT_FOUND");
    }

    @ExceptionHandler(ExerciseNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleExerciseNotFound(ExerciseNotFoundException ex) {
        log.warn("Exercise lookup failed: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.NOT_FOUND, ex.getMessage(), "EXERCISE_NOT_FOUND");
    }

    /**
     * Network error, non-2xx answer or timeout from the generative engine.
     */
    @ExceptionHandler(GenerativeEngineException.class)
    public ResponseEntity<Map<String, Object>> handleGenerativeEngine(GenerativeEngineException ex) {
        log.error("Generative engine '{}' failed: {}", ex.getProvider(), ex.getMessage());
        return buildErrorResponse(
                HttpStatus.BAD_GATEWAY,
                "The AI service did not respond. Please try again.",
                "GENERATION_FAILED"
        );
    }

    @ExceptionHandler(EmbeddingModelException.class)
    public ResponseEntity<Map<String, Object>> handleEmbeddingModel(EmbeddingModelException ex) {
        log.error("Embedding model unavailable: {}", ex.getMessage(), ex);
        return buildErrorResponse(
                HttpStatus.SERVICE_UNAVAILABLE,
                "The embedding model could not be loaded.",
                "EMBEDDING_MODEL_UNAVAILABLE"
        );
    }

    @ExceptionHandler(EmbeddingDimensionException.class)
    public ResponseEntity<Map<String, Object>> handleDimension(EmbeddingDimensionException ex) {
        log.error("Rejected write: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), "EMBEDDING_DIMENSION_MISMATCH");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .orElse("Invalid request");
        return buildErrorResponse(HttpStatus.BAD_REQUEST, message, "INVALID_REQUEST");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request body", "INVALID_REQUEST");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "INVALID_REQUEST");
    }

    /**
     * Catch-all handler for unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please try again later.",
                "INTERNAL_SERVER_ERROR"
        );
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(
            HttpStatus status, String message, String errorCode) {
        return ResponseEntity.status(status).body(Map.of(
                "error", message,
                "errorCode", errorCode,
                "status", status.value(),
                "timestamp", LocalDateTime.now().toString()
        ));
    }
}
