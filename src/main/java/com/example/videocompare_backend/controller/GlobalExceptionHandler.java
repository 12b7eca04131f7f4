package com.example.videocompare_backend.controller;

import com.example.videocompare_backend.dto.web.SkippedEntry;
import com.example.videocompare_backend.exception.AggregateFailureException;
import com.example.videocompare_backend.exception.EmbeddingException;
import com.example.videocompare_backend.exception.InputException;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps request-level failures to HTTP responses. Per-item failures never get here; they are
 * reported in the {@code skipped} list of a successful response.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InputException.class)
    ResponseEntity<ApiError> handleInput(InputException ex) {
        LOGGER.warn("Rejected request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "InputError", ex.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOGGER.warn("Rejected request: {}", message);
        return respond(HttpStatus.BAD_REQUEST, "InputError", message, null);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    ResponseEntity<ApiError> handleMissingPart(Exception ex) {
        LOGGER.warn("Rejected request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "InputError", ex.getMessage(), null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException ex) {
        LOGGER.warn("Upload too large: {}", ex.getMessage());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, "InputError", "Upload exceeds the configured size limit", null);
    }

    @ExceptionHandler(AggregateFailureException.class)
    ResponseEntity<ApiError> handleAggregate(AggregateFailureException ex) {
        LOGGER.error("Comparison failed status={} message={} skipped={}", ex.getStatus().value(), ex.getMessage(), ex.getSkipped().size());
        List<SkippedEntry> skipped = ex.getSkipped().stream().map(SkippedEntry::from).toList();
        return respond(ex.getStatus(), "AggregateFailure", ex.getMessage(), skipped);
    }

    @ExceptionHandler(EmbeddingException.class)
    ResponseEntity<ApiError> handleEmbedding(EmbeddingException ex) {
        LOGGER.error("Embedding service failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "EmbeddingError", "Scoring service temporarily unavailable", null);
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOGGER.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String error, String message, List<SkippedEntry> skipped) {
        return ResponseEntity.status(status).body(new ApiError(error, message, skipped, Instant.now()));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ApiError(String error, String message, List<SkippedEntry> skipped, Instant timestamp) {
    }
}
