package com.techlab.mailmerge.controller;

import com.techlab.mailmerge.exception.AllRowsFailedException;
import com.techlab.mailmerge.exception.MailMergeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns exceptions into the {@code {success: false, message}} error body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AllRowsFailedException.class)
    public ResponseEntity<Map<String, Object>> handleAllRowsFailed(AllRowsFailedException e) {
        log.error("Batch generation failed: {}", e.getMessage());
        List<Map<String, Object>> failures = e.getFailures().stream()
                .map(failure -> {
                    Map<String, Object> entry = new HashMap<>();
                    entry.put("row", failure.getRowIndex() + 1);
                    entry.put("filename", failure.getFilename());
                    entry.put("reason", failure.getFailureReason());
                    return entry;
                })
                .collect(Collectors.toList());

        Map<String, Object> error = error(e.getMessage());
        error.put("failures", failures);
        return ResponseEntity.status(e.getStatus()).body(error);
    }

    @ExceptionHandler(MailMergeException.class)
    public ResponseEntity<Map<String, Object>> handleMailMerge(MailMergeException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.warn("Request rejected ({}): {}", e.getStatus().value(), e.getMessage());
        }
        return ResponseEntity.status(e.getStatus()).body(error(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("Invalid request: {}", message);
        return ResponseEntity.badRequest().body(error(message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(error("Invalid or missing request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse errorResponse) {
            log.warn("Request rejected ({}): {}", errorResponse.getStatusCode().value(), e.getMessage());
            return ResponseEntity.status(errorResponse.getStatusCode()).body(error(e.getMessage()));
        }
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error("Error: " + e.getMessage()));
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        error.put("message", message);
        return error;
    }
}
