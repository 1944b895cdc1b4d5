package com.compareintel.compare.controller;

import com.compareintel.compare.service.ComparisonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ComparisonException.class)
    public ResponseEntity<Map<String, Object>> handleComparisonException(ComparisonException exception) {
        if (exception.status().is5xxServerError()) {
            log.error("Comparison request failed: {}", exception.getMessage());
        }
        return ResponseEntity.status(exception.status())
                .body(Map.of(
                        "error", exception.getMessage()
                ));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBindException(WebExchangeBindException exception) {
        String message = exception.getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .map(field -> field + " " + fieldMessage(exception, field))
                .collect(Collectors.joining("; "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", message.isBlank() ? "Invalid request" : message
                ));
    }

    private String fieldMessage(WebExchangeBindException exception, String field) {
        FieldError error = exception.getFieldError(field);
        return error == null || error.getDefaultMessage() == null ? "is invalid" : error.getDefaultMessage();
    }
}
