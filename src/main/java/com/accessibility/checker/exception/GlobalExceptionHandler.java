package com.accessibility.checker.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps precondition violations to 400 responses. Per-image and collaborator failures never
 * reach this layer; they are reflected in the assessment itself.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AccessibilityCheckerException.class)
    public ResponseEntity<Map<String, Object>> handleCheckerException(AccessibilityCheckerException ex,
                                                                      HttpServletRequest request) {
        log.warn("Rejected request {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), request));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex,
                                                                HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Invalid request");
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "INVALID_INPUT", message, request));
    }

    private static Map<String, Object> body(HttpStatus status, String code, String message,
                                            HttpServletRequest request) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", status.value());
        out.put("error", code);
        out.put("message", message);
        out.put("path", request.getRequestURI());
        out.put("timestamp", Instant.now().toString());
        return out;
    }
}
