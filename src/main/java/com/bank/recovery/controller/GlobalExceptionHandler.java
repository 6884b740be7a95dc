package com.bank.recovery.controller;

import com.bank.recovery.exception.ConversationCommitException;
import com.bank.recovery.exception.RequestValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(RequestValidationException.class)
    public ResponseEntity<Map<String, Object>> handleRequestValidation(RequestValidationException ex,
                                                                       HttpServletRequest req) {
        HttpStatus status = ex.isNotFound() ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        Map<String, Object> body = body(status, ex.getMessage(), req);
        if (ex.getField() != null) {
            body.put("field", ex.getField());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleBeanValidation(MethodArgumentNotValidException ex,
                                                                    HttpServletRequest req) {
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "Request validation failed", req);
        if (ex.getBindingResult().getFieldError() != null) {
            body.put("field", ex.getBindingResult().getFieldError().getField());
            body.put("error", ex.getBindingResult().getFieldError().getDefaultMessage());
        }
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex,
                                                                HttpServletRequest req) {
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "Malformed request body", req));
    }

    @ExceptionHandler(ConversationCommitException.class)
    public ResponseEntity<Map<String, Object>> handleCommit(ConversationCommitException ex, HttpServletRequest req) {
        log.warn("Commit failed for conversation {}: {}", ex.getConversationId(), ex.getMessage());
        Map<String, Object> body = body(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), req);
        body.put("conversationId", ex.getConversationId());
        body.put("retryable", true);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private static Map<String, Object> body(HttpStatus status, String error, HttpServletRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("path", req.getRequestURI());
        return body;
    }
}
