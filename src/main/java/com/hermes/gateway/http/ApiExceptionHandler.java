package com.hermes.gateway.http;

import com.hermes.containers.ClaimNotFoundException;
import com.hermes.shared.retry.RetryableException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RetryableException.class)
    public ResponseEntity<Map<String, String>> handleRetryable(RetryableException ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, errorType={}, errorMessage={}",
                request.getRequestURI(), ex.getClass().getSimpleName(), ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, errorType={}, errorMessage={}",
                request.getRequestURI(), ex.getClass().getSimpleName(), ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({CommandNotFoundException.class, ClaimNotFoundException.class})
    public ResponseEntity<Map<String, String>> handleNotFound(RuntimeException ex) {
        return body(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, errorType={}", request.getRequestURI(), ex.getClass().getSimpleName(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error");
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String message) {
        var text = message == null || message.isBlank() ? status.getReasonPhrase() : message;
        return ResponseEntity.status(status).body(Map.of("error", text));
    }
}
