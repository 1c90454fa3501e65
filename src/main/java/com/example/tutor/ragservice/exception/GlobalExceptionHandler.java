package com.example.tutor.ragservice.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ApiErrorException.class)
    public ResponseEntity<Map<String, Object>> handleApiError(ApiErrorException exception) {
        Map<String, Object> error = new HashMap<>();
        error.put("code", exception.getCode());
        error.put("message", exception.getMessage());
        error.put("details", exception.getDetails() == null ? Map.of() : exception.getDetails());

        return ResponseEntity.status(exception.getStatus()).body(Map.of("error", error));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception exception) {
        log.error("Unhandled request failure", exception);
        Map<String, Object> error = new HashMap<>();
        error.put("code", "INTERNAL_ERROR");
        error.put("message", "Unexpected tutor service failure");
        error.put("details", Map.of("reason", String.valueOf(exception.getMessage())));

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", error));
    }
}
