package io.dispatch4j.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.dispatch4j.core.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage() == null ? "invalid_request" : ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "malformed_json", "request body is not valid JSON for this endpoint");
    }

    @ExceptionHandler(JsonProcessingException.class)
    public ResponseEntity<Map<String, Object>> malformed(JsonProcessingException ex) {
        return error(HttpStatus.BAD_REQUEST, "malformed_json", "request body is not valid JSON for this endpoint");
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<Map<String, Object>> storeFailure(StoreException ex) {
        log.error("Store failure while handling request msg={}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "store_error", ex.getMessage() == null ? "store_error" : ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "status", "error",
                "reason", reason,
                "message", message,
                "ts", Instant.now().toString()
        ));
    }
}
