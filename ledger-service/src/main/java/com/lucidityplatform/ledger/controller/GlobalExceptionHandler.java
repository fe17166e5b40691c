package com.lucidityplatform.ledger.controller;

import com.lucidityplatform.common.exception.ActorNotFoundException;
import com.lucidityplatform.common.exception.LucidityException;
import com.lucidityplatform.common.exception.OnCooldownException;
import com.lucidityplatform.common.exception.StorageException;
import com.lucidityplatform.common.exception.UnknownActionCodeException;
import com.lucidityplatform.common.exception.UnknownEncounterCategoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps the lucidity exception taxonomy onto HTTP responses with a
 * {@code {error, message, ...}} body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({UnknownActionCodeException.class, UnknownEncounterCategoryException.class})
    public ResponseEntity<Map<String, Object>> handleUnknownCode(LucidityException e) {
        log.warn("Rejected unknown code. code={} message={}", e.getCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body(e));
    }

    @ExceptionHandler(OnCooldownException.class)
    public ResponseEntity<Map<String, Object>> handleCooldown(OnCooldownException e) {
        Map<String, Object> body = body(e);
        body.put("actionCode", e.getActionCode());
        body.put("expiresAt", e.getExpiresAt());
        body.put("remainingSeconds", e.getRemaining().toSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, e.getRemaining().toSeconds())))
            .body(body);
    }

    @ExceptionHandler(ActorNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleActorNotFound(ActorNotFoundException e) {
        log.warn("Unknown actor. actorId={}", e.getActorId());
        Map<String, Object> body = body(e);
        body.put("actorId", e.getActorId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageException e) {
        Map<String, Object> body = body(e);
        body.put("operation", e.getOperation());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        log.warn("Bad request. message={}", e.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "BAD_REQUEST");
        body.put("message", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    private static Map<String, Object> body(LucidityException e) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", e.getCode());
        body.put("message", e.getMessage());
        return body;
    }
}
