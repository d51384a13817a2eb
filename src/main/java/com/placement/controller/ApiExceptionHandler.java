package com.placement.controller;

import com.placement.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps batch-level failures to HTTP status codes. Per-offer failures are part of the
 * normal {@code BatchResult} response and never reach this handler.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, String>> storeUnavailable(StoreUnavailableException e) {
        log.error("Record store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                "errorKind", e.getErrorKind().name(),
                "error", e.getMessage()
        ));
    }
}
