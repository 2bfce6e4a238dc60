package com.portfolioscanner.scanner.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;

@RestControllerAdvice
public class ScannerExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ScannerExceptionHandler.class);

    @ExceptionHandler(ScannerException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(ScannerException ex) {
        log.warn("Rejected scanner request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "invalid_request", "message", ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(ServerWebInputException ex) {
        log.warn("Unreadable scanner request: {}", ex.getReason());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "invalid_request", "message", "Request body is missing or malformed"));
    }

    @ExceptionHandler(AnalysisNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(AnalysisNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", "analysis_not_found", "message", ex.getMessage()));
    }
}
