package com.workgraph.dispatch.api;

import com.workgraph.core.error.AnalysisTimeoutException;
import com.workgraph.core.error.IndexInconsistentException;
import com.workgraph.core.error.NotFoundException;
import com.workgraph.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain errors to HTTP responses with a small JSON body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(NotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler({ValidationException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        return body(HttpStatus.BAD_REQUEST, "invalid_request", e.getMessage());
    }

    @ExceptionHandler(IndexInconsistentException.class)
    public ResponseEntity<Map<String, Object>> inconsistent(IndexInconsistentException e) {
        log.warn("Request failed on inconsistent index: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, "index_inconsistent", e.getMessage());
    }

    @ExceptionHandler(AnalysisTimeoutException.class)
    public ResponseEntity<Map<String, Object>> timeout(AnalysisTimeoutException e) {
        log.warn("Analytics timed out: {}", e.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "timeout", e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("error", error);
        result.put("message", message);
        return ResponseEntity.status(status).body(result);
    }
}
