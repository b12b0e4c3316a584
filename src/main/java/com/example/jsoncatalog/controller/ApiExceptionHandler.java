package com.example.jsoncatalog.controller;

import com.example.jsoncatalog.exception.DatasetNotFoundException;
import com.example.jsoncatalog.exception.DatasetOperationException;
import com.example.jsoncatalog.exception.DuplicateDatasetException;
import com.example.jsoncatalog.exception.IngestionException;
import com.example.jsoncatalog.exception.InvalidRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps core failures to HTTP responses shaped {@code {success:false, error, operation?, datasetId?}}.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(DatasetNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(DatasetNotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(InvalidRequestException e) {
        log.debug("Invalid request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(DuplicateDatasetException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(DuplicateDatasetException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<Map<String, Object>> handleIngestion(IngestionException e) {
        HttpStatus status = switch (e.getKind()) {
            case INPUT, ANALYSIS -> HttpStatus.BAD_REQUEST;
            case STORAGE, CATALOG -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return respond(status, e);
    }

    @ExceptionHandler(DatasetOperationException.class)
    public ResponseEntity<Map<String, Object>> handleOperation(DatasetOperationException e) {
        log.error("Operation {} failed for dataset {}", e.getOperation(), e.getDatasetId(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception e) {
        return ResponseEntity.badRequest().body(Map.of("success", false, "error", "Malformed request: " + e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse errorResponse) {
            // framework errors (unknown route, wrong method, missing parameter) keep their status
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(Map.of("success", false, "error", String.valueOf(errorResponse.getBody().getDetail())));
        }
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("success", false, "error", "Internal server error"));
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, DatasetOperationException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", e.getMessage());
        if (e.getOperation() != null) {
            body.put("operation", e.getOperation());
        }
        if (e.getDatasetId() != null) {
            body.put("datasetId", e.getDatasetId());
        }
        return ResponseEntity.status(status).body(body);
    }
}
