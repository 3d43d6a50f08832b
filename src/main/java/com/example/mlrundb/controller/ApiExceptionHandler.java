package com.example.mlrundb.controller;

import com.example.mlrundb.error.BatchDeleteException;
import com.example.mlrundb.error.MetadataDbException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BatchDeleteException.class)
    public ResponseEntity<Map<String, Object>> handleBatchDelete(BatchDeleteException ex) {
        logger.warn("Delete by query incomplete: {}", ex.getMessage());
        Map<String, Object> body = body(ex);
        body.put("deleted", ex.getDeleted());
        body.put("failed", new ArrayList<>(ex.getFailures().keySet()));
        return ResponseEntity.status(ex.getStatusCode()).body(body);
    }

    @ExceptionHandler(MetadataDbException.class)
    public ResponseEntity<Map<String, Object>> handleMetadataDb(MetadataDbException ex) {
        if (ex.getStatusCode() >= 500) {
            logger.error("Request failed: {}", ex.getMessage(), ex);
        } else {
            logger.debug("Request rejected: {}", ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatusCode()).body(body(ex));
    }

    private static Map<String, Object> body(MetadataDbException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", ex.getErrorCode());
        body.put("message", ex.getMessage());
        return body;
    }
}
