package com.labelrun.api.controller;

import com.labelrun.api.dto.ErrorBody;
import com.labelrun.ingestion.store.ProgressStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps request and store failures to ErrorBody responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleBadInput(ServerWebInputException ex) {
        String message = ex.getReason() != null ? ex.getReason() : "Invalid request";
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", message));
    }

    @ExceptionHandler(ProgressStoreException.class)
    public ResponseEntity<ErrorBody> handleStore(ProgressStoreException ex) {
        log.error("Progress store unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("STORE_UNAVAILABLE", "Progress store is unavailable"));
    }
}
