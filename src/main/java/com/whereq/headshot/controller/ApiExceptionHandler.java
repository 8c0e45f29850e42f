package com.whereq.headshot.controller;

import com.whereq.headshot.dto.ErrorResponse;
import com.whereq.headshot.exception.BatchValidationException;
import com.whereq.headshot.exception.JobNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

/**
 * Maps API errors to {@link ErrorResponse} bodies. Internal exception details are logged, never
 * returned.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBindException(WebExchangeBindException e) {
        List<String> errors = e.getFieldErrors().stream()
            .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : error.getField() + " is invalid")
            .toList();
        return ResponseEntity.badRequest().body(new ErrorResponse("Batch job validation failed", errors));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInputException(ServerWebInputException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(e.getReason() != null ? e.getReason() : "Malformed request"));
    }

    @ExceptionHandler(BatchValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(BatchValidationException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("Batch job validation failed", e.getErrors()));
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(JobNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled API error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of("Internal server error"));
    }
}
