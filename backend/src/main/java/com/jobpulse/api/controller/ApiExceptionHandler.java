package com.jobpulse.api.controller;

import com.jobpulse.api.dto.ErrorBody;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps unreadable bodies and missing parameters to 400 with ErrorBody.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        log.debug("Rejected request: {}", ex.getReason());
        String message = ex.getReason() != null ? ex.getReason() : "Invalid request";
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", message));
    }
}
