/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.lockregistry.web;

import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps registry failures onto HTTP statuses. Responses carry no body.
 */
@Slf4j
@RestControllerAdvice
public class LockExceptionHandler {

    @ExceptionHandler(LockNotFoundException.class)
    public ResponseEntity<Void> handleLockNotFound(LockNotFoundException e) {
        log.debug("Responding 410: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.GONE).build();
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Void> handleInvalidBody(MethodArgumentNotValidException e) {
        log.debug("Rejected lock request body: {} field error(s)", e.getErrorCount());
        return ResponseEntity.unprocessableEntity().build();
    }

    /**
     * Well-formed JSON of the wrong shape (a token that is not a string) is
     * 422. Anything that does not parse, or a missing body, stays 400.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Void> handleUnreadableBody(HttpMessageNotReadableException e) {
        if (e.getCause() instanceof MismatchedInputException mismatch) {
            log.debug("Rejected lock request body: {}", mismatch.getOriginalMessage());
            return ResponseEntity.unprocessableEntity().build();
        }
        log.debug("Unreadable lock request body: {}", e.getMessage());
        return ResponseEntity.badRequest().build();
    }
}
