package com.nexusbounty.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class DisputeConflictExceptionHandler {

    @ExceptionHandler(DisputeConflictException.class)
    public ResponseEntity<DisputeConflictErrorResponse> handle(DisputeConflictException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new DisputeConflictErrorResponse(ex.getCode(), ex.getMessage()));
    }

    public record DisputeConflictErrorResponse(
            String code,
            String message
    ) {
    }
}
