package com.vidnyan.govern.adapter.in.web;

import com.vidnyan.govern.domain.error.GovernanceException;
import com.vidnyan.govern.domain.error.InvalidPolicyException;
import com.vidnyan.govern.domain.error.ScanTimeoutException;
import com.vidnyan.govern.domain.error.StoreException;
import com.vidnyan.govern.domain.error.UnknownFrameworkException;
import com.vidnyan.govern.domain.error.UnknownPolicyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps governance errors to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class GovernanceExceptionHandler {

    @ExceptionHandler({UnknownFrameworkException.class, UnknownPolicyException.class})
    public ResponseEntity<ErrorResponse> notFound(GovernanceException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), List.of());
    }

    @ExceptionHandler(InvalidPolicyException.class)
    public ResponseEntity<ErrorResponse> invalidPolicy(InvalidPolicyException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), e.getProblems());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), List.of());
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorResponse> storeUnavailable(StoreException e) {
        log.error("Store failure: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), List.of());
    }

    @ExceptionHandler(ScanTimeoutException.class)
    public ResponseEntity<ErrorResponse> timeout(ScanTimeoutException e) {
        log.warn("Scan timed out: {}", e.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, e.getMessage(), List.of());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, List<String> problems) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), message, problems));
    }

    public record ErrorResponse(int status, String message, List<String> problems) {}
}
