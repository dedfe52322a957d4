package org.operaton.nostrpub.controller;

import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.exception.BridgeException;
import org.operaton.nostrpub.exception.SignatureInvalidException;
import org.operaton.nostrpub.exception.StoreUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps bridge failures to HTTP status codes for remote servers.
 */
@RestControllerAdvice
@Slf4j
public class BridgeExceptionHandler {

    @ExceptionHandler(SignatureInvalidException.class)
    public ResponseEntity<Map<String, String>> signatureInvalid(SignatureInvalidException e) {
        log.warn("Rejected inbox request: {}", e.getMessage());
        return error(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, String>> storeUnavailable(StoreUnavailableException e) {
        log.error("Store unavailable", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "temporarily unavailable");
    }

    @ExceptionHandler(BridgeException.class)
    public ResponseEntity<Map<String, String>> malformed(BridgeException e) {
        log.debug("Bad inbox request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
