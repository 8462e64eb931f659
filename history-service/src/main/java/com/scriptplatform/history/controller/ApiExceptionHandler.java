package com.scriptplatform.history.controller;

import com.scriptplatform.common.exception.PreconditionFailedException;
import com.scriptplatform.common.exception.ResourceNotFoundException;
import com.scriptplatform.common.exception.ScoringException;
import com.scriptplatform.common.exception.StoreUnavailableException;
import com.scriptplatform.common.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps store and calibration failures to JSON error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ScoringException.class)
    public ResponseEntity<Map<String, Object>> handleScoring(ScoringException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("Request failed. operation={} reason={}", ex.getOperation(), ex.getMessage());
        } else {
            log.info("Request rejected. operation={} status={} reason={}",
                     ex.getOperation(), status.value(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(body(status, ex.getMessage()));
    }

    @ExceptionHandler({ServerWebInputException.class, DecodingException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(body(status, "malformed request body"));
    }

    static HttpStatus statusFor(ScoringException ex) {
        if (ex instanceof ValidationException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (ex instanceof PreconditionFailedException) {
            return HttpStatus.PRECONDITION_FAILED;
        }
        if (ex instanceof ResourceNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof StoreUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static Map<String, Object> body(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return body;
    }
}
