package com.marketfeed.marketdata.controller;

import com.marketfeed.common.exception.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;

/**
 * Upstream failures surface as {@code 502}, malformed requests as {@code 400}. The upstream
 * response body is logged, never returned.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(FetchException.class)
    public ResponseEntity<ApiError> handleFetch(FetchException e) {
        log.warn("Upstream fetch failed. resource={} status={} body={}",
                 e.getResource(), e.getStatusCode(), e.getResponseBody());
        return respond(HttpStatus.BAD_GATEWAY, e.getMessage(), e.getResource(), e.getStatusCode());
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    public ResponseEntity<ApiError> handleBadInput(Exception e) {
        log.warn("Rejected request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), null, null);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String message,
                                                    String resource, Integer upstreamStatus) {
        return ResponseEntity.status(status)
            .body(new ApiError(status.value(), status.getReasonPhrase(), message,
                               resource, upstreamStatus, Instant.now()));
    }
}
