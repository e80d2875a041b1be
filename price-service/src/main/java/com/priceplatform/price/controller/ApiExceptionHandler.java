package com.priceplatform.price.controller;

import com.priceplatform.common.exception.PricingException;
import com.priceplatform.common.exception.RefreshValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RefreshValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(RefreshValidationException e) {
        log.info("REQUEST_REJECTED err={}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(Map.of("error", "Invalid request", "message", e.getMessage()));
    }

    @ExceptionHandler(PricingException.class)
    public ResponseEntity<Map<String, Object>> handlePricing(PricingException e) {
        log.error("REQUEST_FAILED component={} err={}", e.getComponent(), e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("error", e.getMessage(), "component", e.getComponent()));
    }
}
