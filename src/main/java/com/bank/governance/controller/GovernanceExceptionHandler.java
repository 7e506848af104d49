package com.bank.governance.controller;

import com.bank.governance.exception.GovernanceValidationException;
import com.bank.governance.exception.PatternConfigurationException;
import com.bank.governance.exception.ReviewAlreadyResolvedException;
import com.bank.governance.exception.ReviewNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GovernanceExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GovernanceExceptionHandler.class);

    @ExceptionHandler(ReviewNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(ReviewNotFoundException e) {
        return body(e.getMessage(), "reviewId");
    }

    @ExceptionHandler(ReviewAlreadyResolvedException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleAlreadyResolved(ReviewAlreadyResolvedException e) {
        Map<String, Object> body = body(e.getMessage(), "reviewId");
        body.put("status", e.getCurrentStatus() != null ? e.getCurrentStatus().name() : null);
        return body;
    }

    @ExceptionHandler(GovernanceValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(GovernanceValidationException e) {
        return body(e.getError().message(), e.getError().field());
    }

    @ExceptionHandler(PatternConfigurationException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handlePatternConfiguration(PatternConfigurationException e) {
        log.warn("Pattern configuration rejected: {}", e.getMessage());
        return body(e.getMessage(), "patterns");
    }

    private static Map<String, Object> body(String error, String field) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("field", field);
        return body;
    }
}
