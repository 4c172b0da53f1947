package com.ulbaudit.audit.controller;

import com.ulbaudit.audit.controller.dto.ErrorResponseDto;
import com.ulbaudit.audit.data.DataProviderUnavailableException;
import com.ulbaudit.audit.rules.RuleNotFoundException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(RuleNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleRuleNotFound(RuleNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "RULE_NOT_FOUND", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(DataProviderUnavailableException.class)
    public ResponseEntity<ErrorResponseDto> handleDataUnavailable(DataProviderUnavailableException ex) {
        Map<String, Object> details = new HashMap<>();
        details.put("ruleId", ex.getRuleId());
        details.put("action", "Set audit.data.directory to the folder holding the questionnaire CSV exports");
        return build(HttpStatus.SERVICE_UNAVAILABLE, "DATA_UNAVAILABLE", ex.getMessage(), details);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        Map<String, Object> details = new HashMap<>();
        details.put("reason", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", details);
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details));
    }
}
