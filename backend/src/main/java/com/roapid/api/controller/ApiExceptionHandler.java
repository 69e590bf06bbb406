package com.roapid.api.controller;

import com.roapid.api.dto.ErrorBody;
import com.roapid.domain.InvalidCategoryException;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps request failures to 400 with ErrorBody.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = "INVALID_CATEGORY".equals(error)
                ? "category is required"
                : ex.getFieldErrors().stream()
                        .findFirst()
                        .map(e -> e.getField() + ": " + e.getDefaultMessage())
                        .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(InvalidCategoryException.class)
    public ResponseEntity<ErrorBody> handleInvalidCategory(InvalidCategoryException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_CATEGORY", ex.getMessage()));
    }
}
