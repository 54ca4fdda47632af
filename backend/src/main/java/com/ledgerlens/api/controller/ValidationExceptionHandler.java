package com.ledgerlens.api.controller;

import com.ledgerlens.api.dto.ErrorBody;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation failures (@Valid) to 400 with ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, userFacingMessage(error, ex)));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_USER" -> "User id is required";
            case "INVALID_LOCATION" -> "Bucket and object name are required";
            case "UNSUPPORTED_FILE_TYPE" -> "Only PDF and image documents are accepted";
            case "EMPTY_MESSAGE" -> "Message text is required";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
