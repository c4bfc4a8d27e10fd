package com.liquidswap.api.controller;

import com.liquidswap.api.dto.ErrorBody;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps request validation failures (@Valid) and unreadable bodies to 400 with {@link ErrorBody}.
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        FieldError fieldError = ex.getFieldError();
        String error = Optional.ofNullable(fieldError)
                .map(FieldError::getDefaultMessage)
                .filter(msg -> !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(ErrorBody.invalidField(error, userFacingMessage(error, ex),
                fieldError != null ? fieldError.getField() : null));
    }

    /** Malformed JSON, wrong field types, missing body. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleUnreadable(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.unreadable(
                ex.getReason() != null ? ex.getReason() : "Request body could not be read"));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_AMOUNT" -> "Amount must be a positive number of satoshis";
            case "INVALID_FEES" -> "Fees must not be negative";
            case "INVALID_INVOICE" -> "Invoice is required";
            case "INVALID_MESSAGE" -> "Message is required";
            case "INVALID_PUBKEY" -> "Public key is required";
            case "INVALID_SIGNATURE" -> "Signature is required";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
