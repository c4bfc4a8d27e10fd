package com.liquidswap.api.controller;

import com.liquidswap.api.dto.PaymentErrorBody;
import com.liquidswap.error.PaymentErrorKind;
import com.liquidswap.error.PaymentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps every {@link PaymentException} to {@link PaymentErrorBody}. The body always names the kind; the status
 * separates caller mistakes (4xx) from wallet, store and network faults (5xx).
 */
@Slf4j
@RestControllerAdvice
public class PaymentErrorHandler {

    @ExceptionHandler(PaymentException.class)
    public ResponseEntity<PaymentErrorBody> handlePayment(PaymentException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("Payment call failed: {}", ex.getMessage(), ex);
        } else {
            log.debug("Payment call rejected: {}", ex.getMessage());
        }
        return ResponseEntity.status(status).body(PaymentErrorBody.of(ex));
    }

    static HttpStatus statusOf(PaymentErrorKind kind) {
        return switch (kind) {
            case ALREADY_CLAIMED, REFUNDED -> HttpStatus.CONFLICT;
            case AMOUNT_OUT_OF_RANGE, GENERIC, INVALID_OR_EXPIRED_FEES, INVALID_INVOICE, INVALID_PREIMAGE ->
                    HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_FUNDS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case PAIRS_NOT_FOUND -> HttpStatus.SERVICE_UNAVAILABLE;
            case LWK_ERROR, SEND_ERROR -> HttpStatus.BAD_GATEWAY;
            case PERSIST_ERROR, SIGNER_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
