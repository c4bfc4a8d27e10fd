package com.liquidswap.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.liquidswap.error.PaymentException;

import java.time.Instant;

/**
 * Flat encoding of a {@link PaymentException}: kind name, numeric tag and the payload fields of that kind.
 * Absent payload fields are omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentErrorBody(String error, int code, String err, String refundTxId, Instant timestamp) {

    public static PaymentErrorBody of(PaymentException e) {
        return new PaymentErrorBody(e.getKind().name(), e.getKind().code(), e.getErr(), e.getRefundTxId(),
                Instant.now());
    }

    /** Inverse of {@link #of}; an unknown code is an {@link IllegalStateException}. */
    public PaymentException toException() {
        return PaymentException.decode(code, err, refundTxId);
    }
}
