package com.liquidswap.error;

import java.util.Objects;

/**
 * The single error type surfaced by every wallet, recovery and payment entry point. Instances are created only
 * through the per-kind factories so payload fields always match {@link PaymentErrorKind}.
 */
public final class PaymentException extends RuntimeException {

    private final PaymentErrorKind kind;
    private final String err;
    private final String refundTxId;

    private PaymentException(PaymentErrorKind kind, String err, String refundTxId, Throwable cause) {
        super(message(kind, err, refundTxId), cause);
        this.kind = kind;
        this.err = err;
        this.refundTxId = refundTxId;
    }

    public static PaymentException alreadyClaimed() {
        return new PaymentException(PaymentErrorKind.ALREADY_CLAIMED, null, null, null);
    }

    public static PaymentException amountOutOfRange() {
        return new PaymentException(PaymentErrorKind.AMOUNT_OUT_OF_RANGE, null, null, null);
    }

    public static PaymentException generic(String err) {
        return new PaymentException(PaymentErrorKind.GENERIC, Objects.requireNonNull(err), null, null);
    }

    public static PaymentException generic(String err, Throwable cause) {
        return new PaymentException(PaymentErrorKind.GENERIC, Objects.requireNonNull(err), null, cause);
    }

    public static PaymentException invalidOrExpiredFees() {
        return new PaymentException(PaymentErrorKind.INVALID_OR_EXPIRED_FEES, null, null, null);
    }

    public static PaymentException insufficientFunds() {
        return new PaymentException(PaymentErrorKind.INSUFFICIENT_FUNDS, null, null, null);
    }

    public static PaymentException invalidInvoice() {
        return new PaymentException(PaymentErrorKind.INVALID_INVOICE, null, null, null);
    }

    public static PaymentException invalidPreimage() {
        return new PaymentException(PaymentErrorKind.INVALID_PREIMAGE, null, null, null);
    }

    public static PaymentException lwkError(String err, Throwable cause) {
        return new PaymentException(PaymentErrorKind.LWK_ERROR, Objects.requireNonNull(err), null, cause);
    }

    public static PaymentException pairsNotFound() {
        return new PaymentException(PaymentErrorKind.PAIRS_NOT_FOUND, null, null, null);
    }

    public static PaymentException persistError(Throwable cause) {
        return new PaymentException(PaymentErrorKind.PERSIST_ERROR, null, null, cause);
    }

    public static PaymentException refunded(String err, String refundTxId) {
        return new PaymentException(PaymentErrorKind.REFUNDED, Objects.requireNonNull(err),
                Objects.requireNonNull(refundTxId), null);
    }

    public static PaymentException sendError(String err, Throwable cause) {
        return new PaymentException(PaymentErrorKind.SEND_ERROR, Objects.requireNonNull(err), null, cause);
    }

    public static PaymentException signerError(String err, Throwable cause) {
        return new PaymentException(PaymentErrorKind.SIGNER_ERROR, Objects.requireNonNull(err), null, cause);
    }

    /**
     * Rebuilds an error from its flat encoding (tag + payload).
     *
     * @throws IllegalStateException for an unknown tag
     */
    public static PaymentException decode(int code, String err, String refundTxId) {
        PaymentErrorKind kind = PaymentErrorKind.fromCode(code);
        return new PaymentException(kind,
                kind.carriesErr() ? Objects.requireNonNullElse(err, "") : null,
                kind.carriesRefundTxId() ? Objects.requireNonNullElse(refundTxId, "") : null,
                null);
    }

    public PaymentErrorKind getKind() {
        return kind;
    }

    /** Payload message; null for kinds that carry none. */
    public String getErr() {
        return err;
    }

    /** Refund transaction id; only set for {@link PaymentErrorKind#REFUNDED}. */
    public String getRefundTxId() {
        return refundTxId;
    }

    public boolean is(PaymentErrorKind other) {
        return kind == other;
    }

    private static String message(PaymentErrorKind kind, String err, String refundTxId) {
        StringBuilder sb = new StringBuilder(kind.name());
        if (err != null) {
            sb.append(": ").append(err);
        }
        if (refundTxId != null) {
            sb.append(" (refund tx ").append(refundTxId).append(')');
        }
        return sb.toString();
    }
}
