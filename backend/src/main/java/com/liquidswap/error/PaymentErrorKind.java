package com.liquidswap.error;

/**
 * Wire-visible payment error tags. The numeric code is the flat tag used across the call boundary;
 * {@code carriesErr}/{@code carriesRefundTxId} say which payload fields travel with it.
 */
public enum PaymentErrorKind {

    ALREADY_CLAIMED(0, false, false),
    AMOUNT_OUT_OF_RANGE(1, false, false),
    GENERIC(2, true, false),
    INVALID_OR_EXPIRED_FEES(3, false, false),
    INSUFFICIENT_FUNDS(4, false, false),
    INVALID_INVOICE(5, false, false),
    INVALID_PREIMAGE(6, false, false),
    LWK_ERROR(7, true, false),
    PAIRS_NOT_FOUND(8, false, false),
    PERSIST_ERROR(9, false, false),
    REFUNDED(10, true, true),
    SEND_ERROR(11, true, false),
    SIGNER_ERROR(12, true, false);

    private final int code;
    private final boolean carriesErr;
    private final boolean carriesRefundTxId;

    PaymentErrorKind(int code, boolean carriesErr, boolean carriesRefundTxId) {
        this.code = code;
        this.carriesErr = carriesErr;
        this.carriesRefundTxId = carriesRefundTxId;
    }

    public int code() {
        return code;
    }

    public boolean carriesErr() {
        return carriesErr;
    }

    public boolean carriesRefundTxId() {
        return carriesRefundTxId;
    }

    /**
     * Decodes a flat tag.
     *
     * @throws IllegalStateException when the tag is outside the known range; this is an internal fault,
     *                               not a payment error
     */
    public static PaymentErrorKind fromCode(int code) {
        for (PaymentErrorKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new IllegalStateException("Unknown payment error tag: " + code);
    }
}
