package com.liquidswap.sdk.model;

/**
 * One entry of the payment list: a wallet transaction, a swap, or both when the swap's transaction is known.
 *
 * @param txId      wallet transaction, null while a swap has no transaction yet
 * @param swapId    null for plain onchain transfers
 * @param timestamp unix seconds; null for mempool transactions
 */
public record Payment(
        String txId,
        String swapId,
        Long timestamp,
        long amountSat,
        long feesSat,
        PaymentType paymentType,
        PaymentStatus status
) {
}
