package com.liquidswap.wallet.lwk;

import java.util.List;

/**
 * Partially signed Elements transaction under construction.
 */
public interface Pset {

    /** Inputs that still need a signature from one of our keys. */
    List<SigningRequest> signingRequests();

    void addSignature(int inputIndex, byte[] publicKey, byte[] derSignature);

    String toBase64();
}
