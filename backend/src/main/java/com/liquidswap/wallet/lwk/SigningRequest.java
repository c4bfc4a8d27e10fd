package com.liquidswap.wallet.lwk;

/**
 * One input to sign: the sighash to sign and the BIP32 path (from the master key) of the key that owns it.
 */
public record SigningRequest(int inputIndex, byte[] sighash, String derivationPath) {
}
