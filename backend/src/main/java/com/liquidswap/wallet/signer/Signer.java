package com.liquidswap.wallet.signer;

/**
 * Key-management capability supplied by the wallet owner. Keys never leave the implementation; everything
 * returned is public material or a signature. Failures are reported as {@link SignerException}.
 */
public interface Signer {

    /** Base58 extended public key of the master node. */
    String xpub();

    /** Base58 extended public key at {@code derivationPath}, e.g. {@code m/84'/1'/0'}. */
    String deriveXpub(String derivationPath);

    /**
     * DER-encoded low-S ECDSA signature of a 32-byte hash with the key at {@code derivationPath}.
     */
    byte[] signEcdsa(byte[] hash, String derivationPath);

    /**
     * 65-byte compact recoverable signature {@code [31 + recId | r | s]} of a 32-byte hash with the master key.
     */
    byte[] signEcdsaRecoverable(byte[] hash);

    /** 32-byte SLIP-77 master blinding key. */
    byte[] slip77MasterBlindingKey();
}
