package com.liquidswap.wallet.signer;

import com.liquidswap.domain.LiquidNetwork;
import com.liquidswap.wallet.lwk.Pset;
import com.liquidswap.wallet.lwk.SigningRequest;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Utils;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.params.MainNetParams;
import org.bitcoinj.params.TestNet3Params;

import java.util.function.Supplier;

/**
 * Adapts a user {@link Signer} to what the wallet needs: PSET signing, descriptor key material and identity.
 * Any failure of the wrapped signer surfaces as {@link SignerException}.
 */
@Slf4j
public class SdkSigner {

    private final Signer signer;
    private final NetworkParameters params;

    public SdkSigner(Signer signer, LiquidNetwork network) {
        this.signer = signer;
        this.params = bitcoinParams(network);
    }

    /** Key serialization parameters: xpub on mainnet, tpub elsewhere. */
    public static NetworkParameters bitcoinParams(LiquidNetwork network) {
        return network.isMainnet() ? MainNetParams.get() : TestNet3Params.get();
    }

    public String xpub() {
        return call(signer::xpub, "xpub");
    }

    public String deriveXpub(String derivationPath) {
        return call(() -> signer.deriveXpub(derivationPath), "deriveXpub");
    }

    /** Hex-encoded compressed public key of the master node. */
    public String pubkey() {
        return masterKey().getPublicKeyAsHex();
    }

    /** Hex-encoded 4-byte master key fingerprint. */
    public String fingerprint() {
        return String.format("%08x", masterKey().getFingerprint());
    }

    public String slip77MasterBlindingKeyHex() {
        byte[] key = call(signer::slip77MasterBlindingKey, "slip77MasterBlindingKey");
        if (key == null || key.length != 32) {
            throw new SignerException("SLIP-77 master blinding key must be 32 bytes");
        }
        return Utils.HEX.encode(key);
    }

    public byte[] signEcdsaRecoverable(byte[] hash) {
        byte[] sig = call(() -> signer.signEcdsaRecoverable(hash), "signEcdsaRecoverable");
        if (sig == null || sig.length != 65) {
            throw new SignerException("Recoverable signature must be 65 bytes");
        }
        return sig;
    }

    /**
     * Adds a signature for every input the PSET asks us to sign.
     *
     * @return number of inputs signed
     */
    public int sign(Pset pset) {
        int signed = 0;
        for (SigningRequest request : pset.signingRequests()) {
            String path = request.derivationPath();
            DeterministicKey key = parseXpub(deriveXpub(path));
            byte[] der = call(() -> signer.signEcdsa(request.sighash(), path), "signEcdsa");
            pset.addSignature(request.inputIndex(), key.getPubKey(), der);
            signed++;
        }
        log.debug("Signed {} PSET inputs", signed);
        return signed;
    }

    private DeterministicKey masterKey() {
        return parseXpub(xpub());
    }

    private DeterministicKey parseXpub(String xpub) {
        try {
            return DeterministicKey.deserializeB58(xpub, params);
        } catch (IllegalArgumentException e) {
            throw new SignerException("Signer returned an invalid extended key", e);
        }
    }

    private static <T> T call(Supplier<T> op, String name) {
        try {
            return op.get();
        } catch (SignerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SignerException("Signer " + name + " failed: " + e.getMessage(), e);
        }
    }
}
