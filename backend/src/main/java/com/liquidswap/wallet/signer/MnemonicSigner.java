package com.liquidswap.wallet.signer;

import com.liquidswap.domain.LiquidNetwork;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Utils;
import org.bitcoinj.crypto.ChildNumber;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDKeyDerivation;
import org.bitcoinj.crypto.HDUtils;
import org.bitcoinj.crypto.MnemonicCode;
import org.bitcoinj.crypto.MnemonicException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * BIP39 mnemonic signer holding the seed in memory.
 */
public class MnemonicSigner implements Signer {

    private static final byte[] SLIP77_ROOT_KEY = "Symmetric key seed".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] SLIP77_LABEL = "\0SLIP-0077".getBytes(StandardCharsets.US_ASCII);

    private final DeterministicKey masterKey;
    private final byte[] slip77Key;
    private final NetworkParameters params;

    public MnemonicSigner(String mnemonic, String passphrase, LiquidNetwork network) {
        List<String> words = Arrays.asList(mnemonic.trim().split("\\s+"));
        try {
            MnemonicCode.INSTANCE.check(words);
        } catch (MnemonicException e) {
            throw new SignerException("Invalid mnemonic: " + e.getClass().getSimpleName(), e);
        }
        byte[] seed = MnemonicCode.toSeed(words, passphrase != null ? passphrase : "");
        this.masterKey = HDKeyDerivation.createMasterPrivateKey(seed);
        this.slip77Key = slip77(seed);
        this.params = SdkSigner.bitcoinParams(network);
    }

    @Override
    public String xpub() {
        return masterKey.serializePubB58(params);
    }

    @Override
    public String deriveXpub(String derivationPath) {
        return derive(derivationPath).serializePubB58(params);
    }

    @Override
    public byte[] signEcdsa(byte[] hash, String derivationPath) {
        return derive(derivationPath).sign(Sha256Hash.wrap(hash)).encodeToDER();
    }

    @Override
    public byte[] signEcdsaRecoverable(byte[] hash) {
        Sha256Hash digest = Sha256Hash.wrap(hash);
        ECKey.ECDSASignature sig = masterKey.sign(digest);
        int recId = -1;
        for (int i = 0; i < 4; i++) {
            ECKey recovered = ECKey.recoverFromSignature(i, sig, digest, true);
            if (recovered != null && Arrays.equals(recovered.getPubKey(), masterKey.getPubKey())) {
                recId = i;
                break;
            }
        }
        if (recId < 0) {
            throw new SignerException("Could not construct a recoverable signature");
        }
        byte[] out = new byte[65];
        out[0] = (byte) (31 + recId);
        System.arraycopy(Utils.bigIntegerToBytes(sig.r, 32), 0, out, 1, 32);
        System.arraycopy(Utils.bigIntegerToBytes(sig.s, 32), 0, out, 33, 32);
        return out;
    }

    @Override
    public byte[] slip77MasterBlindingKey() {
        return slip77Key.clone();
    }

    private DeterministicKey derive(String derivationPath) {
        List<ChildNumber> path;
        try {
            path = Bip32Paths.parse(derivationPath);
        } catch (IllegalArgumentException e) {
            throw new SignerException(e.getMessage(), e);
        }
        DeterministicKey key = masterKey;
        for (ChildNumber child : path) {
            key = HDKeyDerivation.deriveChildKey(key, child);
        }
        return key;
    }

    private static byte[] slip77(byte[] seed) {
        byte[] root = HDUtils.hmacSha512(SLIP77_ROOT_KEY, seed);
        byte[] node = HDUtils.hmacSha512(Arrays.copyOfRange(root, 0, 32), SLIP77_LABEL);
        return Arrays.copyOfRange(node, 32, 64);
    }
}
