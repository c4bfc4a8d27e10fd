package com.liquidswap.wallet.signer;

import com.liquidswap.common.ZBase32;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Lightning-style message signatures: sha256d("Lightning Signed Message:" || msg), 65-byte recoverable
 * signature, z-base-32 text.
 */
public final class LightningMessageSigning {

    static final byte[] PREFIX = "Lightning Signed Message:".getBytes(StandardCharsets.UTF_8);

    private LightningMessageSigning() {
    }

    public static byte[] messageHash(String message) {
        byte[] body = message.getBytes(StandardCharsets.UTF_8);
        byte[] data = new byte[PREFIX.length + body.length];
        System.arraycopy(PREFIX, 0, data, 0, PREFIX.length);
        System.arraycopy(body, 0, data, PREFIX.length, body.length);
        return Sha256Hash.hashTwice(data);
    }

    public static String encode(byte[] recoverableSignature) {
        return ZBase32.encode(recoverableSignature);
    }

    /**
     * True when {@code signature} recovers to {@code publicKey} for {@code message}. Malformed signatures
     * yield false.
     */
    public static boolean verify(String message, ECKey publicKey, String signature) {
        byte[] sig;
        try {
            sig = ZBase32.decode(signature);
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (sig.length != 65) {
            return false;
        }
        int header = sig[0] & 0xff;
        if (header < 27 || header > 34) {
            return false;
        }
        boolean compressed = header >= 31;
        int recId = (header - 27) & 3;
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(sig, 1, 33));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(sig, 33, 65));
        if (r.signum() == 0 || s.signum() == 0) {
            return false;
        }
        try {
            ECKey recovered = ECKey.recoverFromSignature(recId, new ECKey.ECDSASignature(r, s),
                    Sha256Hash.wrap(messageHash(message)), compressed);
            return recovered != null && recovered.getPubKeyPoint().equals(publicKey.getPubKeyPoint());
        } catch (IllegalArgumentException | ArithmeticException e) {
            return false;
        }
    }
}
