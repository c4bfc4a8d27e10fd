package com.liquidswap.wallet;

import com.liquidswap.domain.LiquidNetwork;
import com.liquidswap.wallet.signer.SdkSigner;

/**
 * Confidential single-sig P2WPKH descriptors with SLIP-77 blinding.
 */
public final class WalletDescriptors {

    private WalletDescriptors() {
    }

    public static String accountPath(LiquidNetwork network) {
        return "m/84'/" + network.coinType() + "'/0'";
    }

    /**
     * {@code ct(slip77(<key>),elwpkh([<fingerprint>/84'/<coin>'/0']<xpub>/<0;1>/*))}
     */
    public static String singlesigWpkh(SdkSigner signer, LiquidNetwork network) {
        String path = accountPath(network);
        String accountXpub = signer.deriveXpub(path);
        return "ct(slip77(" + signer.slip77MasterBlindingKeyHex() + "),elwpkh(["
                + signer.fingerprint() + path.substring(1) + "]" + accountXpub + "/<0;1>/*))";
    }
}
