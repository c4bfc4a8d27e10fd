package com.liquidswap.config;

import com.liquidswap.domain.LiquidNetwork;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Wallet identity and local storage. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "liquidswap.sdk")
@NoArgsConstructor
@Getter
@Setter
public class LiquidSdkProperties {

    /** Liquid network the wallet runs on. Default TESTNET. */
    private LiquidNetwork network = LiquidNetwork.TESTNET;

    /** Root of the local wallet stores and backups. One sub-directory per network. */
    private String dataDir = "./.data";

    /** Electrum server as host:port. Empty means the public Blockstream server of the network. */
    private String electrumUrl = "";

    /** BIP-39 mnemonic. When empty no mnemonic signer is created and a Signer bean must be supplied. */
    private String mnemonic = "";

    /** Optional BIP-39 passphrase. */
    private String passphrase = "";

    public String electrumUrlOrDefault() {
        if (electrumUrl != null && !electrumUrl.isBlank()) {
            return electrumUrl;
        }
        return switch (network) {
            case MAINNET -> "blockstream.info:995";
            case TESTNET -> "blockstream.info:465";
            case REGTEST -> "localhost:19002";
        };
    }
}
