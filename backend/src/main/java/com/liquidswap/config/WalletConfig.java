package com.liquidswap.config;

import com.liquidswap.common.KeyedLockRegistry;
import com.liquidswap.persist.Persister;
import com.liquidswap.wallet.LiquidOnchainWallet;
import com.liquidswap.wallet.OnchainWallet;
import com.liquidswap.wallet.lwk.DescriptorWalletFactory;
import com.liquidswap.wallet.lwk.ElectrumClientFactory;
import com.liquidswap.wallet.signer.MnemonicSigner;
import com.liquidswap.wallet.signer.SdkSigner;
import com.liquidswap.wallet.signer.Signer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the signer adapter and the onchain wallet engine. The descriptor-wallet library and the Electrum transport
 * ({@link DescriptorWalletFactory}, {@link ElectrumClientFactory}) are beans of the embedding application.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(LiquidSdkProperties.class)
public class WalletConfig {

    /** Only when {@code liquidswap.sdk.mnemonic} is set; otherwise a Signer bean must be supplied. */
    @Bean
    @ConditionalOnProperty(prefix = "liquidswap.sdk", name = "mnemonic")
    public Signer mnemonicSigner(LiquidSdkProperties properties) {
        return new MnemonicSigner(properties.getMnemonic(), properties.getPassphrase(), properties.getNetwork());
    }

    @Bean
    public SdkSigner sdkSigner(Signer signer, LiquidSdkProperties properties) {
        return new SdkSigner(signer, properties.getNetwork());
    }

    @Bean
    public OnchainWallet onchainWallet(LiquidSdkProperties properties,
                                       SdkSigner sdkSigner,
                                       DescriptorWalletFactory descriptorWalletFactory,
                                       ElectrumClientFactory electrumClientFactory,
                                       Persister persister) {
        log.info("Opening {} wallet under {}", properties.getNetwork(), properties.getDataDir());
        return new LiquidOnchainWallet(
                properties.getNetwork(),
                Path.of(properties.getDataDir()),
                properties.electrumUrlOrDefault(),
                sdkSigner,
                descriptorWalletFactory,
                electrumClientFactory,
                persister);
    }

    /** Per-swap-id locks shared by recovery and payment flows. */
    @Bean
    public KeyedLockRegistry swapLocks() {
        return new KeyedLockRegistry();
    }
}
