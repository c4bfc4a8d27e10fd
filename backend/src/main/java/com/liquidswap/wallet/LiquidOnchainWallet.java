package com.liquidswap.wallet;

import com.liquidswap.domain.LiquidNetwork;
import com.liquidswap.domain.ReservedAddress;
import com.liquidswap.domain.WalletTransaction;
import com.liquidswap.error.PaymentErrorKind;
import com.liquidswap.error.PaymentException;
import com.liquidswap.persist.Persister;
import com.liquidswap.wallet.lwk.AddressResult;
import com.liquidswap.wallet.lwk.DescriptorWallet;
import com.liquidswap.wallet.lwk.DescriptorWalletException;
import com.liquidswap.wallet.lwk.DescriptorWalletFactory;
import com.liquidswap.wallet.lwk.ElectrumClient;
import com.liquidswap.wallet.lwk.ElectrumClientFactory;
import com.liquidswap.wallet.lwk.ElectrumSettings;
import com.liquidswap.wallet.lwk.FinalizedTransaction;
import com.liquidswap.wallet.lwk.InsufficientFundsException;
import com.liquidswap.wallet.lwk.Pset;
import com.liquidswap.wallet.lwk.PsetDetails;
import com.liquidswap.wallet.lwk.UpdateHeightTooOldException;
import com.liquidswap.wallet.lwk.WalletStoreException;
import com.liquidswap.wallet.signer.LightningMessageSigning;
import com.liquidswap.wallet.signer.SdkSigner;
import com.liquidswap.wallet.signer.SignerException;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Utils;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Onchain wallet over a Liquid descriptor wallet. The descriptor wallet and the Electrum client are each owned
 * behind one lock; when both are needed the client lock is taken first.
 */
@Slf4j
public class LiquidOnchainWallet implements OnchainWallet {

    /** Addresses derived past the last known index that a full scan still covers. */
    static final int SCAN_INDEX_BUFFER = 5;

    private static final Pattern ASSET_ID = Pattern.compile("^[0-9a-fA-F]{64}$");

    private final LiquidNetwork network;
    private final Path storeDir;
    private final String electrumUrl;
    private final SdkSigner signer;
    private final DescriptorWalletFactory walletFactory;
    private final ElectrumClientFactory electrumClientFactory;
    private final Persister persister;
    private final LiquidAddressValidator addressValidator;
    private final String descriptor;

    private final ReentrantLock walletLock = new ReentrantLock();
    private final ReentrantLock clientLock = new ReentrantLock();
    private DescriptorWallet wallet;
    private ElectrumClient electrumClient;

    public LiquidOnchainWallet(LiquidNetwork network,
                               Path dataDir,
                               String electrumUrl,
                               SdkSigner signer,
                               DescriptorWalletFactory walletFactory,
                               ElectrumClientFactory electrumClientFactory,
                               Persister persister) {
        this.network = network;
        this.storeDir = dataDir.resolve(network.storeName());
        this.electrumUrl = electrumUrl;
        this.signer = signer;
        this.walletFactory = walletFactory;
        this.electrumClientFactory = electrumClientFactory;
        this.persister = persister;
        this.addressValidator = new LiquidAddressValidator(network);
        this.descriptor = signerCall(() -> WalletDescriptors.singlesigWpkh(signer, network));
        this.wallet = openWallet();
    }

    @Override
    public LiquidNetwork network() {
        return network;
    }

    @Override
    public List<WalletTransaction> transactions() {
        return withWallet(w -> {
            try {
                return w.transactions();
            } catch (DescriptorWalletException e) {
                throw PaymentException.generic("Failed to fetch wallet transactions: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public Map<String, WalletTransaction> transactionsByTxId() {
        Map<String, WalletTransaction> byTxId = new LinkedHashMap<>();
        for (WalletTransaction tx : transactions()) {
            byTxId.put(tx.getTxid(), tx);
        }
        return byTxId;
    }

    @Override
    public FinalizedTransaction buildTx(Double feeRateSatPerKvb, String recipient, String assetId, long amountSat) {
        validateRecipient(recipient);
        if (assetId == null || !ASSET_ID.matcher(assetId).matches()) {
            throw PaymentException.generic("Invalid asset id: " + assetId);
        }
        return withWallet(w -> {
            Pset pset;
            try {
                pset = isNativeAsset(assetId)
                        ? w.buildLbtcTx(recipient, amountSat, feeRateSatPerKvb)
                        : w.buildAssetTx(recipient, amountSat, assetId, feeRateSatPerKvb);
            } catch (InsufficientFundsException e) {
                throw PaymentException.insufficientFunds();
            } catch (DescriptorWalletException e) {
                throw PaymentException.lwkError(e.getMessage(), e);
            }
            return signAndFinalize(w, pset);
        });
    }

    @Override
    public FinalizedTransaction buildDrainTx(Double feeRateSatPerKvb, String recipient, Long enforceAmountSat) {
        validateRecipient(recipient);
        return withWallet(w -> {
            Pset pset;
            try {
                pset = w.buildDrainTx(recipient, feeRateSatPerKvb);
            } catch (InsufficientFundsException e) {
                throw PaymentException.insufficientFunds();
            } catch (DescriptorWalletException e) {
                throw PaymentException.lwkError(e.getMessage(), e);
            }
            if (enforceAmountSat != null) {
                PsetDetails details;
                try {
                    details = w.details(pset);
                } catch (DescriptorWalletException e) {
                    throw PaymentException.lwkError(e.getMessage(), e);
                }
                long balanceSat = details.balanceOf(w.policyAsset());
                long netOutflow = -balanceSat - details.fee();
                if (netOutflow != enforceAmountSat) {
                    throw PaymentException.generic("Drain tx amount " + balanceSat
                            + " sat doesn't match enforce amount " + enforceAmountSat + " sat");
                }
            }
            return signAndFinalize(w, pset);
        });
    }

    @Override
    public FinalizedTransaction buildTxOrDrainTx(Double feeRateSatPerKvb, String recipient, String assetId,
                                                 long amountSat) {
        try {
            return buildTx(feeRateSatPerKvb, recipient, assetId, amountSat);
        } catch (PaymentException e) {
            if (!e.is(PaymentErrorKind.INSUFFICIENT_FUNDS) || !isNativeAsset(assetId)) {
                throw e;
            }
            log.warn("Cannot build tx due to insufficient funds, attempting to build drain tx for {} sat", amountSat);
            return buildDrainTx(feeRateSatPerKvb, recipient, amountSat);
        }
    }

    @Override
    public AddressResult nextUnusedAddress() {
        return withWallet(w -> {
            int tip = walletTip(w);
            Optional<ReservedAddress> reserved = persister.nextExpiredReservedAddress(tip);
            if (reserved.isPresent()) {
                ReservedAddress r = reserved.get();
                log.debug("Reusing reserved address {} that expired at height {}", r.getAddress(),
                        r.getExpiryBlockHeight());
                return new AddressResult(r.getAddress(), r.getDerivationIndex(), r.getScriptPubKey());
            }
            Optional<Integer> nextIndex = persister.nextDerivationIndex();
            AddressResult result;
            try {
                result = w.address(nextIndex.orElse(null));
            } catch (DescriptorWalletException e) {
                throw PaymentException.lwkError(e.getMessage(), e);
            }
            log.debug("Issued address {} with derivation index {}", result.address(), result.index());
            if (nextIndex.isEmpty()) {
                persister.setLastDerivationIndex(result.index());
            }
            return result;
        });
    }

    @Override
    public int tip() {
        return withWallet(this::walletTip);
    }

    @Override
    public long balanceSat() {
        return withWallet(w -> {
            try {
                return w.balance().getOrDefault(w.policyAsset(), 0L);
            } catch (DescriptorWalletException e) {
                throw PaymentException.lwkError(e.getMessage(), e);
            }
        });
    }

    @Override
    public String broadcast(FinalizedTransaction tx) {
        clientLock.lock();
        try {
            ElectrumClient client = electrumClient();
            try {
                String txid = client.broadcast(tx);
                log.info("Broadcast transaction {}", txid);
                return txid;
            } catch (DescriptorWalletException e) {
                throw PaymentException.sendError("Failed to broadcast " + tx.txid() + ": " + e.getMessage(), e);
            }
        } finally {
            clientLock.unlock();
        }
    }

    @Override
    public void fullScan() {
        long started = System.nanoTime();
        clientLock.lock();
        try {
            ElectrumClient client = electrumClient();
            walletLock.lock();
            try {
                int lastDerivationIndex = persister.getLastDerivationIndex().orElse(0);
                int scanToIndex = lastDerivationIndex + SCAN_INDEX_BUFFER;
                try {
                    wallet.fullScanToIndex(client, scanToIndex);
                } catch (UpdateHeightTooOldException e) {
                    log.warn("Full scan failed with update height too old, wiping wallet store and retrying: {}",
                            e.getMessage());
                    wallet = rescanFreshStore(client, scanToIndex);
                } catch (DescriptorWalletException e) {
                    throw PaymentException.lwkError("Full scan failed: " + e.getMessage(), e);
                }
                persister.setLastScannedDerivationIndex(lastDerivationIndex);
            } finally {
                walletLock.unlock();
            }
        } finally {
            clientLock.unlock();
        }
        log.info("Wallet full scan completed in {} ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    }

    @Override
    public void emptyCache() {
        walletLock.lock();
        try {
            wipeStore();
            wallet = openStore();
        } finally {
            walletLock.unlock();
        }
        log.info("Wallet cache emptied at {}", storeDir);
    }

    @Override
    public String signMessage(String message) {
        byte[] hash = LightningMessageSigning.messageHash(message);
        byte[] signature = signerCall(() -> signer.signEcdsaRecoverable(hash));
        return LightningMessageSigning.encode(signature);
    }

    @Override
    public boolean checkMessage(String message, String pubkey, String signature) {
        if (pubkey == null || pubkey.isBlank()) {
            throw PaymentException.generic("Public key is required");
        }
        ECKey key;
        try {
            key = ECKey.fromPublicOnly(Utils.HEX.decode(pubkey.trim().toLowerCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw PaymentException.generic("Invalid public key: " + pubkey, e);
        }
        return LightningMessageSigning.verify(message, key, signature);
    }

    @Override
    public String pubkey() {
        return signerCall(signer::pubkey);
    }

    @Override
    public String fingerprint() {
        return signerCall(signer::fingerprint);
    }

    String descriptor() {
        return descriptor;
    }

    private DescriptorWallet rescanFreshStore(ElectrumClient client, int scanToIndex) {
        try {
            wipeStore();
            DescriptorWallet fresh = openStore();
            fresh.fullScanToIndex(client, scanToIndex);
            return fresh;
        } catch (DescriptorWalletException e) {
            throw PaymentException.generic("Full scan retry on a fresh wallet store failed: " + e.getMessage(), e);
        }
    }

    private FinalizedTransaction signAndFinalize(DescriptorWallet w, Pset pset) {
        try {
            signer.sign(pset);
        } catch (SignerException e) {
            throw PaymentException.signerError("Failed to sign transaction: " + e.getMessage(), e);
        }
        try {
            return w.finalizeTx(pset);
        } catch (DescriptorWalletException e) {
            throw PaymentException.lwkError(e.getMessage(), e);
        }
    }

    private int walletTip(DescriptorWallet w) {
        try {
            return w.tip();
        } catch (DescriptorWalletException e) {
            throw PaymentException.lwkError(e.getMessage(), e);
        }
    }

    private <T> T withWallet(Function<DescriptorWallet, T> action) {
        walletLock.lock();
        try {
            return action.apply(wallet);
        } finally {
            walletLock.unlock();
        }
    }

    /** Caller holds the client lock. */
    private ElectrumClient electrumClient() {
        if (electrumClient == null) {
            try {
                electrumClient = electrumClientFactory.connect(ElectrumSettings.forNetwork(network, electrumUrl));
            } catch (DescriptorWalletException e) {
                throw PaymentException.lwkError("Failed to connect Electrum client: " + e.getMessage(), e);
            }
        }
        return electrumClient;
    }

    private DescriptorWallet openWallet() {
        try {
            return walletFactory.open(network, descriptor, storeDir);
        } catch (WalletStoreException | UpdateHeightTooOldException e) {
            log.warn("Wallet store at {} could not be opened, wiping and retrying: {}", storeDir, e.getMessage());
            wipeStore();
            return openStore();
        } catch (DescriptorWalletException e) {
            throw PaymentException.lwkError(e.getMessage(), e);
        }
    }

    private DescriptorWallet openStore() {
        try {
            return walletFactory.open(network, descriptor, storeDir);
        } catch (DescriptorWalletException e) {
            throw PaymentException.lwkError(e.getMessage(), e);
        }
    }

    private void wipeStore() {
        try {
            FileSystemUtils.deleteRecursively(storeDir);
        } catch (IOException e) {
            throw PaymentException.generic("Failed to wipe wallet store " + storeDir, e);
        }
    }

    private void validateRecipient(String recipient) {
        if (!addressValidator.isValid(recipient)) {
            throw PaymentException.generic("Recipient address " + recipient + " is not a valid Liquid address");
        }
    }

    private boolean isNativeAsset(String assetId) {
        return network.lbtcAssetId().equalsIgnoreCase(assetId);
    }

    private <T> T signerCall(Supplier<T> op) {
        try {
            return op.get();
        } catch (SignerException e) {
            throw PaymentException.signerError(e.getMessage(), e);
        }
    }
}
