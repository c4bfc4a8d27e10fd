package com.liquidswap.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liquidswap.common.KeyedLockRegistry;
import com.liquidswap.config.LiquidSdkProperties;
import com.liquidswap.domain.Chain;
import com.liquidswap.domain.LiquidNetwork;
import com.liquidswap.domain.SwapKind;
import com.liquidswap.domain.SwapRecord;
import com.liquidswap.domain.SwapScripts;
import com.liquidswap.domain.SwapState;
import com.liquidswap.domain.WalletTransaction;
import com.liquidswap.error.PaymentException;
import com.liquidswap.persist.Persister;
import com.liquidswap.recovery.RecoveryReport;
import com.liquidswap.recovery.SwapRecoveryService;
import com.liquidswap.sdk.invoice.Bolt11Invoice;
import com.liquidswap.sdk.model.BackupFile;
import com.liquidswap.sdk.model.GetInfoRequest;
import com.liquidswap.sdk.model.GetInfoResponse;
import com.liquidswap.sdk.model.Payment;
import com.liquidswap.sdk.model.PaymentStatus;
import com.liquidswap.sdk.model.PaymentType;
import com.liquidswap.sdk.model.PrepareReceiveRequest;
import com.liquidswap.sdk.model.PrepareReceiveResponse;
import com.liquidswap.sdk.model.PrepareSendRequest;
import com.liquidswap.sdk.model.PrepareSendResponse;
import com.liquidswap.sdk.model.ReceivePaymentResponse;
import com.liquidswap.sdk.model.RestoreRequest;
import com.liquidswap.sdk.model.SendPaymentResponse;
import com.liquidswap.sdk.swapper.CreatedReverseSwap;
import com.liquidswap.sdk.swapper.CreatedSubmarineSwap;
import com.liquidswap.sdk.swapper.PairKind;
import com.liquidswap.sdk.swapper.ReverseSwapRequest;
import com.liquidswap.sdk.swapper.SubmarineSwapRequest;
import com.liquidswap.sdk.swapper.SwapPair;
import com.liquidswap.sdk.swapper.SwapPairService;
import com.liquidswap.sdk.swapper.Swapper;
import com.liquidswap.wallet.OnchainWallet;
import com.liquidswap.wallet.lwk.AddressResult;
import com.liquidswap.wallet.lwk.FinalizedTransaction;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Utils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Call-bridge facade: every operation either returns its response or throws a {@link PaymentException} of a
 * documented kind.
 */
@Slf4j
@Service
public class LiquidSdk {

    static final String BACKUP_DIR = "backup";
    static final String BACKUP_FILE = "backup.json";

    private final OnchainWallet wallet;
    private final Persister persister;
    private final SwapPairService pairService;
    private final Swapper swapper;
    private final SwapRecoveryService recoveryService;
    private final KeyedLockRegistry swapLocks;
    private final ObjectMapper objectMapper;
    private final LiquidNetwork network;
    private final Path dataDir;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public LiquidSdk(OnchainWallet wallet,
                     Persister persister,
                     SwapPairService pairService,
                     Swapper swapper,
                     SwapRecoveryService recoveryService,
                     KeyedLockRegistry swapLocks,
                     ObjectMapper objectMapper,
                     LiquidSdkProperties properties) {
        this(wallet, persister, pairService, swapper, recoveryService, swapLocks, objectMapper,
                properties.getNetwork(), Path.of(properties.getDataDir()), Clock.systemUTC());
    }

    LiquidSdk(OnchainWallet wallet,
              Persister persister,
              SwapPairService pairService,
              Swapper swapper,
              SwapRecoveryService recoveryService,
              KeyedLockRegistry swapLocks,
              ObjectMapper objectMapper,
              LiquidNetwork network,
              Path dataDir,
              Clock clock) {
        this.wallet = wallet;
        this.persister = persister;
        this.pairService = pairService;
        this.swapper = swapper;
        this.recoveryService = recoveryService;
        this.swapLocks = swapLocks;
        this.objectMapper = objectMapper;
        this.network = network;
        this.dataDir = dataDir;
        this.clock = clock;
    }

    public GetInfoResponse getInfo(GetInfoRequest request) {
        if (request != null && request.withScan()) {
            wallet.fullScan();
        }
        long pendingSend = 0;
        long pendingReceive = 0;
        for (SwapRecord swap : persister.listActiveSwaps()) {
            if (swap.getState() != SwapState.PENDING && swap.getState() != SwapState.WAITING_CONFIRMATION) {
                continue;
            }
            switch (swap.getKind()) {
                case SEND, CHAIN_SEND -> pendingSend += swap.getExpectedAmountSat();
                case RECEIVE, CHAIN_RECEIVE -> pendingReceive += swap.getExpectedAmountSat();
            }
        }
        return new GetInfoResponse(wallet.balanceSat(), pendingSend, pendingReceive, wallet.pubkey());
    }

    public PrepareReceiveResponse prepareReceivePayment(PrepareReceiveRequest request) {
        long payerAmountSat = request.payerAmountSat();
        SwapPair pair = pairService.pair(PairKind.REVERSE);
        if (payerAmountSat <= 0 || !pair.inRange(payerAmountSat)) {
            throw PaymentException.amountOutOfRange();
        }
        long feesSat = pair.fees(payerAmountSat);
        if (feesSat >= payerAmountSat) {
            throw PaymentException.amountOutOfRange();
        }
        log.debug("Receive of {} sat quoted at {} sat fees", payerAmountSat, feesSat);
        return new PrepareReceiveResponse(payerAmountSat, feesSat);
    }

    /**
     * Creates a reverse swap: the counterparty returns an invoice bound to our preimage hash and, once it is paid,
     * locks {@code payerAmountSat - feesSat} on Liquid for our claim address. The address stays reserved until the
     * swap's timeout height.
     */
    public ReceivePaymentResponse receivePayment(PrepareReceiveResponse request) {
        long payerAmountSat = request.payerAmountSat();
        SwapPair pair = pairService.pair(PairKind.REVERSE);
        if (!pair.inRange(payerAmountSat)) {
            throw PaymentException.amountOutOfRange();
        }
        if (pair.fees(payerAmountSat) != request.feesSat()) {
            throw PaymentException.invalidOrExpiredFees();
        }

        byte[] preimage = new byte[32];
        random.nextBytes(preimage);
        String preimageHash = Sha256Hash.of(preimage).toString();
        ECKey claimKey = new ECKey(random);
        AddressResult claimAddress = wallet.nextUnusedAddress();

        CreatedReverseSwap created = callSwapper(() -> swapper.createReverseSwap(new ReverseSwapRequest(
                payerAmountSat, preimageHash, claimKey.getPublicKeyAsHex(), claimAddress.address(), pair.hash())));
        long expectedOnchain = payerAmountSat - request.feesSat();
        if (created.onchainAmountSat() != expectedOnchain) {
            throw PaymentException.generic("Onchain amount " + created.onchainAmountSat()
                    + " sat does not match the expected " + expectedOnchain + " sat");
        }
        Bolt11Invoice invoice = Bolt11Invoice.parse(created.invoice());
        if (!invoice.isFor(network) || invoice.amountSat() == null || invoice.amountSat() != payerAmountSat) {
            throw PaymentException.invalidInvoice();
        }
        if (!preimageHash.equals(invoice.paymentHash())) {
            throw PaymentException.invalidPreimage();
        }

        persister.reserveAddress(claimAddress.address(), claimAddress.index(), claimAddress.scriptPubKey(),
                created.timeoutBlockHeight());
        SwapRecord record = SwapRecord.builder()
                .id(created.id())
                .kind(SwapKind.RECEIVE)
                .createdAt(clock.instant())
                .expectedAmountSat(created.onchainAmountSat())
                .feesSat(request.feesSat())
                .maxFeesSat(request.feesSat())
                .invoice(invoice.bolt11())
                .preimage(Utils.HEX.encode(preimage))
                .claimPrivateKey(claimKey.getPrivateKeyAsHex())
                .claimAddress(claimAddress.address())
                .userLeg(SwapScripts.builder()
                        .chain(Chain.LIQUID)
                        .lockupScript(created.lockupScript())
                        .claimScript(claimAddress.scriptPubKey())
                        .timeoutHeight(created.timeoutBlockHeight())
                        .build())
                .state(SwapState.CREATED)
                .build();
        persister.saveSwap(record);
        log.info("Receive swap {} created: {} sat, fees {} sat, timeout height {}", record.getId(), payerAmountSat,
                request.feesSat(), created.timeoutBlockHeight());
        return new ReceivePaymentResponse(record.getId(), invoice.bolt11());
    }

    public PrepareSendResponse prepareSendPayment(PrepareSendRequest request) {
        Bolt11Invoice invoice = parsePayable(request.invoice());
        rejectExisting(invoice.bolt11());
        SwapPair pair = pairService.pair(PairKind.SUBMARINE);
        long amountSat = invoice.amountSat();
        if (!pair.inRange(amountSat)) {
            throw PaymentException.amountOutOfRange();
        }
        return new PrepareSendResponse(invoice.bolt11(), pair.fees(amountSat));
    }

    /**
     * Pays a BOLT11 invoice through a submarine swap: the lockup is built (falling back to a wallet drain when the
     * exact amount cannot be covered), broadcast and the record moves to PENDING. The swap record is saved before
     * anything is broadcast.
     */
    public SendPaymentResponse sendPayment(PrepareSendResponse request) {
        Bolt11Invoice invoice = parsePayable(request.invoice());
        return swapLocks.withLock("invoice:" + invoice.bolt11(), () -> {
            rejectExisting(invoice.bolt11());
            SwapPair pair = pairService.pair(PairKind.SUBMARINE);
            long amountSat = invoice.amountSat();
            if (!pair.inRange(amountSat)) {
                throw PaymentException.amountOutOfRange();
            }
            long quotedFees = pair.fees(amountSat);
            if (quotedFees != request.feesSat()) {
                throw PaymentException.invalidOrExpiredFees();
            }

            ECKey refundKey = new ECKey(random);
            CreatedSubmarineSwap created = callSwapper(() -> swapper.createSubmarineSwap(new SubmarineSwapRequest(
                    invoice.bolt11(), refundKey.getPublicKeyAsHex(), pair.hash())));
            if (created.expectedAmountSat() > amountSat + quotedFees) {
                throw PaymentException.invalidOrExpiredFees();
            }
            SwapRecord record = SwapRecord.builder()
                    .id(created.id())
                    .kind(SwapKind.SEND)
                    .createdAt(clock.instant())
                    .expectedAmountSat(created.expectedAmountSat())
                    .feesSat(created.expectedAmountSat() - amountSat)
                    .maxFeesSat(quotedFees)
                    .invoice(invoice.bolt11())
                    .refundPrivateKey(refundKey.getPrivateKeyAsHex())
                    .userLeg(SwapScripts.builder()
                            .chain(Chain.LIQUID)
                            .lockupScript(created.lockupScript())
                            .timeoutHeight(created.timeoutBlockHeight())
                            .build())
                    .state(SwapState.CREATED)
                    .build();
            return swapLocks.withLock(record.getId(), () -> lockUp(record, created.lockupAddress()));
        });
    }

    public List<Payment> listPayments() {
        List<WalletTransaction> transactions = wallet.transactions();
        List<SwapRecord> swaps = persister.listSwaps();
        Map<String, SwapRecord> swapsByTxId = new HashMap<>();
        for (SwapRecord swap : swaps) {
            String txId = walletTxIdOf(swap);
            if (txId != null) {
                swapsByTxId.put(txId, swap);
            }
        }

        String lbtc = network.lbtcAssetId();
        List<Payment> payments = new ArrayList<>();
        Set<String> listedSwaps = new HashSet<>();
        for (WalletTransaction tx : transactions) {
            long delta = tx.balanceOf(lbtc);
            PaymentType type = delta >= 0 ? PaymentType.RECEIVE : PaymentType.SEND;
            SwapRecord swap = swapsByTxId.get(tx.getTxid());
            PaymentStatus status;
            long fees;
            if (swap != null) {
                listedSwaps.add(swap.getId());
                status = PaymentStatus.of(swap.getState());
                fees = swap.getFeesSat();
            } else {
                status = tx.isConfirmed() ? PaymentStatus.COMPLETE : PaymentStatus.PENDING;
                fees = type == PaymentType.SEND ? tx.getFee() : 0L;
            }
            Long timestamp = tx.getTimestamp() != null ? tx.getTimestamp().getEpochSecond() : null;
            payments.add(new Payment(tx.getTxid(), swap != null ? swap.getId() : null, timestamp, Math.abs(delta),
                    fees, type, status));
        }
        for (SwapRecord swap : swaps) {
            if (listedSwaps.contains(swap.getId())) {
                continue;
            }
            Long timestamp = swap.getCreatedAt() != null ? swap.getCreatedAt().getEpochSecond() : null;
            payments.add(new Payment(null, swap.getId(), timestamp, swap.getExpectedAmountSat(), swap.getFeesSat(),
                    paymentTypeOf(swap.getKind()), PaymentStatus.of(swap.getState())));
        }
        payments.sort(Comparator.comparing(Payment::timestamp, Comparator.nullsFirst(Comparator.<Long>reverseOrder())));
        return payments;
    }

    public void backup() {
        Path path = defaultBackupPath();
        BackupFile file = new BackupFile(BackupFile.CURRENT_VERSION, clock.instant(),
                persister.getLastDerivationIndex().orElse(null), persister.listSwaps());
        try {
            Files.createDirectories(path.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), file);
        } catch (IOException e) {
            throw PaymentException.generic("Could not write backup to " + path + ": " + e.getMessage(), e);
        }
        log.info("Backed up {} swaps to {}", file.swaps().size(), path);
    }

    public void restore(RestoreRequest request) {
        Path path = request != null && request.backupPath() != null && !request.backupPath().isBlank()
                ? Path.of(request.backupPath())
                : defaultBackupPath();
        if (!Files.isRegularFile(path)) {
            throw PaymentException.generic("Backup file not found: " + path);
        }
        BackupFile file;
        try {
            file = objectMapper.readValue(path.toFile(), BackupFile.class);
        } catch (IOException e) {
            throw PaymentException.generic("Could not read backup " + path + ": " + e.getMessage(), e);
        }
        if (file.version() != BackupFile.CURRENT_VERSION) {
            throw PaymentException.generic("Unsupported backup version " + file.version());
        }
        List<SwapRecord> swaps = file.swaps() != null ? file.swaps() : List.of();
        persister.replaceAll(swaps, file.lastDerivationIndex());
        log.info("Restored {} swaps from {}", swaps.size(), path);
    }

    public void emptyWalletCache() {
        wallet.emptyCache();
    }

    /** Full scan, then recovery of every active swap. */
    public RecoveryReport sync() {
        return recoveryService.recover();
    }

    public String signMessage(String message) {
        return wallet.signMessage(message);
    }

    public boolean checkMessage(String message, String pubkey, String signature) {
        return wallet.checkMessage(message, pubkey, signature);
    }

    Path defaultBackupPath() {
        return dataDir.resolve(BACKUP_DIR).resolve(BACKUP_FILE);
    }

    private SendPaymentResponse lockUp(SwapRecord record, String lockupAddress) {
        persister.saveSwap(record);
        String txid;
        try {
            FinalizedTransaction tx = wallet.buildTxOrDrainTx(null, lockupAddress, network.lbtcAssetId(),
                    record.getExpectedAmountSat());
            txid = wallet.broadcast(tx);
        } catch (PaymentException e) {
            log.warn("Lockup of send swap {} failed: {}", record.getId(), e.getMessage());
            persister.saveSwap(record.toBuilder()
                    .state(SwapState.FAILED)
                    .failureReason(e.getKind() + (e.getErr() != null ? ": " + e.getErr() : ""))
                    .build());
            throw e;
        }
        persister.saveSwap(record.toBuilder()
                .state(SwapState.PENDING)
                .lockupTxId(txid)
                .lockupAmountSat(record.getExpectedAmountSat())
                .build());
        log.info("Send swap {} locked up {} sat in {}", record.getId(), record.getExpectedAmountSat(), txid);
        return new SendPaymentResponse(txid);
    }

    private Bolt11Invoice parsePayable(String bolt11) {
        Bolt11Invoice invoice = Bolt11Invoice.parse(bolt11);
        if (!invoice.isFor(network) || invoice.amountSat() == null || invoice.isExpiredAt(clock.instant())) {
            throw PaymentException.invalidInvoice();
        }
        return invoice;
    }

    private void rejectExisting(String bolt11) {
        Optional<SwapRecord> existing = persister.findSwapByInvoice(bolt11);
        if (existing.isEmpty()) {
            return;
        }
        SwapRecord swap = existing.get();
        switch (swap.getState()) {
            case COMPLETE -> throw PaymentException.alreadyClaimed();
            case REFUNDED -> throw PaymentException.refunded("Swap " + swap.getId() + " was refunded",
                    Objects.requireNonNullElse(swap.getRefundTxId(), ""));
            case FAILED, EXPIRED -> log.debug("Retrying invoice of {} swap {}", swap.getState(), swap.getId());
            default -> throw PaymentException.generic("Payment of this invoice is already in progress (swap "
                    + swap.getId() + ", " + swap.getState() + ")");
        }
    }

    private static <T> T callSwapper(Supplier<T> call) {
        try {
            return call.get();
        } catch (PaymentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw PaymentException.generic("Swap counterparty call failed: " + e.getMessage(), e);
        }
    }

    /** The wallet-side transaction of a swap: what we broadcast for sends, what we received for receives. */
    private static String walletTxIdOf(SwapRecord swap) {
        return switch (swap.getKind()) {
            case SEND, CHAIN_SEND -> swap.getLockupTxId();
            case RECEIVE, CHAIN_RECEIVE -> swap.getClaimTxId();
        };
    }

    private static PaymentType paymentTypeOf(SwapKind kind) {
        return switch (kind) {
            case SEND, CHAIN_SEND -> PaymentType.SEND;
            case RECEIVE, CHAIN_RECEIVE -> PaymentType.RECEIVE;
        };
    }
}
