package com.liquidswap.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.liquidswap.domain.Chain;
import com.liquidswap.domain.WalletTransaction;
import com.liquidswap.domain.WalletTxOut;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Utils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Esplora REST history client for one chain: {@code /blocks/tip/height} and paged
 * {@code /scripthash/:hash/txs[/chain/:last_seen]} queries, with endpoint rotation, bounded retries and a
 * shared local rate limiter.
 */
@Slf4j
public class EsploraChainClient implements SwapChainClient {

    /** Confirmed transactions per Esplora history page. */
    static final int CONFIRMED_PAGE_SIZE = 25;

    private final Chain chain;
    private final EsploraHttpClient httpClient;
    private final EndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final int maxPages;

    public EsploraChainClient(Chain chain,
                              EsploraHttpClient httpClient,
                              EndpointRotator rotator,
                              RateLimiter rateLimiter,
                              ObjectMapper objectMapper,
                              int maxPages) {
        this.chain = chain;
        this.httpClient = httpClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.maxPages = Math.max(1, maxPages);
    }

    @Override
    public Chain chain() {
        return chain;
    }

    @Override
    public int tip() {
        String body = get("/blocks/tip/height").trim();
        try {
            return Integer.parseInt(body);
        } catch (NumberFormatException e) {
            throw new ChainClientException(chain + " tip is not a number: " + body, e);
        }
    }

    @Override
    public List<WalletTransaction> scriptTransactions(Collection<String> scripts) {
        Map<String, WalletTransaction> byTxid = new LinkedHashMap<>();
        for (String script : scripts) {
            for (WalletTransaction tx : historyOf(script)) {
                byTxid.merge(tx.getTxid(), tx, EsploraChainClient::preferConfirmed);
            }
        }
        return new ArrayList<>(byTxid.values());
    }

    /** Esplora script hash: sha256 of the script bytes, hex, not reversed. */
    static String scriptHash(String scriptHex) {
        return Sha256Hash.of(Utils.HEX.decode(scriptHex.toLowerCase(Locale.ROOT))).toString();
    }

    private List<WalletTransaction> historyOf(String script) {
        String hash = scriptHash(script);
        List<WalletTransaction> txs = new ArrayList<>();
        String path = "/scripthash/" + hash + "/txs";
        for (int page = 0; page < maxPages; page++) {
            JsonNode array = parse(get(path));
            int confirmed = 0;
            String lastConfirmed = null;
            for (JsonNode node : array) {
                WalletTransaction tx = toTransaction(node);
                txs.add(tx);
                if (tx.isConfirmed()) {
                    confirmed++;
                    lastConfirmed = tx.getTxid();
                }
            }
            if (confirmed < CONFIRMED_PAGE_SIZE || lastConfirmed == null) {
                return txs;
            }
            path = "/scripthash/" + hash + "/txs/chain/" + lastConfirmed;
        }
        log.warn("{} history of script hash {} truncated after {} pages", chain, hash, maxPages);
        return txs;
    }

    private WalletTransaction toTransaction(JsonNode node) {
        String txid = node.path("txid").asText();
        JsonNode status = node.path("status");
        boolean confirmed = status.path("confirmed").asBoolean(false);
        WalletTransaction.WalletTransactionBuilder builder = WalletTransaction.builder()
                .txid(txid)
                .height(confirmed ? status.path("block_height").asInt() : null)
                .timestamp(status.has("block_time") ? Instant.ofEpochSecond(status.path("block_time").asLong()) : null)
                .fee(node.path("fee").asLong(0L))
                .lockTime(node.path("locktime").asLong(0L));
        for (JsonNode vin : node.path("vin")) {
            JsonNode prevout = vin.path("prevout");
            WalletTxOut.WalletTxOutBuilder input = WalletTxOut.builder()
                    .txid(vin.path("txid").asText(null))
                    .vout(vin.path("vout").asInt())
                    .scriptPubKey(prevout.path("scriptpubkey").asText(null))
                    .assetId(prevout.path("asset").asText(null))
                    .value(prevout.has("value") ? prevout.path("value").asLong() : null);
            for (JsonNode item : vin.path("witness")) {
                input.witnessItem(item.asText());
            }
            builder.input(input.build());
        }
        int index = 0;
        for (JsonNode vout : node.path("vout")) {
            builder.output(WalletTxOut.builder()
                    .txid(txid)
                    .vout(index++)
                    .scriptPubKey(vout.path("scriptpubkey").asText(null))
                    .assetId(vout.path("asset").asText(null))
                    .value(vout.has("value") ? vout.path("value").asLong() : null)
                    .build());
        }
        return builder.build();
    }

    private JsonNode parse(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isArray()) {
                throw new ChainClientException(chain + " history response is not an array");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ChainClientException(chain + " history response is not JSON", e);
        }
    }

    private String get(String path) {
        ChainClientException lastError = null;
        int maxAttempts = rotator.maxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                sleep(rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.next();
            if (!rateLimiter.acquirePermission()) {
                lastError = new ChainClientException("Local limiter timeout before GET " + path + " on " + endpoint);
                continue;
            }
            try {
                String body = httpClient.get(endpoint, path).block();
                if (body == null) {
                    throw new ChainClientException("Empty response for GET " + path + " on " + endpoint);
                }
                return body;
            } catch (ChainClientException e) {
                lastError = e;
                log.warn("{} GET {} on {} failed (attempt {}/{}): {}",
                        chain, path, endpoint, attempt + 1, maxAttempts, e.getMessage());
            }
        }
        throw new ChainClientException(chain + " GET " + path + " failed after " + maxAttempts + " attempts",
                lastError);
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainClientException("Interrupted during retry", e);
        }
    }

    private static WalletTransaction preferConfirmed(WalletTransaction a, WalletTransaction b) {
        return !a.isConfirmed() && b.isConfirmed() ? b : a;
    }
}
