package com.liquidswap.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liquidswap.common.RetryPolicy;
import com.liquidswap.domain.Chain;
import com.liquidswap.domain.WalletTransaction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EsploraChainClientTest {

    private static final String SCRIPT = "00141111111111111111111111111111111111111111";
    private static final String SCRIPT_HASH = "82d2c7b9ded542f3024bfe1babe73021e1a4894db8b8be6215f96be6737c975b";
    private static final String OTHER_SCRIPT = "00142222222222222222222222222222222222222222";
    private static final String OTHER_SCRIPT_HASH = "86c5df5ffa4f54ac6d3a090fe5cd61f41cf01c67839d2a45c0a2a5d37d792f5b";

    private FakeEsploraHttpClient http;
    private EsploraChainClient client;

    @BeforeEach
    void setUp() {
        http = new FakeEsploraHttpClient();
        client = clientWithPages(5);
    }

    @Test
    @DisplayName("script hash is sha256 of the script bytes, not reversed")
    void scriptHash() {
        assertThat(EsploraChainClient.scriptHash(SCRIPT)).isEqualTo(SCRIPT_HASH);
        assertThat(EsploraChainClient.scriptHash(SCRIPT.toUpperCase())).isEqualTo(SCRIPT_HASH);
    }

    @Test
    void tip_parsesHeight() {
        http.respond("/blocks/tip/height", "2841999\n");
        assertThat(client.tip()).isEqualTo(2841999);
    }

    @Test
    void tip_nonNumeric_throws() {
        http.respond("/blocks/tip/height", "<html>");
        assertThatThrownBy(() -> client.tip()).isInstanceOf(ChainClientException.class);
    }

    @Test
    @DisplayName("history maps heights, prevouts and outputs of confirmed and mempool transactions")
    void scriptTransactions_mapsEsploraJson() {
        http.respond("/scripthash/" + SCRIPT_HASH + "/txs", "["
                + tx("aa", false, 0, "cc", 1, SCRIPT)
                + "," + tx("bb", true, 120, "dd", 0, SCRIPT)
                + "]");

        List<WalletTransaction> txs = client.scriptTransactions(List.of(SCRIPT));

        assertThat(txs).extracting(WalletTransaction::getTxid).containsExactly("aa", "bb");
        WalletTransaction mempool = txs.get(0);
        assertThat(mempool.getHeight()).isNull();
        assertThat(mempool.isConfirmed()).isFalse();
        WalletTransaction confirmed = txs.get(1);
        assertThat(confirmed.getHeight()).isEqualTo(120);
        assertThat(confirmed.getTimestamp()).isEqualTo(Instant.ofEpochSecond(1_700_000_120L));
        assertThat(confirmed.getFee()).isEqualTo(250L);
        assertThat(confirmed.getInputs()).singleElement().satisfies(in -> {
            assertThat(in.getTxid()).isEqualTo("dd");
            assertThat(in.getVout()).isZero();
            assertThat(in.getScriptPubKey()).isEqualTo("0014ffff");
            assertThat(in.getValue()).isEqualTo(60_000L);
        });
        assertThat(confirmed.getOutputs()).singleElement().satisfies(out -> {
            assertThat(out.getTxid()).isEqualTo("bb");
            assertThat(out.getVout()).isZero();
            assertThat(out.paysTo(SCRIPT)).isTrue();
            assertThat(out.getValue()).isEqualTo(50_000L);
        });
    }

    @Test
    @DisplayName("history keeps each input's witness stack and the lock time")
    void scriptTransactions_mapsWitnessAndLockTime() {
        http.respond("/scripthash/" + SCRIPT_HASH + "/txs", "[{\"txid\":\"ee\",\"locktime\":800100"
                + ",\"status\":{\"confirmed\":true,\"block_height\":800110}"
                + ",\"vin\":[{\"txid\":\"ff\",\"vout\":0,\"witness\":[\"3044\",\"\",\"8201\"]"
                + ",\"prevout\":{\"scriptpubkey\":\"" + SCRIPT + "\",\"value\":50000}}]"
                + ",\"vout\":[{\"scriptpubkey\":\"" + OTHER_SCRIPT + "\",\"value\":49800}]}]");

        WalletTransaction refund = client.scriptTransactions(List.of(SCRIPT)).get(0);

        assertThat(refund.getLockTime()).isEqualTo(800_100L);
        assertThat(refund.getInputs()).singleElement()
                .satisfies(in -> assertThat(in.getWitness()).containsExactly("3044", "", "8201"));
    }

    @Test
    @DisplayName("inputs without a witness map to an empty stack")
    void scriptTransactions_missingWitness() {
        http.respond("/scripthash/" + SCRIPT_HASH + "/txs", "[" + tx("bb", true, 120, "dd", 0, SCRIPT) + "]");

        WalletTransaction tx = client.scriptTransactions(List.of(SCRIPT)).get(0);

        assertThat(tx.getLockTime()).isZero();
        assertThat(tx.getInputs().get(0).getWitness()).isEmpty();
    }

    @Test
    @DisplayName("a full page of confirmed transactions continues from the last confirmed txid")
    void scriptTransactions_pagesThroughChainHistory() {
        StringBuilder firstPage = new StringBuilder("[");
        for (int i = 0; i < EsploraChainClient.CONFIRMED_PAGE_SIZE; i++) {
            if (i > 0) {
                firstPage.append(',');
            }
            firstPage.append(tx("c" + i, true, 1000 - i, "p" + i, 0, SCRIPT));
        }
        firstPage.append(']');
        String lastSeen = "c" + (EsploraChainClient.CONFIRMED_PAGE_SIZE - 1);
        http.respond("/scripthash/" + SCRIPT_HASH + "/txs", firstPage.toString());
        http.respond("/scripthash/" + SCRIPT_HASH + "/txs/chain/" + lastSeen,
                "[" + tx("older", true, 10, "p", 0, SCRIPT) + "]");

        List<WalletTransaction> txs = client.scriptTransactions(List.of(SCRIPT));

        assertThat(txs).hasSize(EsploraChainClient.CONFIRMED_PAGE_SIZE + 1);
        assertThat(txs.get(txs.size() - 1).getTxid()).isEqualTo("older");
        assertThat(http.calls).hasSize(2);
    }

    @Test
    @DisplayName("paging stops at maxPages")
    void scriptTransactions_boundedByMaxPages() {
        StringBuilder page = new StringBuilder("[");
        for (int i = 0; i < EsploraChainClient.CONFIRMED_PAGE_SIZE; i++) {
            if (i > 0) {
                page.append(',');
            }
            page.append(tx("c" + i, true, 1000 - i, "p" + i, 0, SCRIPT));
        }
        page.append(']');
        http.respond("/scripthash/" + SCRIPT_HASH + "/txs", page.toString());
        EsploraChainClient onePage = clientWithPages(1);

        assertThat(onePage.scriptTransactions(List.of(SCRIPT))).hasSize(EsploraChainClient.CONFIRMED_PAGE_SIZE);
        assertThat(http.calls).hasSize(1);
    }

    @Test
    @DisplayName("a tx seen for two scripts is returned once, the confirmed copy wins")
    void scriptTransactions_dedupsByTxid() {
        http.respond("/scripthash/" + SCRIPT_HASH + "/txs", "[" + tx("shared", false, 0, "p", 0, SCRIPT) + "]");
        http.respond("/scripthash/" + OTHER_SCRIPT_HASH + "/txs",
                "[" + tx("shared", true, 77, "p", 0, OTHER_SCRIPT) + "]");

        List<WalletTransaction> txs = client.scriptTransactions(List.of(SCRIPT, OTHER_SCRIPT));

        assertThat(txs).singleElement().satisfies(tx -> assertThat(tx.getHeight()).isEqualTo(77));
    }

    @Test
    @DisplayName("transport failures are retried on the next endpoint")
    void get_retriesOnFailure() {
        http.fail("/blocks/tip/height");
        http.respond("/blocks/tip/height", "10");

        assertThat(client.tip()).isEqualTo(10);
        assertThat(http.calls).containsExactly("https://a/blocks/tip/height", "https://b/blocks/tip/height");
    }

    @Test
    @DisplayName("gives up after maxAttempts")
    void get_failsAfterMaxAttempts() {
        http.fail("/blocks/tip/height");
        http.fail("/blocks/tip/height");
        http.fail("/blocks/tip/height");

        assertThatThrownBy(() -> client.tip())
                .isInstanceOf(ChainClientException.class)
                .hasMessageContaining("after 3 attempts");
    }

    @Test
    void nonArrayHistory_throws() {
        http.respond("/scripthash/" + SCRIPT_HASH + "/txs", "{\"error\":\"bad\"}");
        assertThatThrownBy(() -> client.scriptTransactions(List.of(SCRIPT)))
                .isInstanceOf(ChainClientException.class);
    }

    private EsploraChainClient clientWithPages(int maxPages) {
        EndpointRotator rotator = new EndpointRotator(List.of("https://a", "https://b"), new RetryPolicy(0L, 0L, 0, 3));
        return new EsploraChainClient(Chain.BITCOIN, http, rotator, fastLimiter(), new ObjectMapper(), maxPages);
    }

    private static String tx(String txid, boolean confirmed, int height, String prevTxid, int prevVout, String script) {
        String status = confirmed
                ? "{\"confirmed\":true,\"block_height\":" + height + ",\"block_time\":" + (1_700_000_000L + height) + "}"
                : "{\"confirmed\":false}";
        return "{\"txid\":\"" + txid + "\",\"fee\":250,\"status\":" + status
                + ",\"vin\":[{\"txid\":\"" + prevTxid + "\",\"vout\":" + prevVout
                + ",\"prevout\":{\"scriptpubkey\":\"0014ffff\",\"value\":60000}}]"
                + ",\"vout\":[{\"scriptpubkey\":\"" + script + "\",\"value\":50000}]}";
    }

    private static RateLimiter fastLimiter() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(1_000_000)
                .timeoutDuration(Duration.ofMillis(1))
                .build();
        return RateLimiter.of("test-esplora-fast-limiter", config);
    }

    /** Canned responses per path, consumed in order; the last one repeats. */
    private static final class FakeEsploraHttpClient implements EsploraHttpClient {

        private final Map<String, Deque<Mono<String>>> responses = new HashMap<>();
        private final List<String> calls = new ArrayList<>();

        void respond(String path, String body) {
            responses.computeIfAbsent(path, p -> new ArrayDeque<>()).add(Mono.just(body));
        }

        void fail(String path) {
            responses.computeIfAbsent(path, p -> new ArrayDeque<>())
                    .add(Mono.error(new ChainClientException("HTTP 503 for " + path)));
        }

        @Override
        public Mono<String> get(String baseUrl, String path) {
            calls.add(baseUrl + path);
            Deque<Mono<String>> queue = responses.get(path);
            if (queue == null || queue.isEmpty()) {
                return Mono.error(new ChainClientException("HTTP 404 for " + path));
            }
            return queue.size() > 1 ? queue.poll() : queue.peek();
        }
    }
}
