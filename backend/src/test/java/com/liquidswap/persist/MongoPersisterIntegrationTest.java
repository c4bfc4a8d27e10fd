package com.liquidswap.persist;

import com.liquidswap.domain.SwapRecord;
import com.liquidswap.domain.SwapState;
import com.liquidswap.error.PaymentErrorKind;
import com.liquidswap.error.PaymentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.liquidswap.recovery.RecoveryFixtures.receive;
import static com.liquidswap.recovery.RecoveryFixtures.send;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers(disabledWithoutDocker = true)
@Import(MongoPersister.class)
class MongoPersisterIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    MongoPersister persister;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void clean() {
        persister.replaceAll(List.of(), null);
    }

    @Test
    @DisplayName("derivation counter is empty until seeded, then increments atomically")
    void derivationCounter() throws Exception {
        assertThat(persister.nextDerivationIndex()).isEmpty();

        persister.setLastDerivationIndex(4);
        Set<Integer> issued = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(pool.submit(() -> issued.add(persister.nextDerivationIndex().orElseThrow())));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(issued).hasSize(20).allMatch(i -> i >= 5 && i <= 24);
        assertThat(persister.getLastDerivationIndex()).contains(24);
    }

    @Test
    @DisplayName("expired reservations are taken once, soonest expiry first")
    void reservations() {
        persister.reserveAddress("addr-b", 2, "s2", 120);
        persister.reserveAddress("addr-a", 1, "s1", 110);
        persister.reserveAddress("addr-c", 3, "s3", 200);

        assertThat(persister.nextExpiredReservedAddress(109)).isEmpty();
        assertThat(persister.nextExpiredReservedAddress(150).orElseThrow().getAddress()).isEqualTo("addr-a");
        assertThat(persister.nextExpiredReservedAddress(150).orElseThrow().getAddress()).isEqualTo("addr-b");
        assertThat(persister.nextExpiredReservedAddress(150)).isEmpty();
        assertThat(persister.listReservedAddresses()).extracting("address").containsExactly("addr-c");
    }

    @Test
    @DisplayName("a derivation index can be reserved only once")
    void uniqueReservationIndex() {
        persister.reserveAddress("addr-a", 1, "s1", 110);

        assertThatThrownBy(() -> persister.reserveAddress("addr-z", 1, "s1", 130))
                .isInstanceOfSatisfying(PaymentException.class,
                        e -> assertThat(e.getKind()).isEqualTo(PaymentErrorKind.PERSIST_ERROR));
    }

    @Test
    @DisplayName("terminal swaps are archived and drop out of the active list")
    void archivesTerminal() {
        persister.saveSwap(send("s1", 100));
        persister.saveSwap(receive("r1", 100).toBuilder().state(SwapState.COMPLETE).build());

        assertThat(persister.listSwaps()).hasSize(2);
        assertThat(persister.listActiveSwaps()).extracting(SwapRecord::getId).containsExactly("s1");
        SwapRecord archived = persister.loadSwap("r1").orElseThrow();
        assertThat(archived.isArchived()).isTrue();
        assertThat(archived.getUpdatedAt()).isNotNull();
        assertThat(persister.findSwapByInvoice("lntb1s1")).map(SwapRecord::getId).contains("s1");
    }

    @Test
    @DisplayName("save replaces the whole record by id")
    void replacesById() {
        persister.saveSwap(send("s1", 100).toBuilder().lockupTxId("lock").build());
        persister.saveSwap(send("s1", 100).toBuilder().state(SwapState.PENDING).build());

        SwapRecord stored = persister.loadSwap("s1").orElseThrow();
        assertThat(stored.getState()).isEqualTo(SwapState.PENDING);
        assertThat(stored.getLockupTxId()).isNull();
        assertThat(mongoTemplate.count(new Query(), SwapRecord.class))
                .isEqualTo(1);
    }

    @Test
    @DisplayName("replaceAll installs restored state and clears reservations")
    void replaceAll() {
        persister.saveSwap(send("old", 100));
        persister.reserveAddress("addr-a", 1, "s1", 110);
        persister.setLastScannedDerivationIndex(9);

        persister.replaceAll(List.of(send("s1", 100), receive("r1", 100).toBuilder()
                .state(SwapState.EXPIRED).build()), 12);

        assertThat(persister.listSwaps()).extracting(SwapRecord::getId).containsExactlyInAnyOrder("s1", "r1");
        assertThat(persister.listActiveSwaps()).extracting(SwapRecord::getId).containsExactly("s1");
        assertThat(persister.listReservedAddresses()).isEmpty();
        assertThat(persister.getLastDerivationIndex()).contains(12);
        assertThat(persister.getLastScannedDerivationIndex()).isEmpty();
    }
}
