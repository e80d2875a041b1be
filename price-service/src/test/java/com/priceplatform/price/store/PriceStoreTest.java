package com.priceplatform.price.store;

import com.priceplatform.price.model.PriceCacheEntry;
import com.priceplatform.price.repository.PriceCacheRepository;
import com.priceplatform.price.repository.PriceHistoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.r2dbc.DataR2dbcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Store behaviour against in-memory H2 with the production schema.
 */
@DataR2dbcTest
@Import({PriceStore.class, PriceStoreTest.ClockConfig.class})
class PriceStoreTest {

    @TestConfiguration
    static class ClockConfig {
        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }
    }

    @Autowired private PriceStore             store;
    @Autowired private PriceCacheRepository   cacheRepository;
    @Autowired private PriceHistoryRepository historyRepository;

    @BeforeEach
    void clean() {
        cacheRepository.deleteAll().block();
        historyRepository.deleteAll().block();
    }

    // ── cache ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("upsert()")
    class UpsertTests {

        @Test
        @DisplayName("first write creates the entry")
        void createsEntry() {
            StepVerifier.create(store.upsert("RELIANCE", new BigDecimal("2500.50"), "GOOGLE_SCRIPT"))
                .assertNext(e -> {
                    assertThat(e.getId()).isNotNull();
                    assertThat(e.getSymbol()).isEqualTo("RELIANCE");
                    assertThat(e.getPrice()).isEqualByComparingTo("2500.50");
                    assertThat(e.getSource()).isEqualTo("GOOGLE_SCRIPT");
                    assertThat(e.getLastUpdated()).isNotNull();
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("identical upsert twice leaves exactly one entry")
        void idempotent() {
            store.upsert("INFY", new BigDecimal("1500"), "GOOGLE_SCRIPT").block();
            store.upsert("INFY", new BigDecimal("1500"), "GOOGLE_SCRIPT").block();

            StepVerifier.create(cacheRepository.count())
                .expectNext(1L)
                .verifyComplete();
        }

        @Test
        @DisplayName("second write overwrites price, source and timestamp")
        void overwrites() {
            PriceCacheEntry first = store.upsert("TCS", new BigDecimal("3400"), "GOOGLE_SCRIPT").block();
            PriceCacheEntry second = store.upsert("TCS", new BigDecimal("3450.25"), "AMFI").block();

            assertThat(second).isNotNull();
            assertThat(second.getId()).isEqualTo(first.getId());
            assertThat(second.getPrice()).isEqualByComparingTo("3450.25");
            assertThat(second.getSource()).isEqualTo("AMFI");
            assertThat(second.getLastUpdated()).isAfterOrEqualTo(first.getLastUpdated());
        }

        @Test
        @DisplayName("interleaved writers for one symbol: last write wins")
        void lastWriteWins() {
            Flux.range(1, 5)
                .concatMap(i -> store.upsert("HDFC", new BigDecimal(1600 + i), "GOOGLE_SCRIPT"))
                .then()
                .block(Duration.ofSeconds(10));

            List<PriceCacheEntry> all = store.listAll().collectList().block();
            assertThat(all).hasSize(1);
            assertThat(all.get(0).getPrice()).isEqualByComparingTo("1605");
        }
    }

    @Nested
    @DisplayName("invalidation")
    class DeleteTests {

        @Test
        @DisplayName("deleteWhere removes only the named symbols")
        void deleteWhere() {
            store.upsert("A", BigDecimal.ONE, "GOOGLE_SCRIPT").block();
            store.upsert("B", BigDecimal.TEN, "GOOGLE_SCRIPT").block();
            store.upsert("C", BigDecimal.TEN, "GOOGLE_SCRIPT").block();

            StepVerifier.create(store.deleteWhere(List.of("A", "C", "MISSING")))
                .expectNext(2L)
                .verifyComplete();

            StepVerifier.create(store.listAll().map(PriceCacheEntry::getSymbol))
                .expectNext("B")
                .verifyComplete();
        }

        @Test
        @DisplayName("deleteWhere with no symbols is a no-op")
        void deleteWhereEmpty() {
            StepVerifier.create(store.deleteWhere(List.of()))
                .expectNext(0L)
                .verifyComplete();
        }

        @Test
        @DisplayName("deleteAll empties the cache but keeps history")
        void deleteAllKeepsHistory() {
            store.upsert("A", BigDecimal.ONE, "GOOGLE_SCRIPT").block();
            store.appendHistory("A", BigDecimal.ONE, "GOOGLE_SCRIPT", Instant.now()).block();

            StepVerifier.create(store.deleteAll())
                .expectNext(1L)
                .verifyComplete();
            StepVerifier.create(historyRepository.count())
                .expectNext(1L)
                .verifyComplete();
        }
    }

    // ── history ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("history")
    class HistoryTests {

        @Test
        @DisplayName("appendHistory never deduplicates")
        void appendOnly() {
            Instant now = Instant.now();
            store.appendHistory("INFY", new BigDecimal("1500"), "GOOGLE_SCRIPT", now).block();
            store.appendHistory("INFY", new BigDecimal("1500"), "GOOGLE_SCRIPT", now).block();

            StepVerifier.create(historyRepository.count())
                .expectNext(2L)
                .verifyComplete();
        }

        @Test
        @DisplayName("latestHistory returns the newest row for the symbol")
        void latest() {
            Instant now = Instant.now();
            store.appendHistory("INFY", new BigDecimal("1400"), "GOOGLE_SCRIPT", now.minus(Duration.ofHours(5))).block();
            store.appendHistory("INFY", new BigDecimal("1500"), "GOOGLE_SCRIPT", now.minus(Duration.ofHours(1))).block();
            store.appendHistory("TCS",  new BigDecimal("3400"), "GOOGLE_SCRIPT", now).block();

            StepVerifier.create(store.latestHistory("INFY"))
                .assertNext(h -> assertThat(h.getPrice()).isEqualByComparingTo("1500"))
                .verifyComplete();
        }

        @Test
        @DisplayName("history range is newest first and honours the limit")
        void range() {
            Instant now = Instant.now();
            for (int i = 1; i <= 5; i++) {
                store.appendHistory("SBIN", new BigDecimal(700 + i), "GOOGLE_SCRIPT",
                                    now.minus(Duration.ofDays(i))).block();
            }

            StepVerifier.create(store.history("SBIN", now.minus(Duration.ofDays(4).plusHours(1)), now, 2))
                .assertNext(h -> assertThat(h.getPrice()).isEqualByComparingTo("701"))
                .assertNext(h -> assertThat(h.getPrice()).isEqualByComparingTo("702"))
                .verifyComplete();
        }

        @Test
        @DisplayName("purgeHistoryBefore drops only rows older than the cutoff")
        void purge() {
            Instant now = Instant.now();
            store.appendHistory("SBIN", new BigDecimal("700"), "GOOGLE_SCRIPT", now.minus(Duration.ofDays(400))).block();
            store.appendHistory("SBIN", new BigDecimal("710"), "GOOGLE_SCRIPT", now.minus(Duration.ofDays(10))).block();

            StepVerifier.create(store.purgeHistoryBefore(now.minus(Duration.ofDays(365))))
                .expectNext(1L)
                .verifyComplete();
            StepVerifier.create(historyRepository.count())
                .expectNext(1L)
                .verifyComplete();
        }

        @Test
        @DisplayName("historyStats summarises rows and distinct symbols")
        void stats() {
            Instant now = Instant.now();
            store.appendHistory("A", BigDecimal.ONE, "GOOGLE_SCRIPT", now.minus(Duration.ofDays(2))).block();
            store.appendHistory("A", BigDecimal.ONE, "GOOGLE_SCRIPT", now.minus(Duration.ofDays(1))).block();
            store.appendHistory("B", BigDecimal.TEN, "AMFI", now).block();

            StepVerifier.create(store.historyStats())
                .assertNext(s -> {
                    assertThat(s.totalRecords()).isEqualTo(3);
                    assertThat(s.uniqueSymbols()).isEqualTo(2);
                    assertThat(s.oldestRecord()).isBefore(s.newestRecord());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("historyStats on an empty table has no timestamps")
        void emptyStats() {
            StepVerifier.create(store.historyStats())
                .assertNext(s -> {
                    assertThat(s.totalRecords()).isZero();
                    assertThat(s.oldestRecord()).isNull();
                    assertThat(s.newestRecord()).isNull();
                })
                .verifyComplete();
        }
    }

    @Test
    @DisplayName("freshEntries skips symbols without a fresh row")
    void freshEntries() {
        store.upsert("FRESH", BigDecimal.ONE, "GOOGLE_SCRIPT").block();

        StepVerifier.create(store.freshEntries(List.of("FRESH", "ABSENT")))
            .assertNext(m -> assertThat(m).containsOnlyKeys("FRESH"))
            .verifyComplete();
    }
}
