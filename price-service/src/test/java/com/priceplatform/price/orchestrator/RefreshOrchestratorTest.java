package com.priceplatform.price.orchestrator;

import com.priceplatform.common.exception.RefreshFailedException;
import com.priceplatform.common.exception.RefreshValidationException;
import com.priceplatform.common.model.RefreshOptions;
import com.priceplatform.common.model.RefreshResult;
import com.priceplatform.common.model.RefreshState;
import com.priceplatform.common.model.SymbolRefreshOutcome;
import com.priceplatform.price.engine.BatchRefreshEngine;
import com.priceplatform.price.engine.RefreshEngineSettings;
import com.priceplatform.price.provider.TrackedSymbolProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RefreshOrchestratorTest {

    @Mock private BatchRefreshEngine    engine;
    @Mock private TrackedSymbolProvider tracked;

    private final Clock clock = Clock.systemUTC();

    private RefreshOrchestrator orchestrator(Duration startDelay, Duration retention) {
        RefreshEngineSettings settings = new RefreshEngineSettings(
            10, Duration.ofSeconds(5), Duration.ofMillis(1), 3, Duration.ofMillis(1),
            startDelay, Duration.ofMillis(10), 20, retention);
        return new RefreshOrchestrator(engine, tracked, settings, clock);
    }

    private RefreshOrchestrator orchestrator() {
        return orchestrator(Duration.ofMillis(1), Duration.ofHours(1));
    }

    private void engineAnswers(Mono<RefreshResult> result) {
        when(engine.refresh(anyList(), anyInt(), any(), anyBoolean(), any(), any()))
            .thenReturn(result);
    }

    private static RefreshResult resultFor(String... symbols) {
        List<SymbolRefreshOutcome> outcomes = new java.util.ArrayList<>();
        for (String s : symbols) {
            outcomes.add(SymbolRefreshOutcome.succeeded(s, BigDecimal.ONE, "GOOGLE_SCRIPT", Instant.now()));
        }
        return RefreshResult.of(outcomes, 5);
    }

    // ── start ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("startRefresh")
    class StartTests {

        @Test
        @DisplayName("registers a pending run and answers with its request id")
        void pendingImmediately() {
            RefreshOrchestrator orchestrator = orchestrator(Duration.ofSeconds(30), Duration.ofHours(1));

            String id = orchestrator.startRefresh(RefreshOptions.forced(List.of("INFY", "TCS"))).block();

            assertThat(id).matches("refresh_\\d+_[0-9a-f]{9}");
            RefreshStatus status = orchestrator.getStatus(id).orElseThrow();
            assertThat(status.getStatus()).isEqualTo(RefreshState.PENDING);
            assertThat(status.getProgress().total()).isEqualTo(2);
            assertThat(status.getProgress().percentage()).isZero();
            assertThat(orchestrator.isActive(id)).isTrue();
        }

        @Test
        @DisplayName("without symbols refreshes the tracked set, trimmed and de-duplicated")
        void trackedSymbols() {
            when(tracked.trackedSymbols()).thenReturn(Flux.just("INFY", " TCS ", "INFY"));
            engineAnswers(Mono.just(resultFor("INFY", "TCS")));

            orchestrator().startRefresh(RefreshOptions.defaults()).block();

            verify(engine, timeout(2000)).refresh(eq(List.of("INFY", "TCS")), eq(10),
                                                  eq(Duration.ofSeconds(5)), eq(false), any(), any());
        }

        @Test
        @DisplayName("include filters separate stocks from fund scheme codes")
        void includeFilters() {
            when(tracked.trackedSymbols()).thenReturn(Flux.just("INFY", "119551"));
            engineAnswers(Mono.just(resultFor("INFY")));

            orchestrator().startRefresh(new RefreshOptions(null, null, null, null, true, false)).block();

            verify(engine, timeout(2000)).refresh(eq(List.of("INFY")), anyInt(), any(),
                                                  anyBoolean(), any(), any());
        }

        @Test
        @DisplayName("forceRefresh=false answers fresh entries from the cache; overrides are passed through")
        void optionsPassedThrough() {
            engineAnswers(Mono.just(resultFor("INFY")));

            orchestrator().startRefresh(new RefreshOptions(List.of("INFY"), false, 5, 250L, null, null)).block();

            verify(engine, timeout(2000)).refresh(eq(List.of("INFY")), eq(5),
                                                  eq(Duration.ofMillis(250)), eq(true), any(), any());
        }

        @Test
        @DisplayName("invalid options are rejected before anything is registered")
        void validation() {
            RefreshOrchestrator orchestrator = orchestrator();

            StepVerifier.create(orchestrator.startRefresh(new RefreshOptions(List.of(), null, null, null, null, null)))
                .expectError(RefreshValidationException.class).verify();
            StepVerifier.create(orchestrator.startRefresh(new RefreshOptions(List.of("A", " "), null, null, null, null, null)))
                .expectError(RefreshValidationException.class).verify();
            StepVerifier.create(orchestrator.startRefresh(new RefreshOptions(List.of("A"), null, 0, null, null, null)))
                .expectError(RefreshValidationException.class).verify();
            StepVerifier.create(orchestrator.startRefresh(new RefreshOptions(List.of("A"), null, 51, null, null, null)))
                .expectError(RefreshValidationException.class).verify();
            StepVerifier.create(orchestrator.startRefresh(new RefreshOptions(List.of("A"), null, null, 0L, null, null)))
                .expectError(RefreshValidationException.class).verify();

            assertThat(orchestrator.snapshot()).isEmpty();
            verify(engine, never()).refresh(anyList(), anyInt(), any(), anyBoolean(), any(), any());
        }

        @Test
        @DisplayName("overlapping runs are tracked independently")
        void overlappingRuns() {
            engineAnswers(Mono.never());
            RefreshOrchestrator orchestrator = orchestrator();

            String first  = orchestrator.startRefresh(RefreshOptions.forced(List.of("A"))).block();
            String second = orchestrator.startRefresh(RefreshOptions.forced(List.of("A"))).block();

            assertThat(first).isNotEqualTo(second);
            assertThat(orchestrator.listActive()).extracting(RefreshStatus::getRequestId)
                .containsExactlyInAnyOrder(first, second);
        }
    }

    // ── quick refresh ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("quickRefresh")
    class QuickRefreshTests {

        @Test
        @DisplayName("returns the run's result once completed")
        void completes() {
            engineAnswers(Mono.just(resultFor("INFY", "TCS")));
            RefreshOrchestrator orchestrator = orchestrator();

            StepVerifier.create(orchestrator.quickRefresh(List.of("INFY", "TCS")))
                .assertNext(result -> assertThat(result.success()).isEqualTo(2))
                .verifyComplete();

            assertThat(orchestrator.snapshot()).containsEntry(RefreshState.COMPLETED, 1L);
        }

        @Test
        @DisplayName("a run that never finishes is cancelled and reported as a timeout")
        void timesOut() {
            engineAnswers(Mono.never());
            RefreshOrchestrator orchestrator = orchestrator();

            StepVerifier.create(orchestrator.quickRefresh(List.of("INFY")))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(RefreshFailedException.class).hasMessage("Refresh timeout");
                    String id = ((RefreshFailedException) e).getRequestId();
                    assertThat(orchestrator.getStatus(id).orElseThrow().getStatus())
                        .isEqualTo(RefreshState.CANCELLED);
                })
                .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("a failed run surfaces its error")
        void fails() {
            engineAnswers(Mono.error(new IllegalStateException("engine exploded")));
            RefreshOrchestrator orchestrator = orchestrator();

            StepVerifier.create(orchestrator.quickRefresh(List.of("INFY")))
                .expectErrorSatisfies(e -> assertThat(e)
                    .isInstanceOf(RefreshFailedException.class).hasMessage("engine exploded"))
                .verify(Duration.ofSeconds(5));

            assertThat(orchestrator.snapshot()).containsEntry(RefreshState.FAILED, 1L);
        }
    }

    // ── cancel & housekeeping ─────────────────────────────────────────────

    @Nested
    @DisplayName("cancel and cleanup")
    class CancelTests {

        @Test
        @DisplayName("unknown or pending runs cannot be cancelled")
        void cancelNotAccepted() {
            RefreshOrchestrator orchestrator = orchestrator(Duration.ofSeconds(30), Duration.ofHours(1));
            String id = orchestrator.startRefresh(RefreshOptions.forced(List.of("A"))).block();

            assertThat(orchestrator.cancel("refresh_missing")).isFalse();
            assertThat(orchestrator.cancel(id)).isFalse();
            assertThat(orchestrator.getStatus(id).orElseThrow().getStatus()).isEqualTo(RefreshState.PENDING);
        }

        @Test
        @DisplayName("an in-progress run is cancelled once and drops out of the active list")
        void cancelInProgress() {
            engineAnswers(Mono.never());
            RefreshOrchestrator orchestrator = orchestrator();
            String id = orchestrator.startRefresh(RefreshOptions.forced(List.of("A"))).block();
            verify(engine, timeout(2000)).refresh(anyList(), anyInt(), any(), anyBoolean(), any(), any());

            assertThat(orchestrator.cancel(id)).isTrue();
            assertThat(orchestrator.cancel(id)).isFalse();

            RefreshStatus status = orchestrator.getStatus(id).orElseThrow();
            assertThat(status.getStatus()).isEqualTo(RefreshState.CANCELLED);
            assertThat(status.getEndTime()).isNotNull();
            assertThat(orchestrator.listActive()).isEmpty();
        }

        @Test
        @DisplayName("finished runs older than the retention window are dropped, active ones kept")
        void cleanupOld() throws InterruptedException {
            RefreshOrchestrator orchestrator = orchestrator(Duration.ofMillis(1), Duration.ofMillis(1));
            engineAnswers(Mono.just(resultFor("A")));
            orchestrator.quickRefresh(List.of("A")).block(Duration.ofSeconds(5));

            engineAnswers(Mono.never());
            String running = orchestrator.startRefresh(RefreshOptions.forced(List.of("B"))).block();
            Thread.sleep(20);

            assertThat(orchestrator.cleanupOld()).isEqualTo(1);
            assertThat(orchestrator.snapshot()).hasSize(1);
            assertThat(orchestrator.getStatus(running)).isPresent();
        }
    }
}
