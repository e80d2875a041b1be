package com.priceplatform.price.engine;

import com.priceplatform.common.exception.BatchTimeoutException;
import com.priceplatform.common.model.RefreshResult;
import com.priceplatform.common.model.SymbolRefreshOutcome;
import com.priceplatform.common.trace.TraceContextUtil;
import com.priceplatform.price.model.PriceCacheEntry;
import com.priceplatform.price.provider.PriceSourceAdapter;
import com.priceplatform.price.store.PriceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Refreshes a list of symbols in fixed-size batches against the bulk price source.
 *
 * <p>Per run:
 * <pre>
 *   for each batch, strictly in order:
 *     cancelled?          → stop, keep what is done
 *     fetch (retry, timeout)
 *       error / timeout   → every symbol of the batch failed with the error message
 *       priced symbol     → upsert + history (see {@link PriceRecorder})
 *       missing symbol    → failed, "Price not available"
 *     more batches left   → inter-batch delay
 * </pre>
 *
 * <p>Batch-level upstream failures are business outcomes and never fail the run.
 * Anything else that escapes (a listener blowing up, a bug) errors the returned Mono.
 */
@Component
public class BatchRefreshEngine {

    private static final Logger log = LoggerFactory.getLogger(BatchRefreshEngine.class);

    public static final String PRICE_NOT_AVAILABLE = "Price not available";

    private final PriceSourceAdapter    adapter;
    private final PriceRecorder         recorder;
    private final PriceStore            store;
    private final RefreshEngineSettings settings;
    private final Clock                 clock;

    public BatchRefreshEngine(PriceSourceAdapter adapter, PriceRecorder recorder, PriceStore store,
                              RefreshEngineSettings settings, Clock clock) {
        this.adapter  = adapter;
        this.recorder = recorder;
        this.store    = store;
        this.settings = settings;
        this.clock    = clock;
    }

    /**
     * The request id for log lines is read from the subscriber's Reactor Context
     * (see {@link TraceContextUtil#withRequestId}).
     *
     * @param batchSize    symbols per upstream call
     * @param batchTimeout bound on each batch's upstream call including retries
     * @param skipFresh    answer symbols with a fresh cache entry from the cache
     * @param cancelled    polled at every batch boundary
     */
    public Mono<RefreshResult> refresh(List<String> symbols, int batchSize, Duration batchTimeout,
                                       boolean skipFresh, BooleanSupplier cancelled,
                                       RefreshProgressListener listener) {
        return Mono.deferContextual(ctx -> {
            String requestId = TraceContextUtil.getRequestId(ctx);
            long started = clock.millis();
            List<List<String>> batches = partition(symbols, batchSize);
            RunTally tally = new RunTally();
            AtomicBoolean cancelLogged = new AtomicBoolean();

            TraceContextUtil.withMdc(requestId, () ->
                log.info("REFRESH_RUN_START requestId={} symbols={} batches={} batchSize={}",
                         requestId, symbols.size(), batches.size(), batchSize));

            return Flux.fromIterable(batches)
                .index()
                .concatMap(indexed -> Mono.defer(() -> {
                    if (cancelled.getAsBoolean()) {
                        if (cancelLogged.compareAndSet(false, true)) {
                            TraceContextUtil.withMdc(requestId, () ->
                                log.info("REFRESH_RUN_CANCELLED requestId={} processed={} remaining={}",
                                         requestId, tally.size(), symbols.size() - tally.size()));
                        }
                        return Mono.<Void>empty();
                    }
                    int index = indexed.getT1().intValue();
                    return processBatch(requestId, indexed.getT2(), batchTimeout, skipFresh, tally, listener)
                        .then(pauseBeforeNext(index, batches.size(), cancelled));
                }))
                .then(Mono.fromCallable(() -> tally.toResult(clock.millis() - started)))
                .doOnNext(result -> TraceContextUtil.withMdc(requestId, () ->
                    log.info("REFRESH_RUN_DONE requestId={} success={} failed={} durationMs={}",
                             requestId, result.success(), result.failed(), result.duration())));
        });
    }

    // ── one batch ─────────────────────────────────────────────────────────────

    private Mono<Void> processBatch(String requestId, List<String> batch, Duration batchTimeout,
                                    boolean skipFresh, RunTally tally, RefreshProgressListener listener) {
        Mono<Map<String, PriceCacheEntry>> cached = skipFresh ? store.freshEntries(batch) : Mono.just(Map.of());

        return cached.flatMap(fresh -> {
                List<String> toFetch = batch.stream()
                    .filter(s -> !fresh.containsKey(s))
                    .collect(Collectors.toList());
                return fetch(requestId, toFetch, batchTimeout)
                    .flatMap(fetched -> Flux.fromIterable(batch)
                        .concatMap(symbol -> {
                            listener.onSymbol(symbol);
                            PriceCacheEntry hit = fresh.get(symbol);
                            return hit != null
                                ? Mono.just(SymbolRefreshOutcome.succeeded(symbol, hit.getPrice(), hit.getSource(),
                                                                           clock.instant()))
                                : resolve(symbol, fetched);
                        })
                        .doOnNext(tally::add)
                        .then());
            })
            .then(Mono.fromRunnable(() -> listener.onBatchComplete(tally.succeeded(), tally.failed())));
    }

    private Mono<BatchFetch> fetch(String requestId, List<String> symbols, Duration batchTimeout) {
        if (symbols.isEmpty()) return Mono.just(BatchFetch.ok(Map.of()));

        return Mono.defer(() -> adapter.fetchMany(symbols))
            .retryWhen(retrySpec(requestId, symbols))
            .timeout(batchTimeout, Mono.error(BatchTimeoutException::new))
            .defaultIfEmpty(Map.of())
            .map(BatchFetch::ok)
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(requestId, () ->
                    log.warn("BATCH_FAILED requestId={} symbols={} err={}", requestId, symbols, e.getMessage()));
                return Mono.just(BatchFetch.failed(describe(e)));
            });
    }

    private Mono<SymbolRefreshOutcome> resolve(String symbol, BatchFetch fetched) {
        if (fetched.error() != null) {
            return Mono.just(SymbolRefreshOutcome.failed(symbol, fetched.error(), clock.instant()));
        }
        BigDecimal price = fetched.prices().get(symbol);
        if (price == null) {
            return Mono.just(SymbolRefreshOutcome.failed(symbol, PRICE_NOT_AVAILABLE, clock.instant()));
        }
        return recorder.record(symbol, price, adapter.sourceTag());
    }

    private Mono<Void> pauseBeforeNext(int index, int batchCount, BooleanSupplier cancelled) {
        return Mono.defer(() -> index < batchCount - 1 && !cancelled.getAsBoolean()
            ? Mono.delay(settings.interBatchDelay()).then()
            : Mono.<Void>empty());
    }

    private RetryBackoffSpec retrySpec(String requestId, List<String> symbols) {
        return Retry.fixedDelay(settings.maxAttempts() - 1L, settings.retryDelay())
            .doBeforeRetry(signal -> TraceContextUtil.withMdc(requestId, () ->
                log.warn("BATCH_RETRY requestId={} symbols={} attempt={} err={}",
                         requestId, symbols.size(), signal.totalRetries() + 2,
                         signal.failure().getMessage())))
            .onRetryExhaustedThrow((retry, signal) -> signal.failure());
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    static List<List<String>> partition(List<String> symbols, int batchSize) {
        List<List<String>> batches = new ArrayList<>();
        for (int i = 0; i < symbols.size(); i += batchSize) {
            batches.add(List.copyOf(symbols.subList(i, Math.min(i + batchSize, symbols.size()))));
        }
        return batches;
    }

    static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record BatchFetch(Map<String, BigDecimal> prices, String error) {
        static BatchFetch ok(Map<String, BigDecimal> prices) { return new BatchFetch(prices, null); }
        static BatchFetch failed(String error)               { return new BatchFetch(Map.of(), error); }
    }

    /** Outcomes of one run in request order. Written sequentially, read at the end. */
    private static final class RunTally {
        private final List<SymbolRefreshOutcome> outcomes = new ArrayList<>();
        private int succeeded;
        private int failed;

        synchronized void add(SymbolRefreshOutcome outcome) {
            outcomes.add(outcome);
            if (outcome.success()) succeeded++; else failed++;
        }

        synchronized int succeeded() { return succeeded; }
        synchronized int failed()    { return failed; }
        synchronized int size()      { return outcomes.size(); }

        synchronized RefreshResult toResult(long durationMs) {
            return RefreshResult.of(new ArrayList<>(outcomes), durationMs);
        }
    }
}
