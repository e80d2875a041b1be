package com.priceplatform.price.orchestrator;

import com.priceplatform.common.exception.RefreshFailedException;
import com.priceplatform.common.exception.RefreshValidationException;
import com.priceplatform.common.model.RefreshOptions;
import com.priceplatform.common.model.RefreshResult;
import com.priceplatform.common.model.RefreshState;
import com.priceplatform.common.trace.TraceContextUtil;
import com.priceplatform.price.client.SymbolNormalizer;
import com.priceplatform.price.engine.BatchRefreshEngine;
import com.priceplatform.price.engine.RefreshEngineSettings;
import com.priceplatform.price.engine.RefreshProgressListener;
import com.priceplatform.price.provider.TrackedSymbolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Starts refresh runs in the background and tracks their status by request id.
 *
 * <p>{@link #startRefresh} answers as soon as the run is registered; the run itself
 * starts after a short delay on a Reactor timer thread. Callers poll
 * {@link #getStatus} or use {@link #quickRefresh} to wait for the result.
 * Runs may overlap; their cache writes are not coordinated.
 */
@Service
public class RefreshOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RefreshOrchestrator.class);

    public static final String REFRESH_TIMEOUT = "Refresh timeout";

    private final Map<String, RefreshStatus> refreshes = new ConcurrentHashMap<>();

    private final BatchRefreshEngine    engine;
    private final TrackedSymbolProvider trackedSymbols;
    private final RefreshEngineSettings settings;
    private final Clock                 clock;

    public RefreshOrchestrator(BatchRefreshEngine engine, TrackedSymbolProvider trackedSymbols,
                               RefreshEngineSettings settings, Clock clock) {
        this.engine         = engine;
        this.trackedSymbols = trackedSymbols;
        this.settings       = settings;
        this.clock          = clock;
    }

    // ── Public API ─────────────────────────────────────────────────────────

    /**
     * Registers a {@code pending} run and schedules it.
     *
     * @return the request id; errors with {@link RefreshValidationException} on bad options
     */
    public Mono<String> startRefresh(RefreshOptions options) {
        RefreshOptions opts = options != null ? options : RefreshOptions.defaults();
        return Mono.defer(() -> {
                validate(opts);
                return resolveSymbols(opts);
            })
            .map(symbols -> launch(symbols, opts));
    }

    public Optional<RefreshStatus> getStatus(String requestId) {
        return Optional.ofNullable(refreshes.get(requestId));
    }

    public boolean isActive(String requestId) {
        RefreshStatus status = refreshes.get(requestId);
        return status != null && status.isActive();
    }

    /**
     * Requests cancellation. Only an {@code in-progress} run can be cancelled; it stops
     * at the next batch boundary and keeps the outcomes gathered so far.
     */
    public boolean cancel(String requestId) {
        RefreshStatus status = refreshes.get(requestId);
        if (status == null) return false;
        boolean cancelled = status.cancel(clock.instant());
        TraceContextUtil.withMdc(requestId, () ->
            log.info("REFRESH_CANCEL requestId={} accepted={} status={}", requestId, cancelled, status.getStatus()));
        return cancelled;
    }

    public List<RefreshStatus> listActive() {
        return refreshes.values().stream()
            .filter(RefreshStatus::isActive)
            .sorted(Comparator.comparing(RefreshStatus::getStartTime))
            .collect(Collectors.toList());
    }

    /** Drops finished runs whose end time is older than the retention window. */
    public int cleanupOld() {
        Instant cutoff = clock.instant().minus(settings.statusRetention());
        int before = refreshes.size();
        refreshes.values().removeIf(s -> s.getEndTime() != null && s.getEndTime().isBefore(cutoff));
        int removed = before - refreshes.size();
        if (removed > 0) {
            log.info("REFRESH_STATUS_CLEANUP removed={} remaining={}", removed, refreshes.size());
        }
        return removed;
    }

    /** Counts of tracked runs per state. */
    public Map<RefreshState, Long> snapshot() {
        return refreshes.values().stream()
            .collect(Collectors.groupingBy(RefreshStatus::getStatus, Collectors.counting()));
    }

    /**
     * Starts a forced refresh and waits for it by polling its status.
     * Errors with {@link RefreshFailedException} when the run fails, is cancelled,
     * vanishes, or is still running after the last poll; in that last case the run
     * is cancelled first.
     */
    public Mono<RefreshResult> quickRefresh(List<String> symbols) {
        return startRefresh(RefreshOptions.forced(symbols))
            .flatMap(this::awaitCompletion);
    }

    // ── run lifecycle ──────────────────────────────────────────────────────

    private String launch(List<String> symbols, RefreshOptions opts) {
        String requestId = newRequestId();
        int batchSize = opts.batchSize() != null ? opts.batchSize() : settings.batchSize();
        Duration batchTimeout = opts.timeout() != null ? Duration.ofMillis(opts.timeout()) : settings.batchTimeout();
        boolean skipFresh = Boolean.FALSE.equals(opts.forceRefresh());

        RefreshStatus status = new RefreshStatus(requestId, symbols.size(), !skipFresh, clock.instant());
        refreshes.put(requestId, status);
        TraceContextUtil.withMdc(requestId, () ->
            log.info("REFRESH_START requestId={} total={} batchSize={} forceRefresh={}",
                     requestId, symbols.size(), batchSize, !skipFresh));

        Mono.delay(settings.startDelay())
            .then(Mono.defer(() -> execute(status, symbols, batchSize, batchTimeout, skipFresh)))
            .subscribe(
                v -> {},
                e -> {
                    status.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                                clock.instant());
                    TraceContextUtil.withMdc(requestId, () ->
                        log.error("REFRESH_FAILED requestId={}", requestId, e));
                });
        return requestId;
    }

    private Mono<Void> execute(RefreshStatus status, List<String> symbols, int batchSize,
                               Duration batchTimeout, boolean skipFresh) {
        status.markInProgress();
        RefreshProgressListener listener = new RefreshProgressListener() {
            @Override public void onSymbol(String symbol)             { status.onSymbol(symbol); }
            @Override public void onBatchComplete(int ok, int failed) { status.onBatchComplete(ok, failed); }
        };
        Mono<RefreshResult> run = engine.refresh(symbols, batchSize, batchTimeout, skipFresh,
                                                 status::isCancelled, listener);
        return TraceContextUtil.withRequestId(run, status.getRequestId())
            .doOnNext(result -> {
                status.complete(result, clock.instant());
                TraceContextUtil.withMdc(status.getRequestId(), () ->
                    log.info("REFRESH_COMPLETE requestId={} status={} success={} failed={} durationMs={}",
                             status.getRequestId(), status.getStatus().wireName(),
                             result.success(), result.failed(), result.duration()));
            })
            .then();
    }

    private Mono<RefreshResult> awaitCompletion(String requestId) {
        return Flux.interval(settings.pollInterval())
            .take(settings.maxPollAttempts())
            .concatMap(tick -> Mono.justOrEmpty(poll(requestId)))
            .next()
            .switchIfEmpty(Mono.defer(() -> {
                cancel(requestId);
                return Mono.<RefreshResult>error(new RefreshFailedException(requestId, REFRESH_TIMEOUT));
            }));
    }

    /** Result once finished, empty while still running, error on an unsuccessful end. */
    private Optional<RefreshResult> poll(String requestId) {
        RefreshStatus status = refreshes.get(requestId);
        if (status == null) {
            throw new RefreshFailedException(requestId, "Refresh status not found");
        }
        switch (status.getStatus()) {
            case COMPLETED:
                return Optional.of(status.getResults() != null ? status.getResults() : RefreshResult.empty());
            case FAILED:
                throw new RefreshFailedException(requestId,
                    status.getError() != null ? status.getError() : "Refresh failed");
            case CANCELLED:
                throw new RefreshFailedException(requestId, "Refresh was cancelled");
            default:
                return Optional.empty();
        }
    }

    // ── validation ─────────────────────────────────────────────────────────

    private void validate(RefreshOptions opts) {
        if (opts.symbols() != null) {
            if (opts.symbols().isEmpty()) {
                throw new RefreshValidationException("symbols must not be empty");
            }
            for (String s : opts.symbols()) {
                if (s == null || s.isBlank()) {
                    throw new RefreshValidationException("symbols must not contain blank entries");
                }
            }
        }
        if (opts.batchSize() != null
                && (opts.batchSize() < 1 || opts.batchSize() > RefreshEngineSettings.MAX_BATCH_SIZE)) {
            throw new RefreshValidationException(
                "batchSize must be between 1 and " + RefreshEngineSettings.MAX_BATCH_SIZE);
        }
        if (opts.timeout() != null && opts.timeout() <= 0) {
            throw new RefreshValidationException("timeout must be positive");
        }
    }

    private Mono<List<String>> resolveSymbols(RefreshOptions opts) {
        Flux<String> source = opts.symbols() != null
            ? Flux.fromIterable(opts.symbols())
            : trackedSymbols.trackedSymbols();
        return source
            .map(String::trim)
            .filter(s -> SymbolNormalizer.isFundSchemeCode(s) ? opts.mutualFundsIncluded() : opts.stocksIncluded())
            .distinct()
            .collectList();
    }

    private String newRequestId() {
        return "refresh_" + clock.millis() + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 9);
    }
}
