package com.priceplatform.price.scheduler;

import com.priceplatform.common.model.RefreshOptions;
import com.priceplatform.price.dto.SchedulerStatus;
import com.priceplatform.price.orchestrator.RefreshOrchestrator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Periodic refresh of the whole tracked symbol set.
 *
 * <pre>
 *   start → cycle now → every interval: cycle
 *   cycle: previous scheduled run still active? skip : orchestrator.startRefresh(defaults)
 * </pre>
 *
 * <p>A cycle only starts a run; it never waits for it. Cycle errors are logged and
 * absorbed so the timer never stops on its own. {@link #stop()} cancels the timer
 * but leaves an in-flight run alone.
 */
@Component
public class PriceRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(PriceRefreshScheduler.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);

    private final RefreshOrchestrator orchestrator;
    private final boolean             autoStart;
    private final Duration            configuredInterval;

    private Disposable       ticker;
    private volatile long    intervalMs;
    private volatile String  lastRequestId;

    public PriceRefreshScheduler(RefreshOrchestrator orchestrator,
                                 @Value("${pricing.scheduler.enabled:false}") boolean autoStart,
                                 @Value("${pricing.scheduler.interval-ms:3600000}") long intervalMs) {
        this.orchestrator       = orchestrator;
        this.autoStart          = autoStart;
        this.configuredInterval = Duration.ofMillis(intervalMs);
    }

    @PostConstruct
    public void startOnBoot() {
        if (autoStart) {
            start(configuredInterval);
        } else {
            log.info("Price refresh scheduler not started. pricing.scheduler.enabled=false");
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    // ── lifecycle ─────────────────────────────────────────────────────────────

    public boolean start() {
        return start(configuredInterval);
    }

    /**
     * @return {@code false} if the scheduler was already running (the interval is left unchanged)
     */
    public synchronized boolean start(Duration interval) {
        if (ticker != null && !ticker.isDisposed()) {
            log.info("SCHEDULER_ALREADY_RUNNING intervalMs={}", intervalMs);
            return false;
        }
        this.intervalMs = interval.toMillis();
        this.ticker = Flux.interval(Duration.ZERO, interval)
            .onBackpressureDrop(tick -> log.warn("SCHEDULER_TICK_DROPPED tick={}", tick))
            .concatMap(tick -> runCycle())
            .subscribe(
                v -> {},
                e -> log.error("Scheduler loop terminated unexpectedly", e));
        log.info("SCHEDULER_STARTED intervalMs={}", intervalMs);
        return true;
    }

    public synchronized boolean stop() {
        if (ticker == null || ticker.isDisposed()) return false;
        ticker.dispose();
        ticker = null;
        log.info("SCHEDULER_STOPPED lastRequestId={}", lastRequestId);
        return true;
    }

    public synchronized SchedulerStatus status() {
        boolean running = ticker != null && !ticker.isDisposed();
        String last = lastRequestId;
        return new SchedulerStatus(running, last != null && orchestrator.isActive(last), intervalMs, last);
    }

    // ── cycle ─────────────────────────────────────────────────────────────────

    Mono<Void> runCycle() {
        return Mono.defer(() -> {
                String previous = lastRequestId;
                if (previous != null && orchestrator.isActive(previous)) {
                    log.info("SCHEDULED_REFRESH_SKIPPED previousRequestId={} reason=still-running", previous);
                    return Mono.<Void>empty();
                }
                return orchestrator.startRefresh(RefreshOptions.defaults())
                    .doOnNext(id -> {
                        lastRequestId = id;
                        log.info("SCHEDULED_REFRESH_STARTED requestId={}", id);
                    })
                    .then();
            })
            .onErrorResume(e -> {
                log.error("SCHEDULED_REFRESH_ERROR err={}", e.getMessage(), e);
                return Mono.empty();
            });
    }
}
