package com.priceplatform.price.service;

import com.priceplatform.price.dto.RefreshHealthReport;
import com.priceplatform.price.dto.SchedulerStatus;
import com.priceplatform.price.orchestrator.RefreshOrchestrator;
import com.priceplatform.price.scheduler.PriceRefreshScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health summary of the refresh machinery: scheduler running, store reachable,
 * cache populated and at least partly fresh.
 */
@Service
public class PricingHealthService {

    private static final Logger log = LoggerFactory.getLogger(PricingHealthService.class);

    private final PriceLookupService    lookupService;
    private final PriceRefreshScheduler scheduler;
    private final RefreshOrchestrator   orchestrator;
    private final Clock                 clock;

    public PricingHealthService(PriceLookupService lookupService, PriceRefreshScheduler scheduler,
                                RefreshOrchestrator orchestrator, Clock clock) {
        this.lookupService = lookupService;
        this.scheduler     = scheduler;
        this.orchestrator  = orchestrator;
        this.clock         = clock;
    }

    public Mono<RefreshHealthReport> healthReport() {
        SchedulerStatus schedulerStatus = scheduler.status();
        Map<String, Long> runs = new LinkedHashMap<>();
        orchestrator.snapshot().forEach((state, count) -> runs.put(state.wireName(), count));

        return lookupService.getCacheStats()
            .map(stats -> {
                List<String> issues = new ArrayList<>();
                if (!schedulerStatus.running())   issues.add("Scheduler not running");
                if (stats.totalEntries() == 0)    issues.add("No cached prices");
                else if (stats.freshEntries() == 0) issues.add("No fresh prices in cache");
                return report(schedulerStatus, true, stats.totalEntries(), stats.freshEntries(), runs, issues);
            })
            .onErrorResume(e -> {
                log.warn("HEALTH_CHECK_STORE_FAILED err={}", e.getMessage());
                List<String> issues = new ArrayList<>();
                if (!schedulerStatus.running()) issues.add("Scheduler not running");
                issues.add("Database unreachable: " + e.getMessage());
                return Mono.just(report(schedulerStatus, false, 0, 0, runs, issues));
            });
    }

    private RefreshHealthReport report(SchedulerStatus scheduler, boolean dbOk, long cached, long fresh,
                                       Map<String, Long> runs, List<String> issues) {
        return new RefreshHealthReport(
            issues.isEmpty() ? "healthy" : "unhealthy",
            scheduler.running(),
            dbOk,
            cached,
            fresh,
            scheduler.lastRequestId(),
            runs,
            List.copyOf(issues),
            clock.instant());
    }
}
