package com.priceplatform.price.scheduler;

import com.priceplatform.price.orchestrator.RefreshOrchestrator;
import com.priceplatform.price.service.PriceLookupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Housekeeping: forget finished refresh statuses and trim old price history.
 */
@Component
public class PricingMaintenanceJobs {

    private static final Logger log = LoggerFactory.getLogger(PricingMaintenanceJobs.class);

    private final RefreshOrchestrator orchestrator;
    private final PriceLookupService  lookupService;
    private final int                 historyRetentionDays;

    public PricingMaintenanceJobs(RefreshOrchestrator orchestrator, PriceLookupService lookupService,
                                  @Value("${pricing.history.retention-days:365}") int historyRetentionDays) {
        this.orchestrator         = orchestrator;
        this.lookupService        = lookupService;
        this.historyRetentionDays = historyRetentionDays;
    }

    @Scheduled(fixedDelayString = "${pricing.refresh.status-cleanup-interval-ms:600000}",
               initialDelayString = "${pricing.refresh.status-cleanup-interval-ms:600000}")
    public void purgeFinishedRefreshes() {
        orchestrator.cleanupOld();
    }

    @Scheduled(cron = "${pricing.history.cleanup-cron:0 30 2 * * *}", zone = "UTC")
    public void purgeOldHistory() {
        lookupService.cleanupHistory(historyRetentionDays)
            .subscribe(
                n -> log.info("HISTORY_RETENTION_DONE retentionDays={} deleted={}", historyRetentionDays, n),
                e -> log.error("HISTORY_RETENTION_FAILED retentionDays={}", historyRetentionDays, e));
    }
}
