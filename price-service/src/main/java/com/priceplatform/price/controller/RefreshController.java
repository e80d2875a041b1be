package com.priceplatform.price.controller;

import com.priceplatform.common.exception.RefreshFailedException;
import com.priceplatform.common.model.RefreshOptions;
import com.priceplatform.price.dto.RefreshHealthReport;
import com.priceplatform.price.dto.SchedulerStatus;
import com.priceplatform.price.dto.SymbolsRequest;
import com.priceplatform.price.orchestrator.RefreshOrchestrator;
import com.priceplatform.price.orchestrator.RefreshStatus;
import com.priceplatform.price.scheduler.PriceRefreshScheduler;
import com.priceplatform.price.service.PricingHealthService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * On-demand refresh runs and scheduler control.
 *
 * <p>Typical caller flow:
 * <ol>
 *   <li>POST /api/v1/refresh {symbols?, batchSize?, ...} → 202 {requestId}</li>
 *   <li>GET  /api/v1/refresh/{requestId} until status is terminal</li>
 *   <li>DELETE /api/v1/refresh/{requestId} to stop early</li>
 * </ol>
 * or POST /api/v1/refresh/quick to wait for the result in one call.
 */
@RestController
@RequestMapping("/api/v1/refresh")
public class RefreshController {

    private static final Logger log = LoggerFactory.getLogger(RefreshController.class);

    private final RefreshOrchestrator   orchestrator;
    private final PriceRefreshScheduler scheduler;
    private final PricingHealthService  healthService;

    public RefreshController(RefreshOrchestrator orchestrator, PriceRefreshScheduler scheduler,
                             PricingHealthService healthService) {
        this.orchestrator  = orchestrator;
        this.scheduler     = scheduler;
        this.healthService = healthService;
    }

    @PostMapping
    public Mono<ResponseEntity<Map<String, Object>>> start(@RequestBody(required = false) RefreshOptions options) {
        return orchestrator.startRefresh(options)
            .map(requestId -> ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.<String, Object>of(
                    "requestId", requestId,
                    "status",    "pending",
                    "statusUrl", "/api/v1/refresh/" + requestId)));
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<RefreshStatus> status(@PathVariable String requestId) {
        return orchestrator.getStatus(requestId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{requestId}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String requestId) {
        if (orchestrator.getStatus(requestId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        boolean cancelled = orchestrator.cancel(requestId);
        return ResponseEntity.ok(Map.of("requestId", requestId, "cancelled", cancelled));
    }

    @GetMapping("/active")
    public List<RefreshStatus> active() {
        return orchestrator.listActive();
    }

    @PostMapping("/quick")
    public Mono<ResponseEntity<Object>> quick(@RequestBody(required = false) SymbolsRequest request) {
        List<String> symbols = request != null ? request.symbols() : null;
        return orchestrator.quickRefresh(symbols)
            .map(result -> ResponseEntity.<Object>ok(result))
            .onErrorResume(RefreshFailedException.class, e -> {
                log.warn("Quick refresh did not complete. requestId={} err={}", e.getRequestId(), e.getMessage());
                HttpStatus status = RefreshOrchestrator.REFRESH_TIMEOUT.equals(e.getMessage())
                    ? HttpStatus.GATEWAY_TIMEOUT
                    : HttpStatus.INTERNAL_SERVER_ERROR;
                return Mono.just(ResponseEntity.status(status)
                    .body(Map.of("requestId", e.getRequestId(), "error", e.getMessage())));
            });
    }

    // ── scheduler ───────────────────────────────────────────────────────────

    @PostMapping("/scheduler/start")
    public ResponseEntity<SchedulerStatus> startScheduler(@RequestParam(required = false) Long intervalMs) {
        if (intervalMs != null && intervalMs > 0) {
            scheduler.start(Duration.ofMillis(intervalMs));
        } else {
            scheduler.start();
        }
        return ResponseEntity.ok(scheduler.status());
    }

    @PostMapping("/scheduler/stop")
    public ResponseEntity<SchedulerStatus> stopScheduler() {
        scheduler.stop();
        return ResponseEntity.ok(scheduler.status());
    }

    @GetMapping("/scheduler")
    public SchedulerStatus schedulerStatus() {
        return scheduler.status();
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<RefreshHealthReport>> health() {
        return healthService.healthReport()
            .map(report -> report.healthy()
                ? ResponseEntity.ok(report)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(report));
    }
}
