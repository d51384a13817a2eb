package com.placement.controller;

import com.placement.config.AppMetrics;
import com.placement.service.cache.BatchDeduplicationService;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * REST endpoint for application metrics summary.
 * Provides a single endpoint with all key metrics.
 *
 * GET /api/metrics/summary
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final AppMetrics appMetrics;
    private final BatchDeduplicationService deduplicationService;

    @GetMapping("/summary")
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> response = new LinkedHashMap<>();

        response.put("timestamp", Instant.now().toString());
        response.put("offers", getOfferMetrics());
        response.put("batches", getBatchMetrics());
        response.put("timing", getTimingMetrics());

        return response;
    }

    @GetMapping("/offers")
    public Map<String, Object> getOfferMetrics() {
        Map<String, Object> offers = new LinkedHashMap<>();

        double total = appMetrics.getOffersTotalCounter().count();
        double failed = appMetrics.getOffersFailedCounter().count();

        offers.put("total", (long) total);
        offers.put("created", (long) appMetrics.getOffersCreatedCounter().count());
        offers.put("updated", (long) appMetrics.getOffersUpdatedCounter().count());
        offers.put("unchanged", (long) appMetrics.getOffersUnchangedCounter().count());
        offers.put("failed", (long) failed);
        offers.put("casConflicts", (long) appMetrics.getCasConflictCounter().count());
        offers.put("duplicateTargets", (long) appMetrics.getDuplicateTargetCounter().count());

        if (total > 0) {
            offers.put("successRate", String.format("%.2f%%", ((total - failed) / total) * 100));
        } else {
            offers.put("successRate", "N/A");
        }

        return offers;
    }

    @GetMapping("/batches")
    public Map<String, Object> getBatchMetrics() {
        Map<String, Object> batches = new LinkedHashMap<>();

        batches.put("received", (long) appMetrics.getBatchesReceivedCounter().count());
        batches.put("duplicates", (long) appMetrics.getDuplicateBatchesCounter().count());
        batches.put("dedupCache", deduplicationService.getStats());

        return batches;
    }

    @GetMapping("/timing")
    public Map<String, Object> getTimingMetrics() {
        Map<String, Object> timing = new LinkedHashMap<>();

        timing.put("batch", getTimerStats(appMetrics.getBatchTimer()));
        timing.put("storeRead", getTimerStats(appMetrics.getStoreReadTimer()));
        timing.put("storeWrite", getTimerStats(appMetrics.getStoreWriteTimer()));

        return timing;
    }

    private Map<String, Object> getTimerStats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();

        long count = timer.count();
        stats.put("count", count);

        if (count > 0) {
            stats.put("totalTimeMs", String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
            stats.put("avgTimeMs", String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)));
            stats.put("maxTimeMs", String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        } else {
            stats.put("totalTimeMs", "0.00");
            stats.put("avgTimeMs", "N/A");
            stats.put("maxTimeMs", "N/A");
        }

        return stats;
    }
}
