package com.placement.controller;

import com.placement.model.BatchResult;
import com.placement.model.DuplicateReport;
import com.placement.model.OfferBatch;
import com.placement.model.PlacementRecord;
import com.placement.model.PlacementStats;
import com.placement.model.Resolution;
import com.placement.service.DuplicateJanitor;
import com.placement.service.IdentityResolver;
import com.placement.service.OfferBatchService;
import com.placement.service.PlacementStatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API for reconciling offer batches and reading canonical records.
 *
 * POST /api/placements/reconcile      → reconcile a batch (same path as the Kafka route)
 * GET  /api/placements/{company}      → record that offers for the company merge into
 * GET  /api/placements/duplicates     → companies with more than one record
 * GET  /api/placements/stats          → package statistics
 */
@RestController
@RequestMapping("/api/placements")
@RequiredArgsConstructor
@Slf4j
public class PlacementController {

    private final OfferBatchService offerBatchService;
    private final IdentityResolver identityResolver;
    private final DuplicateJanitor duplicateJanitor;
    private final PlacementStatsService statsService;

    @PostMapping("/reconcile")
    public ResponseEntity<?> reconcile(@RequestBody OfferBatch batch) {
        log.info("REST reconcile request: batch {} with {} offers", batch.batchId(), batch.offers().size());
        Optional<BatchResult> result = offerBatchService.process(batch);
        if (result.isEmpty()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "batchId", batch.batchId(),
                    "message", "Batch already reconciled"
            ));
        }
        return ResponseEntity.ok(result.get());
    }

    @GetMapping("/duplicates")
    public List<DuplicateReport> duplicates() {
        return duplicateJanitor.scan();
    }

    @GetMapping("/stats")
    public PlacementStats stats() {
        return statsService.computeStats();
    }

    @GetMapping("/{company}")
    public ResponseEntity<PlacementRecord> getCanonical(@PathVariable String company) {
        Resolution resolution = identityResolver.resolve(company);
        if (resolution.target() == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(resolution.target());
    }
}
