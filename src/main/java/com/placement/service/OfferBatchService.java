package com.placement.service;

import com.placement.config.AppMetrics;
import com.placement.config.TraceContextManager;
import com.placement.model.BatchResult;
import com.placement.model.OfferBatch;
import com.placement.service.cache.BatchDeduplicationService;
import com.placement.service.publishing.PlacementEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point shared by the Kafka route and the REST API:
 * de-duplicate → reconcile → dead-letter failures → publish change events.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OfferBatchService {

    private final BatchDeduplicationService deduplicationService;
    private final ReconciliationOrchestrator orchestrator;
    private final DeadLetterPublisher deadLetterPublisher;
    private final PlacementEventPublisher eventPublisher;
    private final AppMetrics metrics;

    /**
     * @return the batch result, or empty when the batch id was already reconciled
     * @throws com.placement.exception.StoreUnavailableException if the store is unreachable;
     *         the batch id is released so a redelivery is reconciled again
     */
    public Optional<BatchResult> process(OfferBatch batch) {
        TraceContextManager.putBatchId(batch.batchId());
        metrics.incrementBatchesReceived();

        if (!deduplicationService.tryAcquire(batch)) {
            log.warn("Skipping duplicate batch {}", batch.batchId());
            metrics.incrementDuplicateBatches();
            return Optional.empty();
        }

        BatchResult result;
        try {
            result = orchestrator.reconcile(batch.offers());
        } catch (RuntimeException e) {
            deduplicationService.release(batch);
            throw e;
        }

        if (!result.failed().isEmpty()) {
            deadLetterPublisher.send(result.failed());
        }
        eventPublisher.publish(result.events());
        return Optional.of(result);
    }
}
