package com.placement.route;

import com.placement.model.BatchResult;
import com.placement.model.OfferBatch;
import com.placement.service.OfferBatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.Exchange;
import org.apache.camel.Processor;
import org.apache.camel.component.kafka.KafkaConstants;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Camel Processor for offer batches.
 *
 * Intentionally thin: it hands the batch to {@link OfferBatchService} and commits the
 * Kafka offset once the batch is reconciled or recognised as a replay. Batch-level
 * failures are rethrown, leaving the offset uncommitted for Camel's error handler.
 */
@Component("offerBatchProcessor")
@Slf4j
@RequiredArgsConstructor
public class OfferBatchProcessor implements Processor {

    static final String BATCH_ID_HEADER = "batchId";

    private final OfferBatchService offerBatchService;

    @Override
    public void process(Exchange exchange) throws Exception {
        OfferBatch batch = exchange.getIn().getBody(OfferBatch.class);
        if (batch == null) {
            log.warn("Received empty message, committing offset");
            commitKafkaOffset(exchange);
            return;
        }

        exchange.getIn().setHeader(BATCH_ID_HEADER, batch.batchId());
        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║ Processing BATCH: {} | Offers: {}                             ",
                batch.batchId(), batch.offers().size());
        log.info("╚══════════════════════════════════════════════════════════════╝");

        Optional<BatchResult> result;
        try {
            result = offerBatchService.process(batch);
        } catch (Exception e) {
            log.error("Failed to reconcile batch {}: {}", batch.batchId(), e.getMessage(), e);
            throw e;
        }

        commitKafkaOffset(exchange);

        result.ifPresentOrElse(
                r -> log.info("BATCH COMPLETE: {} in {}ms | Created: {} | Updated: {} | Failed: {}",
                        batch.batchId(), r.processingTimeMs(), r.created(), r.updated(), r.failed().size()),
                () -> log.info("Duplicate batch {} skipped, offset committed", batch.batchId()));
    }

    private void commitKafkaOffset(Exchange exchange) {
        Object manualCommit = exchange.getIn().getHeader(KafkaConstants.MANUAL_COMMIT);
        if (manualCommit != null) {
            try {
                manualCommit.getClass().getMethod("commit").invoke(manualCommit);
                log.debug("Kafka offset committed successfully");
            } catch (Exception e) {
                log.warn("Failed to commit Kafka offset: {}", e.getMessage());
            }
        } else {
            log.warn("Manual commit header not found - auto-commit may be enabled");
        }
    }
}
