package com.placement.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Reconciliation metrics.
 *
 * Key metrics:
 * - placement.offers.total       → Offers handled (success + failure)
 * - placement.offers.created     → Offers that created a new record
 * - placement.offers.updated     → Offers merged into an existing record
 * - placement.offers.failed      → Offers reported as failed
 * - placement.cas.conflicts      → Conditional writes lost to a concurrent writer
 * - placement.duplicate.targets  → Offers whose company had more than one record
 * - placement.batch.time         → End-to-end batch time
 * - placement.store.read / write → Store call latency
 *
 * View at: http://localhost:8080/actuator/metrics
 */
@Component
@Getter
public class AppMetrics {

    private final Timer batchTimer;
    private final Timer storeReadTimer;
    private final Timer storeWriteTimer;

    private final Counter offersTotalCounter;
    private final Counter offersCreatedCounter;
    private final Counter offersUpdatedCounter;
    private final Counter offersUnchangedCounter;
    private final Counter offersFailedCounter;
    private final Counter casConflictCounter;
    private final Counter duplicateTargetCounter;
    private final Counter batchesReceivedCounter;
    private final Counter duplicateBatchesCounter;

    public AppMetrics(MeterRegistry registry) {
        // ═══════════════════════════════════════════════════════════════
        // TIMERS
        // ═══════════════════════════════════════════════════════════════

        this.batchTimer = Timer.builder("placement.batch.time")
                .description("Total time to reconcile one offer batch")
                .register(registry);

        this.storeReadTimer = Timer.builder("placement.store.read")
                .description("Record store read time")
                .tag("operation", "read")
                .register(registry);

        this.storeWriteTimer = Timer.builder("placement.store.write")
                .description("Record store write time")
                .tag("operation", "write")
                .register(registry);

        // ═══════════════════════════════════════════════════════════════
        // COUNTERS
        // ═══════════════════════════════════════════════════════════════

        this.offersTotalCounter = Counter.builder("placement.offers.total")
                .description("Offers handled (success + failed)")
                .register(registry);

        this.offersCreatedCounter = Counter.builder("placement.offers.created")
                .description("Offers that created a new company record")
                .register(registry);

        this.offersUpdatedCounter = Counter.builder("placement.offers.updated")
                .description("Offers merged into an existing company record")
                .register(registry);

        this.offersUnchangedCounter = Counter.builder("placement.offers.unchanged")
                .description("Offers that changed nothing and were not written")
                .register(registry);

        this.offersFailedCounter = Counter.builder("placement.offers.failed")
                .description("Offers that could not be reconciled")
                .register(registry);

        this.casConflictCounter = Counter.builder("placement.cas.conflicts")
                .description("Conditional writes that lost to a concurrent writer")
                .register(registry);

        this.duplicateTargetCounter = Counter.builder("placement.duplicate.targets")
                .description("Offers resolved against a company with several records")
                .register(registry);

        this.batchesReceivedCounter = Counter.builder("placement.batches.received")
                .description("Offer batches received")
                .register(registry);

        this.duplicateBatchesCounter = Counter.builder("placement.batches.duplicate")
                .description("Replayed offer batches skipped")
                .register(registry);
    }

    public void recordBatchTime(long millis) {
        batchTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordStoreRead(long millis) {
        storeReadTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordStoreWrite(long millis) {
        storeWriteTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementOffers(int created, int updated, int unchanged, int failed) {
        offersTotalCounter.increment(created + updated + unchanged + failed);
        offersCreatedCounter.increment(created);
        offersUpdatedCounter.increment(updated);
        offersUnchangedCounter.increment(unchanged);
        offersFailedCounter.increment(failed);
    }

    public void incrementCasConflicts() {
        casConflictCounter.increment();
    }

    public void incrementDuplicateTargets() {
        duplicateTargetCounter.increment();
    }

    public void incrementBatchesReceived() {
        batchesReceivedCounter.increment();
    }

    public void incrementDuplicateBatches() {
        duplicateBatchesCounter.increment();
    }
}
