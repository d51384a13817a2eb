package com.placement.service;

import com.placement.config.AppMetrics;
import com.placement.exception.ConcurrentRecordModificationException;
import com.placement.exception.ReconciliationException;
import com.placement.model.BatchResult;
import com.placement.model.ErrorKind;
import com.placement.model.FailedOffer;
import com.placement.model.InsertResult;
import com.placement.model.MergeOutcome;
import com.placement.model.Offer;
import com.placement.model.PlacementEvent;
import com.placement.model.PlacementEvent.EventType;
import com.placement.model.PlacementRecord;
import com.placement.model.Resolution;
import com.placement.repository.PlacementRecordStore;
import com.placement.service.publishing.PlacementEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reconciles a batch of offers into the canonical company records.
 *
 * Per offer: validate → resolve merge target → merge → persist. New companies are
 * inserted; existing records are written with a compare-and-swap on their version, and a
 * lost race re-reads the record and merges again, up to {@code maxCasAttempts} times.
 *
 * Offers run in parallel on the reconcile executor and fail independently: every failure
 * lands in {@link BatchResult#failed()} and the batch carries on. Only an unreachable store
 * at batch start is thrown to the caller.
 *
 * An offer reported as timed out or interrupted keeps running; if it still writes, its
 * event is published on completion instead of travelling in the batch result.
 */
@Service
@Slf4j
public class ReconciliationOrchestrator {

    private final PlacementRecordStore store;
    private final IdentityResolver identityResolver;
    private final RecordMerger recordMerger;
    private final OfferValidator offerValidator;
    private final PlacementEventPublisher eventPublisher;
    private final AppMetrics metrics;
    private final ExecutorService executor;
    private final Clock clock;
    private final Semaphore storeSemaphore;
    private final int maxCasAttempts;
    private final long offerTimeoutMs;

    @Value("${app.reconcile.skip-unchanged-writes:false}")
    private boolean skipUnchangedWrites;

    public ReconciliationOrchestrator(
            PlacementRecordStore store,
            IdentityResolver identityResolver,
            RecordMerger recordMerger,
            OfferValidator offerValidator,
            PlacementEventPublisher eventPublisher,
            AppMetrics metrics,
            @Qualifier("reconcileExecutor") ExecutorService executor,
            Clock clock,
            @Value("${app.executor.store-concurrency:10}") int storeConcurrency,
            @Value("${app.reconcile.max-cas-attempts:5}") int maxCasAttempts,
            @Value("${app.reconcile.offer-timeout-ms:30000}") long offerTimeoutMs) {
        this.store = store;
        this.identityResolver = identityResolver;
        this.recordMerger = recordMerger;
        this.offerValidator = offerValidator;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
        this.storeSemaphore = new Semaphore(storeConcurrency);
        this.maxCasAttempts = maxCasAttempts;
        this.offerTimeoutMs = offerTimeoutMs;
        log.info("ReconciliationOrchestrator initialized with storeConcurrency: {}, maxCasAttempts: {}, offerTimeout: {}ms",
                storeConcurrency, maxCasAttempts, offerTimeoutMs);
    }

    /**
     * Reconciles every offer of the batch.
     *
     * @throws com.placement.exception.StoreUnavailableException if the store cannot be reached at all
     */
    public BatchResult reconcile(List<Offer> offers) {
        if (offers.isEmpty()) {
            return BatchResult.empty();
        }

        long startTime = System.currentTimeMillis();

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("RECONCILE START: {} offers | skipUnchangedWrites: {}", offers.size(), skipUnchangedWrites);
        log.info("═══════════════════════════════════════════════════════════════");

        // fail fast: without a store there is nothing to reconcile against
        store.ping();

        AtomicBoolean cancelled = new AtomicBoolean(false);
        List<CompletableFuture<OfferOutcome>> tasks = offers.stream()
                .map(offer -> CompletableFuture.supplyAsync(() -> processWithSemaphore(offer, cancelled), executor))
                .toList();
        // bounded copies time out on their own; the tasks stay reachable for late outcomes
        List<CompletableFuture<OfferOutcome>> bounded = tasks.stream()
                .map(task -> task.copy().orTimeout(offerTimeoutMs, TimeUnit.MILLISECONDS))
                .toList();

        List<OfferOutcome> outcomes = new ArrayList<>(offers.size());
        for (int i = 0; i < tasks.size(); i++) {
            outcomes.add(await(bounded.get(i), tasks.get(i), offers.get(i), cancelled));
        }

        BatchResult result = summarize(outcomes, System.currentTimeMillis() - startTime);

        metrics.recordBatchTime(result.processingTimeMs());
        metrics.incrementOffers(result.created(), result.updated(), result.unchanged(), result.failed().size());

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("RECONCILE COMPLETE | Total: {}ms", result.processingTimeMs());
        log.info("  Created: {} | Updated: {} | Unchanged: {} | Failed: {}",
                result.created(), result.updated(), result.unchanged(), result.failed().size());
        if (result.duplicateTargets() > 0) {
            log.warn("  {} offers resolved against companies with duplicate records", result.duplicateTargets());
        }
        log.info("═══════════════════════════════════════════════════════════════");

        return result;
    }

    private OfferOutcome await(CompletableFuture<OfferOutcome> bounded, CompletableFuture<OfferOutcome> task,
                               Offer offer, AtomicBoolean cancelled) {
        try {
            return bounded.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!cancelled.getAndSet(true)) {
                log.warn("Reconciliation interrupted, remaining offers will not be started");
            }
            publishWhenLate(task, offer);
            return OfferOutcome.failed(new FailedOffer(offer, ErrorKind.UNEXPECTED,
                    "Batch interrupted before offer completed; outcome unknown, replay is safe",
                    "InterruptedException", 0));
        } catch (ExecutionException e) {
            // processWithSemaphore never throws, so this can only be the timeout
            Throwable cause = e.getCause();
            if (cause instanceof TimeoutException) {
                log.warn("Offer for '{}' did not complete within {}ms", companyOf(offer), offerTimeoutMs);
                publishWhenLate(task, offer);
                return OfferOutcome.failed(new FailedOffer(offer, ErrorKind.STORE_UNAVAILABLE,
                        "Offer did not complete within " + offerTimeoutMs + "ms; outcome unknown, replay is safe",
                        "TimeoutException", 0));
            }
            return OfferOutcome.failed(toFailure(offer, cause, 0));
        }
    }

    /**
     * An offer already reported as failed may still write. Its event then goes out on its own.
     */
    private void publishWhenLate(CompletableFuture<OfferOutcome> task, Offer offer) {
        task.thenAccept(outcome -> {
            if (outcome.event() == null) {
                log.info("Offer for '{}' finished after it was reported failed, status: {}",
                        companyOf(offer), outcome.status());
                return;
            }
            log.warn("Offer for '{}' finished after it was reported failed, publishing its {} event for record {}",
                    companyOf(offer), outcome.event().type(), outcome.event().recordId());
            eventPublisher.publish(List.of(outcome.event()));
        });
    }

    private OfferOutcome processWithSemaphore(Offer offer, AtomicBoolean cancelled) {
        AtomicInteger attempts = new AtomicInteger();
        try {
            if (cancelled.get()) {
                throw new CancellationException("Batch cancelled");
            }
            storeSemaphore.acquire();
            try {
                return reconcileOne(offer, attempts);
            } finally {
                storeSemaphore.release();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Reconciliation interrupted for company '{}'", companyOf(offer));
            return OfferOutcome.failed(new FailedOffer(offer, ErrorKind.UNEXPECTED,
                    "Processing interrupted; outcome unknown, replay is safe", "InterruptedException", attempts.get()));
        } catch (Exception e) {
            log.warn("Failed to reconcile offer for company '{}': {}", companyOf(offer), e.getMessage());
            return OfferOutcome.failed(toFailure(offer, e, attempts.get()));
        }
    }

    /**
     * Read → merge → conditional write for one offer, retrying the whole cycle when the
     * write loses to a concurrent writer.
     */
    OfferOutcome reconcileOne(Offer offer, AtomicInteger attempts) {
        offerValidator.validate(offer);

        Resolution resolution = identityResolver.resolve(offer.company());
        boolean duplicateTarget = resolution.kind() == Resolution.Kind.MANY;
        if (duplicateTarget) {
            metrics.incrementDuplicateTargets();
        }

        PlacementRecord target = resolution.target();
        while (true) {
            attempts.incrementAndGet();
            MergeOutcome merged = recordMerger.merge(target, offer, clock.instant());

            if (target == null) {
                InsertResult inserted = store.insert(merged.record());
                if (inserted.status() == InsertResult.Status.ALREADY_EXISTS) {
                    log.info("Record {} for '{}' was already written by an earlier attempt",
                            inserted.id(), offer.company());
                }
                log.debug("Created record {} for '{}' with {} students",
                        inserted.id(), offer.company(), merged.record().numberOfOffers());
                return OfferOutcome.created(event(EventType.NEW_OFFER, offer, merged, inserted.id()), duplicateTarget);
            }

            if (!merged.changed() && skipUnchangedWrites) {
                log.debug("Offer for '{}' changes nothing on record {}, skipping write", offer.company(), target.id());
                return OfferOutcome.unchanged(duplicateTarget);
            }

            if (store.updateConditional(target.id(), target.version(), merged.record())) {
                log.debug("Updated record {} for '{}': +{} students, {} upgraded",
                        target.id(), offer.company(), merged.newlyAddedStudents().size(),
                        merged.upgradedStudents().size());
                PlacementEvent event = merged.newlyAddedStudents().isEmpty()
                        ? null
                        : event(EventType.UPDATE_OFFER, offer, merged, target.id());
                return OfferOutcome.updated(event, duplicateTarget);
            }

            metrics.incrementCasConflicts();
            if (attempts.get() >= maxCasAttempts) {
                throw new ConcurrentRecordModificationException(target.id(), attempts.get());
            }
            log.debug("Record {} changed since read (attempt {}/{}), re-reading",
                    target.id(), attempts.get(), maxCasAttempts);
            target = reread(target, offer.company());
        }
    }

    /**
     * Fresh copy of the target; if it vanished (removed by an operator) the company is
     * resolved again, which may fall back to creating a new record.
     */
    private PlacementRecord reread(PlacementRecord target, String company) {
        Optional<PlacementRecord> fresh = store.findById(target.id());
        return fresh.orElseGet(() -> identityResolver.resolve(company).target());
    }

    private PlacementEvent event(EventType type, Offer offer, MergeOutcome merged, String recordId) {
        PlacementRecord record = merged.record();
        return new PlacementEvent(
                type,
                record.company(),
                recordId,
                merged.newlyAddedStudents(),
                List.copyOf(record.roles().values()),
                record.numberOfOffers(),
                offer.emailSender(),
                offer.timeSent());
    }

    private FailedOffer toFailure(Offer offer, Throwable error, int attempts) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        ErrorKind kind = cause instanceof ReconciliationException re ? re.getErrorKind() : ErrorKind.UNEXPECTED;
        return new FailedOffer(offer, kind, cause.getMessage(), cause.getClass().getSimpleName(), attempts);
    }

    private BatchResult summarize(List<OfferOutcome> outcomes, long elapsedMs) {
        int created = 0;
        int updated = 0;
        int unchanged = 0;
        int duplicateTargets = 0;
        List<FailedOffer> failed = new ArrayList<>();
        List<PlacementEvent> events = new ArrayList<>();

        for (OfferOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case CREATED -> created++;
                case UPDATED -> updated++;
                case UNCHANGED -> unchanged++;
                case FAILED -> failed.add(outcome.failure());
            }
            if (outcome.event() != null) {
                events.add(outcome.event());
            }
            if (outcome.duplicateTarget()) {
                duplicateTargets++;
            }
        }
        return new BatchResult(outcomes.size(), created, updated, unchanged, duplicateTargets,
                List.copyOf(failed), List.copyOf(events), elapsedMs);
    }

    private static String companyOf(Offer offer) {
        return offer == null ? null : offer.company();
    }

    /**
     * Result of one offer.
     */
    record OfferOutcome(
            Status status,
            PlacementEvent event,
            FailedOffer failure,
            boolean duplicateTarget
    ) {
        enum Status {
            CREATED,
            UPDATED,
            UNCHANGED,
            FAILED
        }

        static OfferOutcome created(PlacementEvent event, boolean duplicateTarget) {
            return new OfferOutcome(Status.CREATED, event, null, duplicateTarget);
        }

        static OfferOutcome updated(PlacementEvent event, boolean duplicateTarget) {
            return new OfferOutcome(Status.UPDATED, event, null, duplicateTarget);
        }

        static OfferOutcome unchanged(boolean duplicateTarget) {
            return new OfferOutcome(Status.UNCHANGED, null, null, duplicateTarget);
        }

        static OfferOutcome failed(FailedOffer failure) {
            return new OfferOutcome(Status.FAILED, null, failure, false);
        }
    }
}
