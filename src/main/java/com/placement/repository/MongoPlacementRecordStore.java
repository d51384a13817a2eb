package com.placement.repository;

import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.client.result.UpdateResult;
import com.placement.config.AppMetrics;
import com.placement.exception.StoreUnavailableException;
import com.placement.model.InsertResult;
import com.placement.model.PlacementDocument;
import com.placement.model.PlacementRecord;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * MongoDB-backed record store.
 *
 * Reads use the Spring Data repository or MongoTemplate queries bounded by {@code maxTime}.
 * Updates are compare-and-swap on the {@code version} field: the filter matches both the id
 * and the version that was read, so a concurrent writer makes the update match nothing.
 *
 * Transient failures (connection loss, timeouts) are retried with exponential backoff and
 * jitter, then surfaced as {@link StoreUnavailableException}.
 */
@Repository
@ConditionalOnProperty(name = "app.mongodb.enabled", havingValue = "true")
@Slf4j
public class MongoPlacementRecordStore implements PlacementRecordStore {

    private final MongoTemplate mongoTemplate;
    private final PlacementDocumentRepository repository;
    private final AppMetrics metrics;
    private final Duration queryTimeout;
    private final int maxRetries;
    private final long retryDelayMs;

    public MongoPlacementRecordStore(
            MongoTemplate mongoTemplate,
            PlacementDocumentRepository repository,
            AppMetrics metrics,
            @Value("${app.store.query-timeout-ms:2000}") long queryTimeoutMs,
            @Value("${app.store.max-retries:2}") int maxRetries,
            @Value("${app.store.retry-delay-ms:100}") long retryDelayMs) {
        this.mongoTemplate = mongoTemplate;
        this.repository = repository;
        this.metrics = metrics;
        this.queryTimeout = Duration.ofMillis(queryTimeoutMs);
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelayMs;
        log.info("MongoPlacementRecordStore initialized with queryTimeout: {}ms, maxRetries: {}, retryDelayMs: {}ms",
                queryTimeoutMs, maxRetries, retryDelayMs);
    }

    @Override
    public void ping() {
        withRetry("ping", () -> mongoTemplate.executeCommand(new Document("ping", 1)));
    }

    @Override
    public List<PlacementRecord> findByCompany(String company) {
        return timedRead(() -> withRetry("findByCompany", () -> {
            Query query = new Query(Criteria.where("company").is(company))
                    .with(Sort.by(Sort.Direction.DESC, "updatedAt"))
                    .maxTime(queryTimeout);
            return mongoTemplate.find(query, PlacementDocument.class).stream()
                    .map(PlacementDocument::toRecord)
                    .toList();
        }));
    }

    @Override
    public Optional<PlacementRecord> findById(String id) {
        return timedRead(() -> withRetry("findById",
                () -> repository.findById(id).map(PlacementDocument::toRecord)));
    }

    @Override
    public List<PlacementRecord> findAll() {
        return timedRead(() -> withRetry("findAll",
                () -> repository.findAll(Sort.by("company", "updatedAt")).stream()
                        .map(PlacementDocument::toRecord)
                        .toList()));
    }

    @Override
    public List<String> findDuplicateCompanies() {
        return timedRead(() -> withRetry("findDuplicateCompanies", () -> {
            Aggregation aggregation = Aggregation.newAggregation(
                    Aggregation.group("company").count().as("count"),
                    Aggregation.match(Criteria.where("count").gt(1)),
                    Aggregation.sort(Sort.Direction.ASC, "_id"));
            return mongoTemplate.aggregate(aggregation, PlacementDocument.class, Document.class)
                    .getMappedResults().stream()
                    .map(doc -> doc.getString("_id"))
                    .toList();
        }));
    }

    @Override
    public InsertResult insert(PlacementRecord record) {
        // id is fixed before the first attempt so a retried insert can detect its own earlier success
        String id = record.id() != null ? record.id() : ObjectId.get().toHexString();
        PlacementDocument document = PlacementDocument.fromRecord(record.withId(id));

        return timedWrite(() -> withRetry("insert", () -> {
            try {
                mongoTemplate.insert(document);
                log.debug("Inserted placement record {} for company '{}'", id, record.company());
                return InsertResult.inserted(id);
            } catch (DuplicateKeyException e) {
                log.info("Placement record {} already exists, treating insert as done", id);
                return InsertResult.alreadyExists(id);
            }
        }));
    }

    @Override
    public boolean updateConditional(String id, long expectedVersion, PlacementRecord record) {
        Query query = new Query(Criteria.where("_id").is(id).and("version").is(expectedVersion));
        Update update = new Update()
                .set("roles", PlacementDocument.toRoleEntries(record))
                .set("studentsSelected", PlacementDocument.toStudentEntries(record))
                .set("numberOfOffers", record.numberOfOffers())
                .set("updatedAt", record.updatedAt())
                .inc("version", 1);

        return timedWrite(() -> withRetry("updateConditional", () -> {
            UpdateResult result = mongoTemplate.updateFirst(query, update, PlacementDocument.class);
            boolean applied = result.getMatchedCount() == 1;
            if (!applied) {
                log.debug("Conditional update of {} at version {} matched nothing", id, expectedVersion);
            }
            return applied;
        }));
    }

    private <T> T timedRead(Supplier<T> operation) {
        long start = System.currentTimeMillis();
        try {
            return operation.get();
        } finally {
            metrics.recordStoreRead(System.currentTimeMillis() - start);
        }
    }

    private <T> T timedWrite(Supplier<T> operation) {
        long start = System.currentTimeMillis();
        try {
            return operation.get();
        } finally {
            metrics.recordStoreWrite(System.currentTimeMillis() - start);
        }
    }

    /**
     * Retry wrapper for transient store failures.
     * Retries up to `maxRetries` times with exponential backoff and jitter.
     */
    private <T> T withRetry(String operationName, Supplier<T> operation) {
        int attempt = 0;
        final int totalAttempts = maxRetries + 1;
        while (true) {
            try {
                attempt++;
                return operation.get();
            } catch (DataAccessException e) {
                if (!isTransient(e)) {
                    throw e;
                }
                if (attempt > maxRetries) {
                    log.error("Store operation '{}' failed after {} attempts: {}",
                            operationName, attempt, e.getMessage());
                    throw new StoreUnavailableException(
                            "Store operation '" + operationName + "' failed after " + attempt + " attempts", e);
                }

                // exponential backoff: base * 2^(attempt-1)
                long baseDelay = retryDelayMs * (1L << (attempt - 1));
                long jitter = ThreadLocalRandom.current().nextLong(0, Math.max(1L, Math.min(1000L, baseDelay)));
                long delay = Math.min(baseDelay + jitter, 60000L);

                log.warn("Store operation '{}' failed (attempt {}/{}), retrying in {}ms: {}",
                        operationName, attempt, totalAttempts, delay, e.getMessage());
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StoreUnavailableException("Interrupted while retrying '" + operationName + "'", e);
                }
            }
        }
    }

    private boolean isTransient(DataAccessException e) {
        return e instanceof DataAccessResourceFailureException
                || e instanceof TransientDataAccessException
                || e.getMostSpecificCause() instanceof MongoExecutionTimeoutException;
    }
}
