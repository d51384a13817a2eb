package com.placement.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.placement.model.OfferBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Skips offer batches that were already accepted within the cache TTL.
 *
 * Batches without an id are always accepted. Thread-safe: Caffeine caches are
 * inherently thread-safe.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchDeduplicationService {

    private final Cache<String, Long> batchDeduplicationCache;

    /**
     * Check and mark atomically - returns true if the batch should be reconciled.
     *
     * Uses putIfAbsent semantics:
     * - If batch id not in cache: adds it and returns true (process it)
     * - If batch id already in cache: returns false (skip it)
     */
    public boolean tryAcquire(OfferBatch batch) {
        String batchId = batch.batchId();
        if (batchId == null || batchId.isBlank()) {
            return true;
        }
        Long existingTimestamp = batchDeduplicationCache.asMap()
                .putIfAbsent(batchId, System.currentTimeMillis());

        if (existingTimestamp != null) {
            log.warn("DUPLICATE BATCH DETECTED: batchId={} (originally accepted at {})", batchId, existingTimestamp);
            return false;
        }
        return true;
    }

    /**
     * Forget a batch so a redelivery is reconciled again, used when reconciliation of the
     * batch failed as a whole.
     */
    public void release(OfferBatch batch) {
        if (batch.batchId() != null) {
            batchDeduplicationCache.invalidate(batch.batchId());
            log.debug("Released batch id {} for redelivery", batch.batchId());
        }
    }

    public CacheStats getStats() {
        var stats = batchDeduplicationCache.stats();
        return new CacheStats(
                batchDeduplicationCache.estimatedSize(),
                stats.hitCount(),
                stats.missCount(),
                stats.hitRate()
        );
    }

    public record CacheStats(
            long size,
            long hits,
            long misses,
            double hitRate
    ) {}
}
