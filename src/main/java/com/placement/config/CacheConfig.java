package com.placement.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Caffeine cache configuration.
 *
 * BATCH DEDUPLICATION CACHE - remembers offer batch ids already reconciled
 *    - Skips batches redelivered by Kafka after a rebalance or retry
 *    - TTL: 1 hour by default
 *    - Reconciliation is idempotent anyway; this only saves store round trips
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Value("${app.cache.batch-dedup.max-size:10000}")
    private int dedupMaxSize;

    @Value("${app.cache.batch-dedup.ttl-minutes:60}")
    private int dedupTtlMinutes;

    /**
     * Value is the timestamp when the batch was first accepted.
     */
    @Bean
    public Cache<String, Long> batchDeduplicationCache() {
        log.info("Creating batch deduplication cache: maxSize={}, ttl={}m", dedupMaxSize, dedupTtlMinutes);
        return Caffeine.newBuilder()
                .maximumSize(dedupMaxSize)
                .expireAfterWrite(Duration.ofMinutes(dedupTtlMinutes))
                .recordStats()
                .build();
    }
}
