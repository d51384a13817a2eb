package com.placement.repository;

import com.placement.model.InsertResult;
import com.placement.model.PlacementRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Process-local record store used when MongoDB is disabled.
 * Compare-and-swap is done inside {@link ConcurrentHashMap#computeIfPresent}, which is atomic per key.
 */
@Repository
@ConditionalOnProperty(name = "app.mongodb.enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class InMemoryPlacementRecordStore implements PlacementRecordStore {

    private static final Comparator<PlacementRecord> NEWEST_FIRST =
            Comparator.comparing(PlacementRecord::updatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .reversed();

    private final Map<String, PlacementRecord> records = new ConcurrentHashMap<>();

    public InMemoryPlacementRecordStore() {
        log.info("MongoDB is disabled, using in-memory placement record store");
    }

    @Override
    public void ping() {
        // always reachable
    }

    @Override
    public List<PlacementRecord> findByCompany(String company) {
        return records.values().stream()
                .filter(r -> r.company().equals(company))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public Optional<PlacementRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<PlacementRecord> findAll() {
        return records.values().stream()
                .sorted(Comparator.comparing(PlacementRecord::company)
                        .thenComparing(PlacementRecord::updatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }

    @Override
    public List<String> findDuplicateCompanies() {
        return records.values().stream()
                .collect(Collectors.groupingBy(PlacementRecord::company, Collectors.counting()))
                .entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    @Override
    public InsertResult insert(PlacementRecord record) {
        String id = record.id() != null ? record.id() : UUID.randomUUID().toString();
        PlacementRecord previous = records.putIfAbsent(id, record.withId(id));
        return previous == null ? InsertResult.inserted(id) : InsertResult.alreadyExists(id);
    }

    @Override
    public boolean updateConditional(String id, long expectedVersion, PlacementRecord record) {
        AtomicBoolean applied = new AtomicBoolean(false);
        records.computeIfPresent(id, (key, current) -> {
            if (current.version() != expectedVersion) {
                return current;
            }
            applied.set(true);
            return new PlacementRecord(key, current.company(), record.roles(), record.studentsSelected(),
                    current.createdAt(), record.updatedAt(), expectedVersion + 1);
        });
        return applied.get();
    }

    /**
     * Number of stored records, across all companies.
     */
    public int size() {
        return records.size();
    }
}
