package com.placement.service;

import com.placement.model.PlacementRecord;
import com.placement.model.Resolution;
import com.placement.repository.PlacementRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Finds the canonical record(s) for a company name (exact match, no normalization) and
 * picks the merge target.
 *
 * With several candidates the most recently updated one wins; ties fall back to the most
 * recently created, then to the highest id, so every caller picks the same record.
 * The other candidates are left alone.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IdentityResolver {

    static final Comparator<PlacementRecord> TARGET_PREFERENCE = Comparator
            .comparing(PlacementRecord::updatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(PlacementRecord::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(PlacementRecord::id, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    private final PlacementRecordStore store;

    public Resolution resolve(String company) {
        return select(store.findByCompany(company));
    }

    /**
     * Chooses among candidates already loaded for one company.
     */
    public Resolution select(List<PlacementRecord> candidates) {
        if (candidates.isEmpty()) {
            return Resolution.none();
        }
        if (candidates.size() == 1) {
            return Resolution.one(candidates.get(0));
        }

        PlacementRecord target = candidates.stream().max(TARGET_PREFERENCE).orElseThrow();
        List<PlacementRecord> duplicates = candidates.stream()
                .filter(r -> r != target)
                .toList();
        log.warn("Company '{}' has {} canonical records, merging into {} (updatedAt={})",
                target.company(), candidates.size(), target.id(), target.updatedAt());
        return Resolution.many(target, duplicates);
    }
}
