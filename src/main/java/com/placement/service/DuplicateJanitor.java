package com.placement.service;

import com.placement.model.DuplicateReport;
import com.placement.model.PlacementRecord;
import com.placement.model.Resolution;
import com.placement.repository.PlacementRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only report of companies that ended up with more than one canonical record,
 * typically from two first inserts racing. Nothing is merged or deleted here; the report
 * names the record the {@link IdentityResolver} currently merges into so an operator can
 * clean up the rest.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DuplicateJanitor {

    private final PlacementRecordStore store;
    private final IdentityResolver identityResolver;

    public List<DuplicateReport> scan() {
        List<String> companies = store.findDuplicateCompanies();
        List<DuplicateReport> reports = new ArrayList<>();

        for (String company : companies) {
            List<PlacementRecord> records = store.findByCompany(company);
            // may have changed since the grouping query
            if (records.size() < 2) {
                continue;
            }
            Resolution resolution = identityResolver.select(records);
            reports.add(new DuplicateReport(
                    company,
                    records.stream().map(PlacementRecord::id).toList(),
                    resolution.target().id()));
        }

        if (reports.isEmpty()) {
            log.info("Duplicate scan: no company has more than one record");
        } else {
            log.warn("Duplicate scan: {} companies have more than one record: {}",
                    reports.size(), reports.stream().map(DuplicateReport::company).toList());
        }
        return reports;
    }
}
