package com.placement.service;

import com.placement.model.PlacementRecord;
import com.placement.model.PlacementStats;
import com.placement.model.PlacementStats.CompanyStats;
import com.placement.model.RolePackage;
import com.placement.model.Student;
import com.placement.repository.PlacementRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Package statistics over every stored record.
 *
 * A student's effective package is their own package, else their role's package in the
 * record, else the record's highest role package. Students without any resolvable package
 * are counted but left out of the package aggregates. Averages and medians are rounded to
 * two decimals, HALF_UP.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PlacementStatsService {

    private static final int SCALE = 2;

    private final PlacementRecordStore store;

    public PlacementStats computeStats() {
        List<PlacementRecord> records = store.findAll();

        // duplicate records of one company land in the same bucket
        Map<String, CompanyAccumulator> byCompany = new TreeMap<>();
        List<BigDecimal> allPackages = new ArrayList<>();
        int totalStudents = 0;

        for (PlacementRecord record : records) {
            CompanyAccumulator acc = byCompany.computeIfAbsent(record.company(), k -> new CompanyAccumulator());
            BigDecimal highestRole = highestRolePackage(record);
            for (Student student : record.studentsSelected().values()) {
                totalStudents++;
                acc.students++;
                BigDecimal effective = effectivePackage(student, record, highestRole);
                if (effective != null) {
                    acc.packages.add(effective);
                    allPackages.add(effective);
                }
            }
        }

        List<CompanyStats> companies = byCompany.entrySet().stream()
                .map(e -> new CompanyStats(
                        e.getKey(),
                        e.getValue().students,
                        max(e.getValue().packages),
                        average(e.getValue().packages)))
                .toList();

        log.debug("Computed stats over {} records, {} students, {} with a package",
                records.size(), totalStudents, allPackages.size());

        return new PlacementStats(
                records.size(),
                totalStudents,
                average(allPackages),
                median(allPackages),
                max(allPackages),
                companies);
    }

    static BigDecimal effectivePackage(Student student, PlacementRecord record, BigDecimal highestRole) {
        if (student.packageValue() != null) {
            return student.packageValue();
        }
        if (student.role() != null) {
            RolePackage role = record.roles().get(student.role());
            if (role != null && role.packageValue() != null) {
                return role.packageValue();
            }
        }
        return highestRole;
    }

    private static BigDecimal highestRolePackage(PlacementRecord record) {
        return record.roles().values().stream()
                .map(RolePackage::packageValue)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
    }

    static BigDecimal average(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return null;
        }
        BigDecimal sum = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(values.size()), SCALE, RoundingMode.HALF_UP);
    }

    static BigDecimal median(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return null;
        }
        List<BigDecimal> sorted = values.stream().sorted().toList();
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid).setScale(SCALE, RoundingMode.HALF_UP);
        }
        return sorted.get(mid - 1).add(sorted.get(mid))
                .divide(BigDecimal.valueOf(2), SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal max(List<BigDecimal> values) {
        return values.stream().max(Comparator.naturalOrder()).orElse(null);
    }

    private static final class CompanyAccumulator {
        private int students;
        private final List<BigDecimal> packages = new ArrayList<>();
    }
}
