package com.placement.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Aggregate package statistics across all canonical records.
 */
public record PlacementStats(
    int totalRecords,
    int totalStudents,
    BigDecimal averagePackage,
    BigDecimal medianPackage,
    BigDecimal highestPackage,
    List<CompanyStats> companies
) {
    public record CompanyStats(
        String company,
        int students,
        BigDecimal highestPackage,
        BigDecimal averagePackage
    ) {}
}
