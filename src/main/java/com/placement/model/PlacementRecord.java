package com.placement.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical per-company placement document.
 *
 * <p>Roles are keyed by role name and students by enrollment number, both in insertion
 * order. {@code version} is the optimistic concurrency token checked by conditional writes.
 */
public record PlacementRecord(
    String id,
    String company,
    Map<String, RolePackage> roles,
    Map<String, Student> studentsSelected,
    Instant createdAt,
    Instant updatedAt,
    long version
) {
    public PlacementRecord {
        roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles == null ? Map.of() : roles));
        studentsSelected = Collections.unmodifiableMap(
                new LinkedHashMap<>(studentsSelected == null ? Map.of() : studentsSelected));
    }

    @JsonProperty("number_of_offers")
    public int numberOfOffers() {
        return studentsSelected.size();
    }

    public PlacementRecord withId(String newId) {
        return new PlacementRecord(newId, company, roles, studentsSelected, createdAt, updatedAt, version);
    }

    public PlacementRecord withVersion(long newVersion) {
        return new PlacementRecord(id, company, roles, studentsSelected, createdAt, updatedAt, newVersion);
    }
}
