package com.placement.service;

import com.placement.model.MergeOutcome;
import com.placement.model.Offer;
import com.placement.model.PlacementRecord;
import com.placement.model.RolePackage;
import com.placement.model.Student;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds an {@link Offer} into a {@link PlacementRecord}.
 *
 * Rules:
 * - roles: unknown role is added; a known role takes the incoming package only when it is
 *   strictly greater, and keeps its stored details unless the offer brings new ones
 * - students: unknown enrollment number is inserted; a known one keeps the higher package,
 *   and its role follows the package, so a lower offer never rewrites the role and an
 *   offer without a role never clears it
 * - student names are refreshed from any non-blank incoming name
 * - an absent package never replaces anything, and is replaced by any present one
 *
 * Stateless and side-effect free: the input record is never modified.
 */
@Component
public class RecordMerger {

    /**
     * @param existing record to merge into, or null to build a new one
     * @param offer    validated offer
     * @param now      merge time; becomes {@code updatedAt} unless the record is already newer
     */
    public MergeOutcome merge(PlacementRecord existing, Offer offer, Instant now) {
        return existing == null ? create(offer, now) : mergeInto(existing, offer, now);
    }

    private MergeOutcome create(Offer offer, Instant now) {
        Map<String, RolePackage> roles = new LinkedHashMap<>();
        for (RolePackage incoming : offer.roles()) {
            if (isBlank(incoming.role())) {
                continue;
            }
            roles.merge(incoming.role(), incoming,
                    (kept, next) -> isGreater(next.packageValue(), kept.packageValue()) ? upgradeRole(kept, next) : kept);
        }

        Map<String, Student> students = new LinkedHashMap<>();
        for (Student incoming : offer.studentsSelected()) {
            students.merge(incoming.enrollmentNumber(), incoming, (kept, next) -> {
                Student merged = isGreater(next.packageValue(), kept.packageValue()) ? upgradeStudent(kept, next) : kept;
                return isBlank(next.name()) ? merged : merged.withName(next.name());
            });
        }

        PlacementRecord record = new PlacementRecord(null, offer.company(), roles, students, now, now, 0L);
        return new MergeOutcome(record, List.copyOf(students.values()), List.of(), true);
    }

    private MergeOutcome mergeInto(PlacementRecord existing, Offer offer, Instant now) {
        boolean changed = false;

        Map<String, RolePackage> roles = new LinkedHashMap<>(existing.roles());
        for (RolePackage incoming : offer.roles()) {
            if (isBlank(incoming.role())) {
                continue;
            }
            RolePackage stored = roles.get(incoming.role());
            if (stored == null) {
                roles.put(incoming.role(), incoming);
                changed = true;
            } else if (isGreater(incoming.packageValue(), stored.packageValue())) {
                roles.put(incoming.role(), upgradeRole(stored, incoming));
                changed = true;
            }
        }

        Map<String, Student> students = new LinkedHashMap<>(existing.studentsSelected());
        List<Student> added = new ArrayList<>();
        Map<String, Student> upgraded = new LinkedHashMap<>();
        for (Student incoming : offer.studentsSelected()) {
            String key = incoming.enrollmentNumber();
            Student stored = students.get(key);
            if (stored == null) {
                students.put(key, incoming);
                added.add(incoming);
                changed = true;
                continue;
            }

            Student merged = stored;
            if (isGreater(incoming.packageValue(), stored.packageValue())) {
                merged = upgradeStudent(merged, incoming);
            }
            if (!isBlank(incoming.name())) {
                merged = merged.withName(incoming.name());
            }
            if (!merged.equals(stored)) {
                students.put(key, merged);
                changed = true;
                if (!Objects.equals(merged.packageValue(), stored.packageValue())) {
                    upgraded.put(key, merged);
                }
            }
        }

        // a student added earlier in this same offer may have been upgraded by a later entry
        List<Student> newlyAdded = added.stream()
                .map(s -> students.get(s.enrollmentNumber()))
                .toList();
        added.forEach(s -> upgraded.remove(s.enrollmentNumber()));

        Instant updatedAt = existing.updatedAt() != null && existing.updatedAt().isAfter(now)
                ? existing.updatedAt()
                : now;

        PlacementRecord record = new PlacementRecord(existing.id(), existing.company(), roles, students,
                existing.createdAt(), updatedAt, existing.version());
        return new MergeOutcome(record, newlyAdded, List.copyOf(upgraded.values()), changed);
    }

    /**
     * Higher package for a known role; stored details survive an offer that omits them.
     */
    private static RolePackage upgradeRole(RolePackage stored, RolePackage incoming) {
        String details = incoming.packageDetails() != null ? incoming.packageDetails() : stored.packageDetails();
        return new RolePackage(stored.role(), incoming.packageValue(), details);
    }

    /**
     * Higher package for a known student; the role follows the package unless the offer has none.
     */
    private static Student upgradeStudent(Student stored, Student incoming) {
        String role = isBlank(incoming.role()) ? stored.role() : incoming.role();
        return stored.withRoleAndPackage(role, incoming.packageValue());
    }

    /**
     * True when {@code incoming} should replace {@code stored}: a present value beats an absent
     * one, otherwise only a strictly greater value wins.
     */
    static boolean isGreater(BigDecimal incoming, BigDecimal stored) {
        if (incoming == null) {
            return false;
        }
        return stored == null || incoming.compareTo(stored) > 0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
