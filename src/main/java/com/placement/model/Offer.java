package com.placement.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One structured placement announcement, as produced by the formatting pipeline.
 *
 * <p>{@code numberOfOffers} is informational only; the reconciler always recomputes
 * the count from the merged student set.
 */
public record Offer(
    String company,
    List<RolePackage> roles,
    List<Student> studentsSelected,
    Integer numberOfOffers,
    Instant receivedAt,
    String emailSender,
    String timeSent
) {
    public Offer {
        // null elements are kept so the validator can report them
        roles = roles == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(roles));
        studentsSelected = studentsSelected == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(studentsSelected));
    }

    public Offer(String company, List<RolePackage> roles, List<Student> studentsSelected) {
        this(company, roles, studentsSelected, studentsSelected == null ? 0 : studentsSelected.size(),
                Instant.now(), null, null);
    }
}
