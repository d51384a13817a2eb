package com.placement.model;

import java.util.List;

/**
 * Result of looking up the canonical record(s) for a company.
 * For {@link Kind#MANY} the {@code target} is the record that receives the merge and
 * {@code duplicates} are the others, left untouched.
 */
public record Resolution(
    Kind kind,
    PlacementRecord target,
    List<PlacementRecord> duplicates
) {
    public enum Kind {
        NONE,
        ONE,
        MANY
    }

    public static Resolution none() {
        return new Resolution(Kind.NONE, null, List.of());
    }

    public static Resolution one(PlacementRecord target) {
        return new Resolution(Kind.ONE, target, List.of());
    }

    public static Resolution many(PlacementRecord target, List<PlacementRecord> duplicates) {
        return new Resolution(Kind.MANY, target, List.copyOf(duplicates));
    }
}
