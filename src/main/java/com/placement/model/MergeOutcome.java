package com.placement.model;

import java.util.List;

/**
 * Merged record plus what the merge changed.
 */
public record MergeOutcome(
    PlacementRecord record,
    List<Student> newlyAddedStudents,
    List<Student> upgradedStudents,
    boolean changed
) {}
