package com.placement.model;

import java.util.List;

/**
 * A company with more than one canonical record, and the record that currently
 * receives merges.
 */
public record DuplicateReport(
    String company,
    List<String> recordIds,
    String chosenTargetId
) {}
