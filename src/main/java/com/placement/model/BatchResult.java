package com.placement.model;

import java.util.List;

/**
 * Outcome of reconciling one batch.
 * {@code processed} counts every offer handled, successful or not.
 */
public record BatchResult(
    int processed,
    int created,
    int updated,
    int unchanged,
    int duplicateTargets,
    List<FailedOffer> failed,
    List<PlacementEvent> events,
    long processingTimeMs
) {
    public static BatchResult empty() {
        return new BatchResult(0, 0, 0, 0, 0, List.of(), List.of(), 0);
    }

    public int succeeded() {
        return created + updated + unchanged;
    }
}
