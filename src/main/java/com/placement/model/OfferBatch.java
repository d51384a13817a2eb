package com.placement.model;

import java.util.List;

/**
 * Envelope received from Kafka or the REST endpoint.
 * {@code batchId} is optional and only used to skip replayed batches.
 */
public record OfferBatch(
    String batchId,
    List<Offer> offers
) {
    public OfferBatch {
        offers = offers == null ? List.of() : offers;
    }
}
