package com.placement.service;

import com.placement.model.FailedOffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Dead Letter Publisher - reports offers that could not be reconciled.
 * Each entry keeps the full offer, so an operator can replay it through
 * POST /api/placements/reconcile once the cause is fixed.
 */
@Service
@Slf4j
public class DeadLetterPublisher {

    public void send(List<FailedOffer> failedOffers) {
        if (failedOffers.isEmpty()) {
            return;
        }

        log.warn("Publishing {} failed offers to Dead Letter Queue", failedOffers.size());

        for (FailedOffer failed : failedOffers) {
            log.warn("  DLQ: Offer for '{}' failed - {} [{}] ({}) after {} attempts",
                    failed.offer() != null ? failed.offer().company() : null,
                    failed.errorMessage(),
                    failed.errorKind(),
                    failed.exceptionType(),
                    failed.attempts());
        }
    }
}
