package com.placement.route;

import com.placement.model.OfferBatch;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.Exchange;
import org.apache.camel.Processor;
import org.springframework.stereotype.Component;

/**
 * Handles offer batches that still failed after Camel's redeliveries,
 * typically because the record store stayed unreachable.
 */
@Component("deadLetterProcessor")
@Slf4j
public class DeadLetterProcessor implements Processor {

    @Override
    public void process(Exchange exchange) {
        Exception cause = exchange.getProperty(Exchange.EXCEPTION_CAUGHT, Exception.class);
        Object body = exchange.getIn().getBody();

        log.error("╔══════════════════════════════════════════════════════════════╗");
        log.error("║ DEAD LETTER PROCESSOR                                         ║");
        log.error("║ Message Type: {}                                              ",
                body != null ? body.getClass().getSimpleName() : "null");
        log.error("║ Exception: {}                                                 ",
                cause != null ? cause.getMessage() : "Unknown");
        log.error("╚══════════════════════════════════════════════════════════════╝");

        if (body instanceof OfferBatch batch) {
            log.error("Failed batch {} with {} offers", batch.batchId(), batch.offers().size());
        }
        // original message (useOriginalMessage), kept in the log for manual replay
        log.error("DLQ: Original body: {}", body);
    }
}
