package com.placement.route;

import com.placement.config.TraceContextManager;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.Exchange;
import org.apache.camel.Processor;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Sets up trace ids for Kafka offer batches and tags the active span with the Camel
 * exchange id, so every log line of one batch carries the same correlation ids.
 *
 * Must run first in the consumer route.
 */
@Component("traceIdProcessor")
@Slf4j
public class TraceIdProcessor implements Processor {

    static final String CREATED_SPAN = "createdSpan";
    static final String CREATED_SPAN_SCOPE = "createdSpanScope";

    private final Tracer tracer;

    public TraceIdProcessor(@Nullable Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void process(Exchange exchange) {
        TraceContextManager.ensureForExchange(exchange);

        String exchangeId = exchange.getExchangeId();
        MDC.put("exchangeId", exchangeId);
        exchange.setProperty("exchangeId", exchangeId);

        if (tracer == null) {
            return;
        }
        try {
            Span current = tracer.currentSpan();
            if (current != null) {
                current.tag("camel.exchange_id", exchangeId);
            } else {
                Span created = tracer.nextSpan().name("reconcile-batch:" + exchangeId).start();
                created.tag("camel.exchange_id", exchangeId);
                exchange.setProperty(CREATED_SPAN, created);
                exchange.setProperty(CREATED_SPAN_SCOPE, tracer.withSpan(created));
            }
        } catch (RuntimeException e) {
            log.debug("Failed to tag or create span for exchange {}", exchangeId, e);
        }
    }

    /**
     * Ends any span created for the exchange and clears the MDC.
     */
    public static void clearTraceContext(Exchange exchange) {
        if (exchange != null) {
            Tracer.SpanInScope scope = exchange.getProperty(CREATED_SPAN_SCOPE, Tracer.SpanInScope.class);
            if (scope != null) {
                scope.close();
            }
            Span span = exchange.getProperty(CREATED_SPAN, Span.class);
            if (span != null) {
                span.end();
            }
        }
        TraceContextManager.clear();
    }
}
