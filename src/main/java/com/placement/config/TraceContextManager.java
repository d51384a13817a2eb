package com.placement.config;

import org.apache.camel.Exchange;
import org.slf4j.MDC;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.UUID;

/**
 * Centralized trace context helper used by the HTTP filter and the Camel processors.
 * Keeps traceId/spanId/batchId generation, MDC population, header propagation and
 * cleanup in one place.
 */
public final class TraceContextManager {

    public static final String TRACE_ID = "traceId";
    public static final String SPAN_ID = "spanId";
    public static final String BATCH_ID = "batchId";
    public static final String TRACE_HEADER = "X-Trace-Id";
    public static final String BATCH_HEADER = "X-Batch-Id";

    private TraceContextManager() {}

    public static String ensureForHttp(HttpServletRequest request, HttpServletResponse response) {
        String traceId = firstNonEmpty(request.getHeader(TRACE_HEADER), MDC.get(TRACE_ID));
        if (traceId == null) {
            traceId = generateTraceId();
        }
        String spanId = firstNonEmpty(MDC.get(SPAN_ID));
        if (spanId == null) {
            spanId = generateSpanId();
        }

        MDC.put(TRACE_ID, traceId);
        MDC.put(SPAN_ID, spanId);

        if (response != null) {
            response.setHeader(TRACE_HEADER, traceId);
        }

        return traceId;
    }

    public static String ensureForExchange(Exchange exchange) {
        String traceId = firstNonEmpty(
                exchange.getIn().getHeader(TRACE_HEADER, String.class),
                exchange.getIn().getHeader(TRACE_ID, String.class),
                MDC.get(TRACE_ID));
        if (traceId == null) {
            traceId = generateTraceId();
        }

        String spanId = firstNonEmpty(exchange.getIn().getHeader(SPAN_ID, String.class), MDC.get(SPAN_ID));
        if (spanId == null) {
            spanId = generateSpanId();
        }

        MDC.put(TRACE_ID, traceId);
        MDC.put(SPAN_ID, spanId);

        exchange.setProperty(TRACE_ID, traceId);
        exchange.setProperty(SPAN_ID, spanId);
        exchange.getIn().setHeader(TRACE_HEADER, traceId);
        exchange.getIn().setHeader(SPAN_ID, spanId);

        return traceId;
    }

    /**
     * Tags subsequent log lines with the batch being reconciled. Null ids are ignored.
     */
    public static void putBatchId(String batchId) {
        if (batchId != null && !batchId.isEmpty()) {
            MDC.put(BATCH_ID, batchId);
        }
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static String generateSpanId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
        MDC.remove(SPAN_ID);
        MDC.remove(BATCH_ID);
        MDC.remove("exchangeId");
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }
}
