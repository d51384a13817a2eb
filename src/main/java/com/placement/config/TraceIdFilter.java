package com.placement.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Puts the caller's correlation ids into MDC for the lifetime of an HTTP request.
 *
 * An inbound {@code X-Trace-Id} is kept, otherwise one is generated; either way it is
 * echoed on the response. A reconcile request may name its batch in {@code X-Batch-Id} so
 * that log lines written before the body is parsed (binding, validation errors) already
 * carry the batch; the id from the body takes over once the batch is processed.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            TraceContextManager.ensureForHttp(request, response);

            String batchId = request.getHeader(TraceContextManager.BATCH_HEADER);
            if (batchId != null && !batchId.isBlank()) {
                TraceContextManager.putBatchId(batchId.strip());
                response.setHeader(TraceContextManager.BATCH_HEADER, batchId.strip());
            }

            filterChain.doFilter(request, response);
        } finally {
            TraceContextManager.clear();
        }
    }
}
