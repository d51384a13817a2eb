package com.placement.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TraceIdFilterTest {

    private TraceIdFilter filter;
    private HttpServletRequest req;
    private HttpServletResponse resp;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new TraceIdFilter();
        req = mock(HttpServletRequest.class);
        resp = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        TraceContextManager.clear();
    }

    @AfterEach
    void tearDown() {
        TraceContextManager.clear();
    }

    @Test
    void doFilter_generatesTraceIdAndCleansUp() throws Exception {
        doAnswer(invocation -> {
            String traceId = MDC.get(TraceContextManager.TRACE_ID);
            assertNotNull(traceId);
            assertEquals(32, traceId.length());
            assertNull(MDC.get(TraceContextManager.BATCH_ID));
            return null;
        }).when(chain).doFilter(req, resp);

        filter.doFilter(req, resp, chain);

        assertNull(MDC.get(TraceContextManager.TRACE_ID));
        verify(resp).setHeader(eq(TraceContextManager.TRACE_HEADER), anyString());
        verify(resp, never()).setHeader(eq(TraceContextManager.BATCH_HEADER), anyString());
    }

    @Test
    void doFilter_keepsInboundTraceIdAndTagsBatch() throws Exception {
        when(req.getHeader(TraceContextManager.TRACE_HEADER)).thenReturn("caller-trace-1");
        when(req.getHeader(TraceContextManager.BATCH_HEADER)).thenReturn(" batch-42 ");

        doAnswer(invocation -> {
            assertEquals("caller-trace-1", MDC.get(TraceContextManager.TRACE_ID));
            assertEquals("batch-42", MDC.get(TraceContextManager.BATCH_ID));
            return null;
        }).when(chain).doFilter(req, resp);

        filter.doFilter(req, resp, chain);

        verify(chain).doFilter(req, resp);
        verify(resp).setHeader(TraceContextManager.TRACE_HEADER, "caller-trace-1");
        verify(resp).setHeader(TraceContextManager.BATCH_HEADER, "batch-42");
        assertNull(MDC.get(TraceContextManager.TRACE_ID));
        assertNull(MDC.get(TraceContextManager.BATCH_ID));
    }

    @Test
    void doFilter_ignoresBlankBatchHeader() throws Exception {
        when(req.getHeader(TraceContextManager.BATCH_HEADER)).thenReturn("  ");

        doAnswer(invocation -> {
            assertNull(MDC.get(TraceContextManager.BATCH_ID));
            return null;
        }).when(chain).doFilter(req, resp);

        filter.doFilter(req, resp, chain);

        verify(resp, never()).setHeader(eq(TraceContextManager.BATCH_HEADER), anyString());
    }
}
