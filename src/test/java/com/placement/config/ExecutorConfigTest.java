package com.placement.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ContextConfiguration;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "app.executor.reconcile-threads=3")
@ContextConfiguration(classes = {ExecutorConfig.class})
class ExecutorConfigTest {

    private static final String TRACE_ID = "traceId";

    @Autowired
    @Qualifier("reconcileExecutor")
    private ExecutorService reconcileExecutor;

    @BeforeEach
    void setUp() {
        MDC.clear();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void shouldPropagateMdcWithExecute() throws Exception {
        final String traceIdValue = UUID.randomUUID().toString();
        final CountDownLatch latch = new CountDownLatch(1);
        final CompletableFuture<String> mdcValueFuture = new CompletableFuture<>();

        MDC.put(TRACE_ID, traceIdValue);

        reconcileExecutor.execute(() -> {
            try {
                mdcValueFuture.complete(MDC.get(TRACE_ID));
            } finally {
                latch.countDown();
            }
        });

        latch.await(5, TimeUnit.SECONDS);
        MDC.remove(TRACE_ID);

        assertThat(mdcValueFuture).isCompletedWithValue(traceIdValue);
    }

    @Test
    void shouldPropagateMdcWithSubmit() throws Exception {
        final String traceIdValue = UUID.randomUUID().toString();
        MDC.put(TRACE_ID, traceIdValue);

        Future<String> future = reconcileExecutor.submit(() -> MDC.get(TRACE_ID));

        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(traceIdValue);
    }

    @Test
    void shouldPropagateMdcThroughCompletableFuture() throws Exception {
        final String traceIdValue = UUID.randomUUID().toString();
        MDC.put(TRACE_ID, traceIdValue);

        String seen = CompletableFuture.supplyAsync(() -> MDC.get(TRACE_ID), reconcileExecutor)
                .get(5, TimeUnit.SECONDS);

        assertThat(seen).isEqualTo(traceIdValue);
    }

    @Test
    void shouldPropagateMdcWithInvokeAll() throws Exception {
        final String traceIdValue = UUID.randomUUID().toString();
        MDC.put(TRACE_ID, traceIdValue);

        List<Callable<String>> tasks = IntStream.range(0, 5)
                .mapToObj(i -> (Callable<String>) () -> MDC.get(TRACE_ID))
                .collect(Collectors.toList());

        List<Future<String>> futures = reconcileExecutor.invokeAll(tasks);

        for (Future<String> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(traceIdValue);
        }
    }

    @Test
    void shouldNotLeakMdcBetweenTasks() throws Exception {
        MDC.put(TRACE_ID, "first");
        reconcileExecutor.submit(() -> MDC.get(TRACE_ID)).get(5, TimeUnit.SECONDS);
        MDC.clear();

        List<Callable<String>> tasks = IntStream.range(0, 6)
                .mapToObj(i -> (Callable<String>) () -> MDC.get(TRACE_ID))
                .collect(Collectors.toList());

        for (Future<String> future : reconcileExecutor.invokeAll(tasks)) {
            assertThat(future.get(5, TimeUnit.SECONDS)).isNull();
        }
    }
}
