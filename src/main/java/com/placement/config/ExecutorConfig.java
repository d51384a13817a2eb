package com.placement.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor for per-offer reconciliation.
 *
 * A fixed pool keeps the number of in-flight store round trips predictable; the orchestrator
 * additionally bounds store access with a semaphore. Tasks inherit the submitter's MDC so
 * worker log lines keep the batch traceId.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${app.executor.reconcile-threads:8}")
    private int reconcileThreads;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "reconcileExecutor", destroyMethod = "shutdown")
    public ExecutorService reconcileExecutor() {
        log.info("Creating reconcile executor with {} threads and MDC propagation", reconcileThreads);
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(reconcileThreads, runnable -> {
            Thread thread = new Thread(runnable, "reconcile-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        return new ExecutorService() {
            private final ExecutorService delegate = pool;

            private <T> Callable<T> wrap(Callable<T> callable) {
                final Map<String, String> context = MDC.getCopyOfContextMap();
                return () -> {
                    if (context != null) {
                        MDC.setContextMap(context);
                    }
                    try {
                        return callable.call();
                    } finally {
                        MDC.clear();
                    }
                };
            }

            private Runnable wrap(Runnable runnable) {
                final Map<String, String> context = MDC.getCopyOfContextMap();
                return () -> {
                    if (context != null) {
                        MDC.setContextMap(context);
                    }
                    try {
                        runnable.run();
                    } finally {
                        MDC.clear();
                    }
                };
            }

            private <T> List<Callable<T>> wrapAll(Collection<? extends Callable<T>> tasks) {
                return tasks.stream().<Callable<T>>map(this::wrap).toList();
            }

            @Override
            public void execute(Runnable command) {
                delegate.execute(wrap(command));
            }

            @Override
            public <T> Future<T> submit(Callable<T> task) {
                return delegate.submit(wrap(task));
            }

            @Override
            public Future<?> submit(Runnable task) {
                return delegate.submit(wrap(task));
            }

            @Override
            public <T> Future<T> submit(Runnable task, T result) {
                return delegate.submit(wrap(task), result);
            }

            @Override
            public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks) throws InterruptedException {
                return delegate.invokeAll(wrapAll(tasks));
            }

            @Override
            public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit) throws InterruptedException {
                return delegate.invokeAll(wrapAll(tasks), timeout, unit);
            }

            @Override
            public <T> T invokeAny(Collection<? extends Callable<T>> tasks) throws InterruptedException, ExecutionException {
                return delegate.invokeAny(wrapAll(tasks));
            }

            @Override
            public <T> T invokeAny(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
                return delegate.invokeAny(wrapAll(tasks), timeout, unit);
            }

            // Boilerplate delegate methods
            @Override
            public void shutdown() { delegate.shutdown(); }
            @Override
            public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
            @Override
            public boolean isShutdown() { return delegate.isShutdown(); }
            @Override
            public boolean isTerminated() { return delegate.isTerminated(); }
            @Override
            public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
                return delegate.awaitTermination(timeout, unit);
            }
        };
    }
}
