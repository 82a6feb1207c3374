package com.frontier.outpost.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Executor for fleet-wide sync runs.
 *
 * A bounded platform-thread pool: each pair sync spends most of its time
 * waiting on outpost HTTP calls, and the fleet is small. The MDC of the
 * submitting thread (traceId, spanId) is carried into each task.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${app.sync.fleet-concurrency:4}")
    private int fleetConcurrency;

    @Bean(name = "syncExecutor", destroyMethod = "shutdown")
    public ExecutorService syncExecutor() {
        log.info("Creating sync executor with {} threads and MDC propagation", fleetConcurrency);
        return mdcPropagating(Executors.newFixedThreadPool(fleetConcurrency, namedThreads("sync-")));
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static ExecutorService mdcPropagating(ExecutorService delegate) {
        return new ExecutorService() {

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
                return tasks.stream().<Callable<T>>map(task -> wrap(task)).collect(Collectors.toList());
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
