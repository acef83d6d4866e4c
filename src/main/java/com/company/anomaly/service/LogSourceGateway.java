package com.company.anomaly.service;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.exception.FetchException;
import com.company.anomaly.source.CountBatch;
import com.company.anomaly.source.ErrorLogSource;
import com.company.anomaly.source.LogEvent;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.*;
import java.util.function.Supplier;

/**
 * Bounded access to the upstream log source: hard timeout per call, bounded retries
 * and a circuit breaker. Every failure surfaces as {@link FetchException}.
 * <p>
 * Calls run on at most {@code anomaly.source.max-concurrent-calls} threads. A timed-out call is
 * cancelled by interrupt; a source that ignores the interrupt holds its thread until it returns.
 */
@Service
@Slf4j
public class LogSourceGateway {

    private final ObjectProvider<ErrorLogSource> logSource;
    private final Duration timeout;
    private final MeterRegistry meterRegistry;
    private final int maxConcurrentCalls;
    private final ExecutorService executor;

    public LogSourceGateway(ObjectProvider<ErrorLogSource> logSource,
                            AnomalyProperties properties,
                            MeterRegistry meterRegistry) {
        this.logSource = logSource;
        this.timeout = properties.getSource().getTimeout();
        this.meterRegistry = meterRegistry;
        this.maxConcurrentCalls = properties.getSource().getMaxConcurrentCalls();
        // no queue: a call that ignored cancellation keeps its thread, new calls are refused once all are taken
        this.executor = new ThreadPoolExecutor(0, maxConcurrentCalls, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), runnable -> {
            Thread thread = new Thread(runnable, "log-source-fetch");
            thread.setDaemon(true);
            return thread;
        });
    }

    public boolean isAvailable() {
        return logSource.getIfAvailable() != null;
    }

    @Retry(name = "logSource")
    @CircuitBreaker(name = "logSource", fallbackMethod = "fetchCountsFallback")
    public CountBatch fetchCounts(Instant windowStart, Instant windowEnd) {
        ErrorLogSource source = requireSource();
        CountBatch batch = withTimeout("fetchCounts", () -> source.fetchCounts(windowStart, windowEnd));
        if (batch == null) {
            throw new FetchException("Log source returned no batch for window " + windowStart);
        }

        meterRegistry.counter("anomaly.source.fetch.success").increment();
        if (!batch.isComplete()) {
            log.warn("Partial result for window {}: {} of {} hits returned",
                    windowStart, batch.getReturnedHits(), batch.getTotalHits());
            meterRegistry.counter("anomaly.source.fetch.partial").increment();
        }
        return batch;
    }

    @Retry(name = "logSource")
    public List<LogEvent> fetchEvents(String categoryKey, Instant windowStart, Instant windowEnd, int limit) {
        ErrorLogSource source = requireSource();
        List<LogEvent> events = withTimeout("fetchEvents",
                () -> source.fetchEvents(categoryKey, windowStart, windowEnd, limit));
        return events != null ? events : List.of();
    }

    /**
     * Open circuit or exhausted call: the cycle must abort, never continue on partial data
     */
    private CountBatch fetchCountsFallback(Instant windowStart, Instant windowEnd, Throwable t) {
        meterRegistry.counter("anomaly.source.fetch.failures").increment();
        if (t instanceof FetchException) {
            throw (FetchException) t;
        }
        throw new FetchException("Log source unavailable for window " + windowStart + ": " + t.getMessage(), t);
    }

    private ErrorLogSource requireSource() {
        ErrorLogSource source = logSource.getIfAvailable();
        if (source == null) {
            throw new FetchException("No ErrorLogSource configured");
        }
        return source;
    }

    private <T> T withTimeout(String operation, Supplier<T> call) {
        Callable<T> task = call::get;
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            meterRegistry.counter("anomaly.source.fetch.rejected", "operation", operation).increment();
            throw new FetchException("Log source " + operation + " refused: "
                    + maxConcurrentCalls + " earlier calls are still running", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            meterRegistry.counter("anomaly.source.fetch.timeouts", "operation", operation).increment();
            throw new FetchException("Log source " + operation + " timed out after " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof FetchException) {
                throw (FetchException) cause;
            }
            throw new FetchException("Log source " + operation + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted while waiting for log source " + operation, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
