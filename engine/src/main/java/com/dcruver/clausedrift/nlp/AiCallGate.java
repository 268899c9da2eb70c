package com.dcruver.clausedrift.nlp;

import com.dcruver.clausedrift.config.DriftProperties;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-wide gate for language-model calls.
 *
 * Calls are serialized (one in flight at a time), their starts are at least
 * the minimum interval apart, and each is bounded by a timeout. A timed-out
 * call is interrupted. Any failure, timeout or interrupt turns into an empty
 * result.
 */
@Component
@Slf4j
public class AiCallGate {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final long minIntervalMs;
    private final long timeoutMs;
    private final ExecutorService executor;

    // guarded by lock; null until the first call
    private Stopwatch sinceLastCall;

    public AiCallGate(DriftProperties properties) {
        DriftProperties.Ai ai = properties.getAi();
        this.minIntervalMs = Math.max(0, ai.getMinIntervalMs());
        this.timeoutMs = ai.getTimeoutMs();
        this.executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
            .setNameFormat("ai-call-%d")
            .setDaemon(true)
            .build());
        log.info("AI call gate: min interval {}ms, timeout {}ms", minIntervalMs, timeoutMs);
    }

    public <T> Optional<T> call(String operation, Supplier<Optional<T>> call) {
        lock.lock();
        try {
            awaitInterval();
            sinceLastCall = Stopwatch.createStarted();

            Callable<Optional<T>> task = call::get;
            Future<Optional<T>> future = executor.submit(task);
            try {
                Optional<T> result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
                return result != null ? result : Optional.empty();
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("AI {} call timed out after {}ms", operation, timeoutMs);
            } catch (ExecutionException e) {
                log.warn("AI {} call failed: {}", operation, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            }
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for AI {} call", operation);
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    private void awaitInterval() throws InterruptedException {
        if (sinceLastCall == null) {
            return;
        }
        long remaining = minIntervalMs - sinceLastCall.elapsed(TimeUnit.MILLISECONDS);
        if (remaining > 0) {
            log.debug("Waiting {}ms before next AI call", remaining);
            TimeUnit.MILLISECONDS.sleep(remaining);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
