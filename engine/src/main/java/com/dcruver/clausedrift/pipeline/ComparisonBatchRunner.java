package com.dcruver.clausedrift.pipeline;

import com.dcruver.clausedrift.config.DriftProperties;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs independent comparisons concurrently on a bounded worker pool.
 * A failing comparison yields a failed result; the rest of the batch continues.
 */
@Component
@Slf4j
public class ComparisonBatchRunner {

    private final ContractDriftPipeline pipeline;
    private final ExecutorService workers;
    private final MdcAwareExecutor executor;

    public ComparisonBatchRunner(ContractDriftPipeline pipeline, DriftProperties properties) {
        this.pipeline = pipeline;
        this.workers = Executors.newFixedThreadPool(
            Math.max(1, properties.getComparison().getWorkerThreads()),
            new ThreadFactoryBuilder().setNameFormat("comparison-%d").setDaemon(true).build());
        this.executor = new MdcAwareExecutor(workers);
    }

    /**
     * Compare every request; results come back in request order.
     */
    public List<ComparisonResult> compareAll(List<ComparisonRequest> requests) {
        log.info("Running {} comparisons", requests.size());

        List<CompletableFuture<ComparisonResult>> futures = requests.stream()
            .map(request -> CompletableFuture
                .supplyAsync(() -> pipeline.compare(request), executor)
                .exceptionally(e -> {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Comparison {} failed", request.getComparisonId(), cause);
                    return ComparisonResult.failed(request, cause.getMessage());
                }))
            .toList();

        List<ComparisonResult> results = futures.stream().map(CompletableFuture::join).toList();
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("Finished {} comparisons ({} failed)", results.size(), failed);
        return results;
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
    }
}
