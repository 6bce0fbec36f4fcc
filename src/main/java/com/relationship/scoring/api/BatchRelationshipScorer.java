package com.relationship.scoring.api;

import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.logging.LogContext;
import com.relationship.scoring.metrics.MetricsService;
import com.relationship.scoring.tracing.AssessmentSpan;
import com.relationship.scoring.tracing.PipelineTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the flag pipeline over many records on a fixed worker pool.
 *
 * <p>At most {@code maxConcurrency} records are in flight at once. Each is bounded by the
 * per-record timeout, measured from the moment a worker starts it; a timed-out worker is
 * interrupted. A record that fails or times out yields
 * {@link RelationshipAssessment#failed(String, String)}; the rest of the batch is
 * unaffected. Results are returned in input order.</p>
 */
public class BatchRelationshipScorer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchRelationshipScorer.class);

    private final RelationshipFlagPipeline pipeline;
    private final int maxConcurrency;
    private final Duration recordTimeout;
    private final MetricsService metrics;
    private final PipelineTracer tracer;
    private final ExecutorService executor;

    public BatchRelationshipScorer(RelationshipFlagPipeline pipeline, int maxConcurrency, Duration recordTimeout,
                                   MetricsService metrics, PipelineTracer tracer) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline is required");
        this.maxConcurrency = maxConcurrency;
        this.recordTimeout = Objects.requireNonNull(recordTimeout, "recordTimeout is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
        this.executor = Executors.newFixedThreadPool(maxConcurrency, new WorkerThreadFactory());
    }

    public List<RelationshipAssessment> assessAll(List<Record> records) {
        Objects.requireNonNull(records, "records is required");
        if (records.isEmpty()) {
            return List.of();
        }

        String batchId = LogContext.generateCorrelationId();
        metrics.recordBatchSize(records.size());

        try (LogContext ctx = LogContext.forBatch(batchId, records.size());
             AssessmentSpan span = tracer.startBatch(batchId, records.size())) {
            log.info("batch.started batchId={} size={}", batchId, records.size());

            Semaphore permits = new Semaphore(maxConcurrency);
            List<CompletableFuture<RelationshipAssessment>> futures = new ArrayList<>(records.size());
            for (Record record : records) {
                futures.add(submit(record, permits));
            }

            List<RelationshipAssessment> results = new ArrayList<>(futures.size());
            int failed = 0;
            for (CompletableFuture<RelationshipAssessment> future : futures) {
                RelationshipAssessment assessment = future.join();
                if (assessment.isFailed()) {
                    failed++;
                }
                results.add(assessment);
            }

            span.setCount("relationship.batch.failed", failed);
            log.info("batch.completed batchId={} size={} failed={}", batchId, results.size(), failed);
            return List.copyOf(results);
        }
    }

    private CompletableFuture<RelationshipAssessment> submit(Record record, Semaphore permits) {
        String recordId = record != null ? record.identifier() : "";
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.completedFuture(
                    RelationshipAssessment.failed(recordId, "Interrupted before assessment started"));
        }

        // The timeout clock starts when a worker picks the record up, not when it is queued
        CompletableFuture<RelationshipAssessment> result = new CompletableFuture<>();
        Future<?> worker;
        try {
            worker = executor.submit(() -> {
                result.orTimeout(recordTimeout.toMillis(), TimeUnit.MILLISECONDS);
                try {
                    result.complete(pipeline.run(record));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                } finally {
                    permits.release();
                }
            });
        } catch (RejectedExecutionException e) {
            permits.release();
            log.warn("Assessment of record {} rejected: scorer is closed", recordId);
            return CompletableFuture.completedFuture(
                    RelationshipAssessment.failed(recordId, "Batch scorer is closed"));
        }

        // Interrupt a timed-out worker to free its thread
        return result
                .whenComplete((assessment, error) -> {
                    if (error instanceof TimeoutException) {
                        worker.cancel(true);
                    }
                })
                .exceptionally(error -> {
                    String message = describe(error);
                    log.warn("Assessment of record {} failed: {}", recordId, message);
                    return RelationshipAssessment.failed(recordId, message);
                });
    }

    private String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "Assessment timed out after " + recordTimeout.toMillis() + " ms";
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "relationship-scoring-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
