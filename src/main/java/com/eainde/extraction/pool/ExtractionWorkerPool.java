package com.eainde.extraction.pool;

import com.eainde.extraction.chunk.TextChunk;
import com.eainde.extraction.exception.PipelineConfigurationException;
import com.eainde.extraction.extract.EntityExtraction;
import com.eainde.extraction.extract.EntityExtractor;
import com.eainde.extraction.thread.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * MAP phase: runs an {@link EntityExtractor} over every chunk with a bounded
 * number of calls in flight.
 *
 * <h3>Contract</h3>
 * <pre>
 * run(chunks, extractor, limit)
 *   │
 *   ├── for each chunk, in order:
 *   │     acquire permit (blocks while `limit` calls are in flight)
 *   │     submit → extractor.extract(chunk.text)
 *   │                ├── ok     → PartialResult(index, entities)
 *   │                └── throws → PartialResult.failed(index)   (any Exception; logged, never rethrown)
 *   │              results[position] = partial; release permit; report progress
 *   │
 *   └── wait for all → results in CHUNK order, not completion order
 * </pre>
 *
 * <h3>Cancellation</h3>
 * <p>If the calling thread is interrupted while waiting for a permit, no further
 * chunks are admitted. Calls already in flight are allowed to finish, then a
 * {@link CancellationException} is thrown with the interrupt flag restored.</p>
 */
@Slf4j
@Component
public class ExtractionWorkerPool {

    private static final String MDC_CHUNK_INDEX = "chunkIndex";

    private final ExtractionProgressListener progressListener;

    public ExtractionWorkerPool(ExtractionProgressListener progressListener) {
        this.progressListener = progressListener;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @param chunks           chunks to extract, in document order
     * @param extractor        the extraction call, invoked once per chunk
     * @param concurrencyLimit maximum simultaneous {@code extract} calls
     * @return one result per chunk, positionally aligned with {@code chunks}
     * @throws PipelineConfigurationException if {@code concurrencyLimit < 1}
     * @throws CancellationException          if interrupted before all chunks were admitted
     */
    public List<PartialResult> run(List<TextChunk> chunks, EntityExtractor extractor, int concurrencyLimit) {
        if (concurrencyLimit < 1) {
            throw new PipelineConfigurationException(
                    "concurrencyLimit (" + concurrencyLimit + ") must be >= 1");
        }
        if (chunks == null || chunks.isEmpty()) {
            log.info("No chunks to extract");
            return Collections.emptyList();
        }

        int total = chunks.size();
        log.info("MAP phase: extracting {} chunks with concurrency limit {}", total, concurrencyLimit);

        AtomicReferenceArray<PartialResult> results = new AtomicReferenceArray<>(total);
        Semaphore permits = new Semaphore(concurrencyLimit, true);
        ProgressCounter progress = new ProgressCounter(total);
        List<CompletableFuture<Void>> submitted = new ArrayList<>(total);

        ExecutorService workers = Executors.newFixedThreadPool(
                Math.min(concurrencyLimit, total), new WorkerThreadFactory());
        Executor executor = new MdcAwareExecutor(workers);

        try {
            for (int position = 0; position < total; position++) {
                TextChunk chunk = chunks.get(position);
                try {
                    permits.acquire();
                } catch (InterruptedException e) {
                    log.warn("MAP phase interrupted after admitting {}/{} chunks; draining in-flight calls",
                            position, total);
                    awaitAll(submitted);
                    Thread.currentThread().interrupt();
                    throw new CancellationException(
                            "Extraction cancelled after " + position + " of " + total + " chunks were admitted");
                }

                int slot = position;
                submitted.add(CompletableFuture.runAsync(() -> {
                    try {
                        PartialResult result = extractOne(chunk, extractor);
                        results.set(slot, result);
                        progress.completed(result);
                    } finally {
                        permits.release();
                    }
                }, executor));
            }

            awaitAll(submitted);
        } finally {
            workers.shutdown();
        }

        List<PartialResult> ordered = new ArrayList<>(total);
        int failed = 0;
        for (int i = 0; i < total; i++) {
            PartialResult result = results.get(i);
            if (result.failed()) failed++;
            ordered.add(result);
        }

        log.info("MAP phase complete: {} chunks, {} succeeded, {} failed", total, total - failed, failed);
        return Collections.unmodifiableList(ordered);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private PartialResult extractOne(TextChunk chunk, EntityExtractor extractor) {
        MDC.put(MDC_CHUNK_INDEX, String.valueOf(chunk.index()));
        try {
            log.debug("Extracting {}", chunk);
            EntityExtraction extraction = extractor.extract(chunk.text());
            if (extraction == null) {
                log.warn("Extraction returned no result for chunk {}", chunk.index());
                return PartialResult.failed(chunk.index());
            }
            return PartialResult.of(chunk.index(), extraction);
        } catch (Exception e) {
            log.warn("Extraction failed for chunk {}: {}", chunk.index(), e.getMessage(), e);
            return PartialResult.failed(chunk.index());
        } finally {
            MDC.remove(MDC_CHUNK_INDEX);
        }
    }

    private static void awaitAll(List<CompletableFuture<Void>> futures) {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }

    /**
     * Serializes progress callbacks so the reported count never goes backwards.
     */
    private final class ProgressCounter {

        private final int total;
        private int completed;

        ProgressCounter(int total) {
            this.total = total;
        }

        synchronized void completed(PartialResult result) {
            completed++;
            try {
                progressListener.onChunkCompleted(completed, total, result);
            } catch (Exception e) {
                log.warn("Progress listener failed at {}/{}", completed, total, e);
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "extraction-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
