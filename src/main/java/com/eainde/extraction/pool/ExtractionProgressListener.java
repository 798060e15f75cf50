package com.eainde.extraction.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives one callback per finished chunk. {@code completed} rises strictly from
 * 1 to {@code total} regardless of which chunk finishes first; callbacks are
 * serialized by the pool.
 */
@FunctionalInterface
public interface ExtractionProgressListener {

    void onChunkCompleted(int completed, int total, PartialResult result);

    /** Logs each completion at INFO. */
    static ExtractionProgressListener logging() {
        Logger log = LoggerFactory.getLogger(ExtractionProgressListener.class);
        return (completed, total, result) -> log.info("Extraction progress {}/{} (chunk {} {})",
                completed, total, result.chunkIndex(), result.failed() ? "FAILED" : "ok");
    }

    static ExtractionProgressListener noop() {
        return (completed, total, result) -> { };
    }
}
