package com.eainde.extraction.config;

import com.eainde.extraction.chunk.ChunkingStrategy;
import com.eainde.extraction.chunk.DocumentChunker;
import com.eainde.extraction.exception.PipelineConfigurationException;

/**
 * Immutable settings of the fragment pipeline, built once at startup and passed to
 * the pipeline's constructor.
 *
 * <p>Construction does not validate: invalid values are reported by {@link #validate()}
 * during the CHUNKING state so a run fails cleanly instead of the context failing to start.</p>
 *
 * @param chunkSize            max characters per chunk
 * @param overlap              characters shared by adjacent chunks
 * @param chunkingStrategy     how chunk ends are chosen
 * @param concurrencyLimit     max extraction calls in flight
 * @param consolidationEnabled whether the consolidation pass runs after the union merge
 */
public record PipelineSettings(
        int chunkSize,
        int overlap,
        ChunkingStrategy chunkingStrategy,
        int concurrencyLimit,
        boolean consolidationEnabled
) {

    public static PipelineSettings defaults() {
        return new PipelineSettings(2000, 100, ChunkingStrategy.FIXED_WINDOW, 4, true);
    }

    /**
     * @throws PipelineConfigurationException if any value cannot produce a run
     */
    public void validate() {
        if (chunkSize <= 0) {
            throw new PipelineConfigurationException("chunkSize (" + chunkSize + ") must be > 0");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new PipelineConfigurationException(
                    "overlap (" + overlap + ") must be >= 0 and < chunkSize (" + chunkSize + ")");
        }
        if (concurrencyLimit < 1) {
            throw new PipelineConfigurationException(
                    "concurrencyLimit (" + concurrencyLimit + ") must be >= 1");
        }
    }

    public DocumentChunker newChunker() {
        return DocumentChunker.builder()
                .chunkSize(chunkSize)
                .overlap(overlap)
                .strategy(chunkingStrategy)
                .build();
    }
}
