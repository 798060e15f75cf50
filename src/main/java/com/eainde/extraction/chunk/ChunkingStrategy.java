package com.eainde.extraction.chunk;

/**
 * How {@link DocumentChunker} decides where a chunk ends.
 */
public enum ChunkingStrategy {

    /** Hard cut every {@code chunkSize} characters. */
    FIXED_WINDOW,

    /**
     * Pack up to {@code chunkSize} characters, preferring to end on a paragraph,
     * then line, then sentence, then word boundary before cutting hard.
     */
    BOUNDARY_AWARE
}
