package com.eainde.extraction.chunk;

import com.eainde.extraction.exception.PipelineConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits large documents into overlapping character-range chunks small enough
 * for a single extraction call.
 *
 * <h3>Guarantees</h3>
 * <ul>
 *   <li>Chunks are returned in increasing {@code index} / {@code startOffset} order.</li>
 *   <li>The trailing {@code overlap} characters of chunk {@code i} are the leading
 *       {@code overlap} characters of chunk {@code i + 1}.</li>
 *   <li>The union of all {@code [startOffset, endOffset)} ranges is the whole text.</li>
 * </ul>
 *
 * <h3>Usage:</h3>
 * <pre>
 * DocumentChunker chunker = DocumentChunker.builder()
 *         .chunkSize(2000)
 *         .overlap(100)
 *         .strategy(ChunkingStrategy.BOUNDARY_AWARE)
 *         .build();
 *
 * List&lt;TextChunk&gt; chunks = chunker.split(sourceText);
 * </pre>
 *
 * <p>This class is pure logic with no Spring dependencies, safe for unit testing
 * and for concurrent use.</p>
 */
public class DocumentChunker {

    private static final Logger log = LoggerFactory.getLogger(DocumentChunker.class);

    /** Preferred break points for {@link ChunkingStrategy#BOUNDARY_AWARE}, strongest first. */
    private static final List<String> BOUNDARY_SEPARATORS = List.of("\n\n", "\n", ". ", " ");

    private final int chunkSize;
    private final int overlap;
    private final ChunkingStrategy strategy;

    private DocumentChunker(Builder builder) {
        this.chunkSize = builder.chunkSize;
        this.overlap = builder.overlap;
        this.strategy = builder.strategy;

        if (chunkSize <= 0) {
            throw new PipelineConfigurationException(
                    "chunkSize (" + chunkSize + ") must be > 0");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new PipelineConfigurationException(
                    "overlap (" + overlap + ") must be >= 0 and < chunkSize (" + chunkSize + ")");
        }
        if (strategy == null) {
            throw new PipelineConfigurationException("chunking strategy must be set");
        }
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Splits a document into overlapping chunks.
     *
     * @param text the full document text
     * @return ordered, unmodifiable list of chunks; empty for null or empty text
     */
    public List<TextChunk> split(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }

        List<TextChunk> chunks = strategy == ChunkingStrategy.FIXED_WINDOW
                ? splitFixed(text)
                : splitOnBoundaries(text);

        log.info("Document of {} chars split into {} chunks (chunkSize={}, overlap={}, strategy={})",
                text.length(), chunks.size(), chunkSize, overlap, strategy);
        for (TextChunk c : chunks) {
            log.debug("  {}", c);
        }

        return Collections.unmodifiableList(chunks);
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }

    public ChunkingStrategy getStrategy() {
        return strategy;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private List<TextChunk> splitFixed(String text) {
        int length = text.length();
        int stride = chunkSize - overlap;
        List<TextChunk> chunks = new ArrayList<>();

        int index = 0;
        for (int start = 0; start < length; start += stride) {
            int end = Math.min(start + chunkSize, length);
            chunks.add(new TextChunk(index++, text.substring(start, end), start, end));
        }
        return chunks;
    }

    private List<TextChunk> splitOnBoundaries(String text) {
        int length = text.length();
        List<TextChunk> chunks = new ArrayList<>();

        int index = 0;
        int start = 0;
        while (true) {
            int hardEnd = Math.min(start + chunkSize, length);
            int end = hardEnd == length ? length : findBoundary(text, start, hardEnd);

            chunks.add(new TextChunk(index++, text.substring(start, end), start, end));

            if (end >= length) break;
            start = end - overlap;
        }
        return chunks;
    }

    /**
     * Returns the exclusive end of the chunk starting at {@code start}: just past the
     * strongest separator in the window, or {@code hardEnd} when none qualifies.
     * A chunk must stay longer than {@code overlap} so the next start moves forward.
     */
    private int findBoundary(String text, int start, int hardEnd) {
        int minEnd = start + overlap + 1;
        for (String separator : BOUNDARY_SEPARATORS) {
            int pos = text.lastIndexOf(separator, hardEnd - separator.length());
            if (pos < start) continue;
            int candidate = pos + separator.length();
            if (candidate >= minEnd) {
                return candidate;
            }
        }
        return hardEnd;
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a chunker with default settings (2000 chars/chunk, 100-char overlap, fixed window).
     */
    public static DocumentChunker withDefaults() {
        return builder().build();
    }

    public static class Builder {
        private int chunkSize = 2000;
        private int overlap = 100;
        private ChunkingStrategy strategy = ChunkingStrategy.FIXED_WINDOW;

        /**
         * Maximum characters per chunk. Default: 2000.
         */
        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * Characters shared between adjacent chunks. Default: 100.
         * Must be less than chunkSize.
         */
        public Builder overlap(int overlap) {
            this.overlap = overlap;
            return this;
        }

        public Builder strategy(ChunkingStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        /**
         * @throws PipelineConfigurationException if the size/overlap combination cannot make progress
         */
        public DocumentChunker build() {
            return new DocumentChunker(this);
        }
    }
}
