package com.eainde.extraction.chunk;

/**
 * A single character-range fragment of a larger document.
 *
 * <p>Consecutive chunks overlap at their boundaries so that an entity whose
 * mention straddles a cut (a name on one side, its title on the other) is
 * still seen whole by at least one extraction call.</p>
 *
 * <pre>
 *   text length 4300, chunkSize 2000, overlap 100
 *   Chunk 0: [0, 2000)
 *   Chunk 1: [1900, 3900)   chars 1900-1999 shared with chunk 0
 *   Chunk 2: [3800, 4300)   chars 3800-3899 shared with chunk 1
 * </pre>
 *
 * @param index       zero-based position of this chunk in the document
 * @param text        the chunk's text, equal to {@code source.substring(startOffset, endOffset)}
 * @param startOffset inclusive start offset in the source text
 * @param endOffset   exclusive end offset in the source text
 */
public record TextChunk(
        int index,
        String text,
        int startOffset,
        int endOffset
) {

    public TextChunk {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException(
                    "invalid range [" + startOffset + ", " + endOffset + ")");
        }
    }

    public int length() {
        return endOffset - startOffset;
    }

    @Override
    public String toString() {
        return String.format("Chunk[%d, chars %d-%d, %d chars]",
                index, startOffset, endOffset, length());
    }
}
