package com.eainde.extraction.extract;

import com.eainde.extraction.exception.ExtractionException;

/**
 * Turns the text of one fragment into structured entities.
 *
 * <p>Implementations are called concurrently from worker threads and must be
 * thread-safe. Any timeout is the implementation's responsibility; the worker
 * pool enforces none.</p>
 */
@FunctionalInterface
public interface EntityExtractor {

    /**
     * @param fragmentText the text of one chunk
     * @return the entities found, never null
     * @throws ExtractionException if the call fails or its output cannot be parsed
     */
    EntityExtraction extract(String fragmentText);
}
