package com.eainde.extraction.merge;

import com.eainde.extraction.exception.ConsolidationException;

import java.util.List;

/**
 * Second-tier merge: cleans, deduplicates and summarizes the union of raw
 * entities (e.g. "Ecopetrol" + "Ecopetrol S.A." → "Ecopetrol S.A.").
 *
 * <p>Optional. When it fails the pipeline keeps the deterministic union.</p>
 */
public interface EntityConsolidator {

    /**
     * @throws ConsolidationException if the call fails or its output is malformed
     */
    ConsolidatedResult consolidate(List<String> rawCompanies,
                                   List<String> rawPersons,
                                   List<String> rawEvents);
}
