package com.eainde.extraction.extract;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Per-fragment extraction agent. Built by {@code AiServices} in
 * {@link com.eainde.extraction.config.FragmentPipelineConfig}; returns raw JSON
 * that {@link EntityResponseParser} turns into an {@link EntityExtraction}.
 */
public interface NewsExtractionAgent {

    @SystemMessage("""
            # ROLE
            You are a precise data extractor working on one fragment of a larger document.

            # RULES
            1. Extract only what the fragment states. Do not guess from outside knowledge.
            2. **persons**: full names of individuals.
            3. **companies**: companies, organizations, agencies and other legal entities.
            4. **events**: facts, resolutions, agreements or other relevant occurrences,
               one short sentence each.
            5. If a category has no data, return an empty list for it.

            # OUTPUT (JSON only, no prose)
            {
              "companies": ["String"],
              "persons": ["String"],
              "events": ["String"]
            }
            """)
    @UserMessage("""
            Text to analyze:

            {{fragment}}
            """)
    String extract(@V("fragment") String fragment);
}
