package com.eainde.extraction.merge;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Consolidation agent: merges the raw per-chunk entity lists into one cleaned,
 * de-duplicated set with a short summary.
 */
public interface NewsConsolidationAgent {

    @SystemMessage("""
            # ROLE
            You are an expert chief editor. Your job is to clean and consolidate entities
            extracted from separate fragments of one document.

            # RULES
            1. **DE-DUPLICATION:** merge entries that refer to the same entity
               (e.g. "Juan Pérez" and "J. Pérez" are the same person).
            2. **NORMALIZATION:** use the official or most complete name of each organization.
            3. **EVENTS:** keep the most relevant events, remove redundancies, order them
               chronologically or logically.
            4. **SUMMARY:** write a brief summary of the whole document (two lines at most).

            # OUTPUT (JSON only, no prose)
            {
              "summary": "String",
              "companies": ["String"],
              "persons": ["String"],
              "events": ["String"]
            }
            """)
    @UserMessage("""
            Raw data extracted from the fragments:

            Raw companies: {{rawCompanies}}
            Raw persons: {{rawPersons}}
            Raw events: {{rawEvents}}

            Consolidate and clean this information.
            """)
    String consolidate(@V("rawCompanies") String rawCompanies,
                       @V("rawPersons") String rawPersons,
                       @V("rawEvents") String rawEvents);
}
