package com.eainde.extraction.extract;

import com.eainde.extraction.exception.ExtractionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link EntityExtractor} backed by the {@link NewsExtractionAgent} chat model.
 *
 * <p>One model call per fragment, no retries. Transport failures and unparseable
 * answers both surface as {@link ExtractionException}.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmEntityExtractor implements EntityExtractor {

    private final NewsExtractionAgent agent;
    private final EntityResponseParser parser;

    @Override
    public EntityExtraction extract(String fragmentText) {
        log.debug("Extracting entities from fragment of {} chars", fragmentText.length());

        String response;
        try {
            response = agent.extract(fragmentText);
        } catch (RuntimeException e) {
            throw new ExtractionException("Extraction model call failed: " + e.getMessage(), e);
        }

        EntityExtraction extraction = parser.parse(response);
        log.debug("Fragment yielded {} entities ({} companies, {} persons, {} events)", extraction.totalCount(),
                extraction.companies().size(), extraction.persons().size(), extraction.events().size());
        return extraction;
    }
}
