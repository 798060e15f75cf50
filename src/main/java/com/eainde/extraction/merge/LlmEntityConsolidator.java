package com.eainde.extraction.merge;

import com.eainde.extraction.exception.ConsolidationException;
import com.eainde.extraction.extract.EntityResponseParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link EntityConsolidator} backed by the {@link NewsConsolidationAgent} chat model.
 *
 * <p>Raw lists are sent as JSON arrays. The answer must be a JSON object whose
 * {@code companies}, {@code persons} and {@code events} fields are arrays;
 * {@code summary} is optional. Anything else is malformed output.</p>
 */
@Slf4j
@Component
public class LlmEntityConsolidator implements EntityConsolidator {

    private final NewsConsolidationAgent agent;
    private final ObjectMapper objectMapper;

    public LlmEntityConsolidator(NewsConsolidationAgent agent, ObjectMapper objectMapper) {
        this.agent = agent;
        this.objectMapper = objectMapper;
    }

    @Override
    public ConsolidatedResult consolidate(List<String> rawCompanies,
                                          List<String> rawPersons,
                                          List<String> rawEvents) {
        log.info("Consolidating {} companies, {} persons, {} events",
                rawCompanies.size(), rawPersons.size(), rawEvents.size());

        String response;
        try {
            response = agent.consolidate(toJson(rawCompanies), toJson(rawPersons), toJson(rawEvents));
        } catch (RuntimeException e) {
            throw new ConsolidationException("Consolidation model call failed: " + e.getMessage(), e);
        }

        return parse(response);
    }

    ConsolidatedResult parse(String response) {
        if (response == null || response.isBlank()) {
            throw new ConsolidationException("Consolidation model returned an empty response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(EntityResponseParser.cleanJson(response));
        } catch (JsonProcessingException e) {
            throw new ConsolidationException(
                    "Consolidation response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConsolidationException("Consolidation response is not a JSON object");
        }

        return new ConsolidatedResult(
                summaryOf(root.get("summary")),
                requireList(root, "companies"),
                requireList(root, "persons"),
                requireList(root, "events"));
    }

    /** Blank or non-text summaries are treated as absent. */
    private static String summaryOf(JsonNode node) {
        if (node == null || !node.isValueNode() || node.isNull()) {
            return null;
        }
        String summary = node.asText().strip();
        return summary.isEmpty() ? null : summary;
    }

    private List<String> requireList(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isArray()) {
            throw new ConsolidationException("Consolidation response has no '" + field + "' array");
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (element.isNull()) continue;
            String text = (element.isValueNode() ? element.asText() : element.toString()).strip();
            if (!text.isEmpty()) {
                values.add(text);
            }
        }
        return values;
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new ConsolidationException("Failed to serialize raw entities", e);
        }
    }
}
