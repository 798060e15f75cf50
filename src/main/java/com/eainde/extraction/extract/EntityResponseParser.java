package com.eainde.extraction.extract;

import com.eainde.extraction.exception.ExtractionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses a model's JSON answer into an {@link EntityExtraction}.
 *
 * <h3>Accepted shapes</h3>
 * <pre>
 * {"companies": ["Ecopetrol"], "persons": ["Juan Pérez"], "events": []}
 * {"Empresas": ["Ecopetrol"], "personas": "Juan Pérez"}          (aliases, single string)
 * ```json
 * {"people": ["Juan Pérez"], "notes": "ignored"}                  (fenced, extra keys)
 * ```
 * </pre>
 *
 * <p>Category keys go through the {@link EntityCategory} alias table. Missing
 * categories become empty lists and unknown keys are ignored. Anything that is
 * not a JSON object raises {@link ExtractionException}.</p>
 */
@Component
public class EntityResponseParser {

    private final ObjectMapper objectMapper;

    public EntityResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EntityExtraction parse(String response) {
        JsonNode root = readObject(response);

        // Per category, the field whose alias comes first; ties keep the first field seen
        Map<EntityCategory, String> selected = new EnumMap<>(EntityCategory.class);
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            EntityCategory.fromKey(name).ifPresent(category -> selected.merge(category, name,
                    (current, candidate) ->
                            category.priority(candidate) < category.priority(current) ? candidate : current));
        }

        Map<EntityCategory, List<String>> values = new EnumMap<>(EntityCategory.class);
        for (EntityCategory category : EntityCategory.values()) {
            String key = selected.get(category);
            values.put(category, key == null ? Collections.emptyList() : coerceList(root.get(key)));
        }

        return new EntityExtraction(
                values.get(EntityCategory.COMPANIES),
                values.get(EntityCategory.PERSONS),
                values.get(EntityCategory.EVENTS));
    }

    /**
     * Reads the response as a JSON object, tolerating Markdown code fences.
     */
    JsonNode readObject(String response) {
        if (response == null || response.isBlank()) {
            throw new ExtractionException("Model returned an empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(cleanJson(response));
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Model response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ExtractionException("Model response is not a JSON object");
        }
        return root;
    }

    /**
     * Converts a category value to a list of non-blank, stripped strings.
     */
    List<String> coerceList(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Collections.emptyList();
        }
        List<String> items = new ArrayList<>();
        if (value.isArray()) {
            for (JsonNode element : value) {
                addIfPresent(items, element);
            }
        } else {
            addIfPresent(items, value);
        }
        return items;
    }

    /**
     * Strips surrounding whitespace and Markdown code fences from a model answer.
     */
    public static String cleanJson(String json) {
        String trimmed = json.strip();
        if (trimmed.startsWith("```")) {
            int firstLineEnd = trimmed.indexOf('\n');
            trimmed = firstLineEnd < 0 ? "" : trimmed.substring(firstLineEnd + 1);
            int closingFence = trimmed.lastIndexOf("```");
            if (closingFence >= 0) {
                trimmed = trimmed.substring(0, closingFence);
            }
        }
        return trimmed.strip();
    }

    private static void addIfPresent(List<String> items, JsonNode element) {
        if (element == null || element.isNull()) return;
        String text = (element.isValueNode() ? element.asText() : element.toString()).strip();
        if (!text.isEmpty()) {
            items.add(text);
        }
    }
}
