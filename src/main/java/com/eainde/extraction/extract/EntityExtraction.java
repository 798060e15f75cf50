package com.eainde.extraction.extract;

import java.util.List;

/**
 * Entities found in one piece of text, as returned by an {@link EntityExtractor}.
 */
public record EntityExtraction(
        List<String> companies,
        List<String> persons,
        List<String> events
) {

    public EntityExtraction {
        companies = companies == null ? List.of() : List.copyOf(companies);
        persons = persons == null ? List.of() : List.copyOf(persons);
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static EntityExtraction empty() {
        return new EntityExtraction(List.of(), List.of(), List.of());
    }

    public int totalCount() {
        return companies.size() + persons.size() + events.size();
    }
}
