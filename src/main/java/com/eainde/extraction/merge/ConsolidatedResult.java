package com.eainde.extraction.merge;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Final, deduplicated entities of one pipeline run.
 *
 * @param summary   short summary from the consolidation pass; null after a union-only merge
 *                  (blank summaries are stored as null)
 * @param companies unique companies / organizations
 * @param persons   unique persons
 * @param events    unique events
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"summary", "companies", "persons", "events"})
public record ConsolidatedResult(
        String summary,
        List<String> companies,
        List<String> persons,
        List<String> events
) {

    public ConsolidatedResult {
        summary = summary == null || summary.isBlank() ? null : summary.strip();
        companies = companies == null ? List.of() : List.copyOf(companies);
        persons = persons == null ? List.of() : List.copyOf(persons);
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static ConsolidatedResult withoutSummary(List<String> companies,
                                                    List<String> persons,
                                                    List<String> events) {
        return new ConsolidatedResult(null, companies, persons, events);
    }

    @JsonIgnore
    public boolean hasSummary() {
        return summary != null;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return companies.isEmpty() && persons.isEmpty() && events.isEmpty();
    }
}
