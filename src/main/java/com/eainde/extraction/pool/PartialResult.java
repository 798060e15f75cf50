package com.eainde.extraction.pool;

import com.eainde.extraction.extract.EntityExtraction;

import java.util.List;

/**
 * Outcome of extracting one chunk. Exactly one is produced per chunk; a failed
 * extraction yields empty lists with {@code failed = true}.
 *
 * @param chunkIndex index of the originating chunk, used only for ordering
 */
public record PartialResult(
        int chunkIndex,
        List<String> companies,
        List<String> persons,
        List<String> events,
        boolean failed
) {

    public PartialResult {
        companies = companies == null ? List.of() : List.copyOf(companies);
        persons = persons == null ? List.of() : List.copyOf(persons);
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static PartialResult of(int chunkIndex, EntityExtraction extraction) {
        return new PartialResult(chunkIndex,
                extraction.companies(), extraction.persons(), extraction.events(), false);
    }

    public static PartialResult failed(int chunkIndex) {
        return new PartialResult(chunkIndex, List.of(), List.of(), List.of(), true);
    }
}
