package com.eainde.extraction.merge;

import com.eainde.extraction.pool.PartialResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * MERGE phase: reduces per-chunk results into one {@link ConsolidatedResult}.
 *
 * <h3>Two tiers</h3>
 * <ol>
 *   <li>{@link #mergeUnion} is pure and deterministic. Per category, entries are taken in
 *       chunk order and deduplicated on {@code strip().toLowerCase(Locale.ROOT)}, keeping
 *       the first occurrence's casing. Blank entries are dropped.</li>
 *   <li>{@link #mergeConsolidate} feeds the union to an {@link EntityConsolidator}. If that
 *       fails or returns malformed output, the union is returned instead (no summary).</li>
 * </ol>
 *
 * <pre>
 * chunk 0: persons ["Juan Pérez"]
 * chunk 1: persons ["juan pérez ", "Ana Gómez"]
 * union  : persons ["Juan Pérez", "Ana Gómez"]
 * </pre>
 */
@Slf4j
@Component
public class ResultMerger {

    // =========================================================================
    //  Public API
    // =========================================================================

    public ConsolidatedResult mergeUnion(List<PartialResult> results) {
        List<PartialResult> ordered = results.stream()
                .sorted(Comparator.comparingInt(PartialResult::chunkIndex))
                .toList();

        ConsolidatedResult union = ConsolidatedResult.withoutSummary(
                collect(ordered, PartialResult::companies),
                collect(ordered, PartialResult::persons),
                collect(ordered, PartialResult::events));

        log.info("Union merge of {} partial results: {} companies, {} persons, {} events",
                results.size(), union.companies().size(), union.persons().size(), union.events().size());
        return union;
    }

    public ConsolidatedResult mergeConsolidate(List<PartialResult> results, EntityConsolidator consolidator) {
        ConsolidatedResult union = mergeUnion(results);

        ConsolidatedResult consolidated;
        try {
            consolidated = consolidator.consolidate(union.companies(), union.persons(), union.events());
        } catch (Exception e) {
            log.warn("Consolidation failed, falling back to union merge: {}", e.getMessage(), e);
            return union;
        }

        if (consolidated == null) {
            log.warn("Consolidation returned no result, falling back to union merge");
            return union;
        }

        ConsolidatedResult cleaned = new ConsolidatedResult(
                consolidated.summary(),
                deduplicate(consolidated.companies()),
                deduplicate(consolidated.persons()),
                deduplicate(consolidated.events()));

        log.info("Consolidation complete: {} companies, {} persons, {} events (from {}/{}/{})",
                cleaned.companies().size(), cleaned.persons().size(), cleaned.events().size(),
                union.companies().size(), union.persons().size(), union.events().size());
        return cleaned;
    }

    /**
     * Order-preserving, case- and whitespace-insensitive deduplication.
     *
     * @return stripped values, first occurrence of each normalized key only
     */
    public static List<String> deduplicate(Iterable<String> items) {
        Map<String, String> unique = new LinkedHashMap<>();
        for (String item : items) {
            if (item == null) continue;
            String key = normalizedKey(item);
            if (!key.isEmpty()) {
                unique.putIfAbsent(key, item.strip());
            }
        }
        return new ArrayList<>(unique.values());
    }

    static String normalizedKey(String value) {
        return value.strip().toLowerCase(Locale.ROOT);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private static List<String> collect(List<PartialResult> ordered,
                                        Function<PartialResult, List<String>> category) {
        List<String> flattened = new ArrayList<>();
        for (PartialResult result : ordered) {
            flattened.addAll(category.apply(result));
        }
        return deduplicate(flattened);
    }
}
