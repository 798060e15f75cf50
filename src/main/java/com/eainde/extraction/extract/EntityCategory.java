package com.eainde.extraction.extract;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The entity categories the pipeline extracts, with the JSON keys a model may
 * use for each. Models answering in Spanish or paraphrasing the schema return
 * {@code "personas"} or {@code "people"} instead of {@code "persons"}; the alias
 * table maps all of them to one canonical category.
 *
 * <p>Keys are matched case-insensitively. Aliases are tried in declaration order.</p>
 */
public enum EntityCategory {

    COMPANIES("companies", "empresas", "organizations", "organizaciones"),
    PERSONS("persons", "personas", "people", "individuos"),
    EVENTS("events", "eventos", "hechos", "acontecimientos");

    private final List<String> aliases;

    EntityCategory(String... aliases) {
        this.aliases = List.of(aliases);
    }

    /** Canonical JSON field name. */
    public String canonicalKey() {
        return aliases.get(0);
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Position of {@code key} in this category's alias list; lower wins.
     *
     * @return the alias index, or {@link Integer#MAX_VALUE} if {@code key} is not an alias
     */
    public int priority(String key) {
        int index = key == null ? -1 : aliases.indexOf(normalize(key));
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    /**
     * Resolves an arbitrary JSON key to its category.
     *
     * @return the category, or empty for unrecognized keys
     */
    public static Optional<EntityCategory> fromKey(String key) {
        if (key == null) return Optional.empty();
        String lowered = normalize(key);
        for (EntityCategory category : values()) {
            if (category.aliases.contains(lowered)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String key) {
        return key.strip().toLowerCase(Locale.ROOT);
    }
}
