package com.eainde.extraction.extract;

import com.eainde.extraction.exception.ExtractionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityResponseParserTest {

    private final EntityResponseParser parser = new EntityResponseParser(new ObjectMapper());

    @Nested
    @DisplayName("Category keys")
    class CategoryKeys {

        @Test
        @DisplayName("reads canonical keys")
        void canonical() {
            EntityExtraction result = parser.parse("""
                    {"companies": ["Ecopetrol"], "persons": ["Juan Pérez"], "events": ["Firma de acuerdo"]}
                    """);

            assertThat(result.companies()).containsExactly("Ecopetrol");
            assertThat(result.persons()).containsExactly("Juan Pérez");
            assertThat(result.events()).containsExactly("Firma de acuerdo");
        }

        @Test
        @DisplayName("maps Spanish and English aliases case-insensitively")
        void aliases() {
            EntityExtraction result = parser.parse("""
                    {"Empresas": ["Ecopetrol"], "PEOPLE": ["Ana Gómez"], "hechos": ["Resolución 40505"]}
                    """);

            assertThat(result.companies()).containsExactly("Ecopetrol");
            assertThat(result.persons()).containsExactly("Ana Gómez");
            assertThat(result.events()).containsExactly("Resolución 40505");
        }

        @Test
        @DisplayName("prefers the earlier alias when several are present")
        void aliasOrder() {
            EntityExtraction result = parser.parse("""
                    {"people": ["B"], "persons": ["A"]}
                    """);

            assertThat(result.persons()).containsExactly("A");
        }

        @Test
        @DisplayName("two spellings of the same alias keep the first one")
        void sameAliasTwice() {
            EntityExtraction result = parser.parse("""
                    {"Persons": ["A"], "persons": ["B"], "PERSONAS": ["C"]}
                    """);

            assertThat(result.persons()).containsExactly("A");
        }

        @Test
        @DisplayName("ignores unknown keys and defaults missing categories to empty")
        void unknownAndMissing() {
            EntityExtraction result = parser.parse("""
                    {"notes": "irrelevant", "persons": ["Juan Pérez"]}
                    """);

            assertThat(result.companies()).isEmpty();
            assertThat(result.events()).isEmpty();
            assertThat(result.persons()).containsExactly("Juan Pérez");
        }
    }

    @Nested
    @DisplayName("Value coercion")
    class Coercion {

        @Test
        @DisplayName("a single string becomes a one-element list")
        void singleString() {
            assertThat(parser.parse("{\"personas\": \"Juan Pérez\"}").persons())
                    .containsExactly("Juan Pérez");
        }

        @Test
        @DisplayName("null, blank and whitespace-padded entries are cleaned")
        void cleaning() {
            EntityExtraction result = parser.parse("""
                    {"companies": [" Ecopetrol ", "", null, "   "], "persons": null}
                    """);

            assertThat(result.companies()).containsExactly("Ecopetrol");
            assertThat(result.persons()).isEmpty();
        }

        @Test
        @DisplayName("other scalars use their text")
        void scalars() {
            assertThat(parser.parse("{\"events\": [2025, true]}").events())
                    .containsExactly("2025", "true");
        }
    }

    @Nested
    @DisplayName("Malformed responses")
    class Malformed {

        @Test
        @DisplayName("strips Markdown code fences")
        void fenced() {
            EntityExtraction result = parser.parse("""
                    ```json
                    {"companies": ["Ecopetrol"]}
                    ```
                    """);

            assertThat(result.companies()).containsExactly("Ecopetrol");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "not json", "[\"Ecopetrol\"]", "\"text\""})
        @DisplayName("rejects blank, invalid or non-object responses")
        void rejects(String response) {
            assertThatThrownBy(() -> parser.parse(response))
                    .isInstanceOf(ExtractionException.class);
        }

        @Test
        @DisplayName("rejects null")
        void rejectsNull() {
            assertThatThrownBy(() -> parser.parse(null))
                    .isInstanceOf(ExtractionException.class);
        }
    }
}
