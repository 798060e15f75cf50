package com.eainde.extraction.sink;

import com.eainde.extraction.merge.ConsolidatedResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileResultSinkTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonFileResultSink sink = new JsonFileResultSink(objectMapper);

    @TempDir
    Path dir;

    @Test
    @DisplayName("writes summary and the three lists in order, creating parent directories")
    void withSummary() throws IOException {
        Path target = dir.resolve("out/nested/data.json");

        sink.write(new ConsolidatedResult("Resumen.", List.of("Ecopetrol"), List.of("Juan Pérez"), List.of()), target);

        String json = Files.readString(target, StandardCharsets.UTF_8);
        JsonNode root = objectMapper.readTree(json);
        assertThat(root.fieldNames()).toIterable().containsExactly("summary", "companies", "persons", "events");
        assertThat(root.get("persons").get(0).asText()).isEqualTo("Juan Pérez");
        assertThat(json).contains("\n");
    }

    @Test
    @DisplayName("omits summary after a union-only merge")
    void withoutSummary() throws IOException {
        Path target = dir.resolve("data.json");

        sink.write(ConsolidatedResult.withoutSummary(List.of(), List.of(), List.of("Evento")), target);

        JsonNode root = objectMapper.readTree(Files.readString(target, StandardCharsets.UTF_8));
        assertThat(root.fieldNames()).toIterable().containsExactly("companies", "persons", "events");
    }

    @Test
    @DisplayName("a blank summary is not written")
    void blankSummary() throws IOException {
        Path target = dir.resolve("blank.json");

        sink.write(new ConsolidatedResult("  ", List.of("Ecopetrol"), List.of(), List.of()), target);

        JsonNode root = objectMapper.readTree(Files.readString(target, StandardCharsets.UTF_8));
        assertThat(root.has("summary")).isFalse();
    }

    @Test
    @DisplayName("does not change the shared ObjectMapper")
    void sharedMapperUntouched() throws IOException {
        sink.write(ConsolidatedResult.withoutSummary(List.of(), List.of(), List.of()), dir.resolve("a.json"));

        assertThat(objectMapper.writeValueAsString(List.of("a"))).isEqualTo("[\"a\"]");
    }
}
