package com.eainde.extraction.sink;

import com.eainde.extraction.merge.ConsolidatedResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link ConsolidatedResult} as indented UTF-8 JSON:
 *
 * <pre>
 * {
 *   "summary" : "...",          (only after a successful consolidation)
 *   "companies" : [ ... ],
 *   "persons" : [ ... ],
 *   "events" : [ ... ]
 * }
 * </pre>
 */
@Slf4j
@Component
public class JsonFileResultSink implements ResultSink {

    private final ObjectMapper objectMapper;

    public JsonFileResultSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void write(ConsolidatedResult result, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = objectMapper.writeValueAsString(result);
        Files.writeString(target, json, StandardCharsets.UTF_8);
        log.info("Results saved to {}", target.toAbsolutePath());
    }
}
