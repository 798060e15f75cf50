package com.eainde.extraction.tool;

import com.eainde.extraction.exception.ContentLoadException;
import com.eainde.extraction.load.ContentLoader;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Lets the model load the text of a source through the {@link ContentLoader}.
 * Load failures are returned to the model as an error string, not thrown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FetchContentToolExecutor implements ToolExecutor {

    static final String NAME = "fetch_content";
    static final String SOURCE_ARGUMENT = "source";

    private final ContentLoader contentLoader;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ToolCapability capability() {
        return ToolCapability.FETCH_CONTENT;
    }

    @Override
    public ToolSpecification specification() {
        return ToolSpecification.builder()
                .name(NAME)
                .description("Returns the text content of a news source (file path or file: URI).")
                .parameters(JsonObjectSchema.builder()
                        .addStringProperty(SOURCE_ARGUMENT, "Path or file: URI of the source to read")
                        .required(SOURCE_ARGUMENT)
                        .build())
                .build();
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        Object source = arguments.get(SOURCE_ARGUMENT);
        if (source == null) {
            return "Error: missing argument '" + SOURCE_ARGUMENT + "'";
        }
        try {
            return contentLoader.load(source.toString());
        } catch (ContentLoadException e) {
            log.warn("fetch_content failed for {}: {}", source, e.getMessage());
            return "Error: " + e.getMessage();
        }
    }
}
