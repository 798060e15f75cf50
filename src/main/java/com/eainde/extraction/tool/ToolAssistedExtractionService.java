package com.eainde.extraction.tool;

import com.eainde.extraction.exception.ExtractionException;
import com.eainde.extraction.exception.PipelineConfigurationException;
import com.eainde.extraction.extract.EntityExtraction;
import com.eainde.extraction.extract.EntityResponseParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Single-call extraction in which the model fetches the source itself.
 *
 * <pre>
 * [system, user(source)] ──► model ──► tool calls? ──yes──► execute, append results ─┐
 *                              ▲                                                     │
 *                              └─────────────────────────────────────────────────────┘
 *                                         no ──► parse final text as entities
 * </pre>
 *
 * <p>A {@link ToolCapability#FETCH_CONTENT} tool must be registered. The loop runs at most {@code extraction.tool.max-iterations} model calls. A model
 * still asking for tools after that, or asking for a tool that is not registered,
 * raises {@link ExtractionException}.</p>
 */
@Slf4j
@Service
public class ToolAssistedExtractionService {

    static final String SYSTEM_PROMPT = """
            You are an expert in news analysis.
            Use the fetch_content tool to read the source the user names, then extract:
            - Companies and organizations mentioned
            - Persons mentioned
            - Relevant events or facts

            Answer ONLY with a JSON object of the form:
            {"companies": [...], "persons": [...], "events": [...]}
            """;

    private final ChatModel chatModel;
    private final ToolRegistry toolRegistry;
    private final EntityResponseParser parser;
    private final ObjectMapper objectMapper;
    private final int maxIterations;

    public ToolAssistedExtractionService(ChatModel chatModel,
                                         ToolRegistry toolRegistry,
                                         EntityResponseParser parser,
                                         ObjectMapper objectMapper,
                                         @Value("${extraction.tool.max-iterations:5}") int maxIterations) {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        if (toolRegistry.withCapability(ToolCapability.FETCH_CONTENT).isEmpty()) {
            throw new PipelineConfigurationException("No tool with capability " + ToolCapability.FETCH_CONTENT
                    + " is registered; tool-assisted extraction cannot read its source");
        }
        this.chatModel = chatModel;
        this.toolRegistry = toolRegistry;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.maxIterations = maxIterations;
    }

    public EntityExtraction extract(String source) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(SYSTEM_PROMPT));
        messages.add(UserMessage.from("Extract the entities from this source: " + source));

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            ChatResponse response;
            try {
                response = chatModel.chat(ChatRequest.builder()
                        .messages(List.copyOf(messages))
                        .toolSpecifications(toolRegistry.specifications())
                        .build());
            } catch (RuntimeException e) {
                throw new ExtractionException("Model call failed: " + e.getMessage(), e);
            }

            AiMessage aiMessage = response.aiMessage();
            if (!aiMessage.hasToolExecutionRequests()) {
                log.info("Tool-assisted extraction finished after {} model call(s)", iteration);
                return parser.parse(aiMessage.text());
            }

            messages.add(aiMessage);
            for (ToolExecutionRequest request : aiMessage.toolExecutionRequests()) {
                messages.add(ToolExecutionResultMessage.from(request, execute(request)));
            }
        }

        throw new ExtractionException(
                "Model still requested tools after " + maxIterations + " iterations");
    }

    private String execute(ToolExecutionRequest request) {
        ToolExecutor executor = toolRegistry.find(request.name())
                .orElseThrow(() -> new ExtractionException("Model requested unknown tool: " + request.name()));
        log.info("Executing tool {} ({})", request.name(), executor.capability());
        return executor.execute(parseArguments(request));
    }

    private Map<String, Object> parseArguments(ToolExecutionRequest request) {
        String arguments = request.arguments();
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(arguments, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new ExtractionException(
                    "Invalid arguments for tool " + request.name() + ": " + e.getOriginalMessage(), e);
        }
    }
}
