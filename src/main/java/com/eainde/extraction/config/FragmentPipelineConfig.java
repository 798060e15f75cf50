package com.eainde.extraction.config;

import com.eainde.extraction.chunk.ChunkingStrategy;
import com.eainde.extraction.extract.NewsExtractionAgent;
import com.eainde.extraction.merge.NewsConsolidationAgent;
import com.eainde.extraction.pool.ExtractionProgressListener;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.service.AiServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the fragment pipeline.
 *
 * <pre>
 *   application.yml ──► PipelineSettings (immutable, validated per run)
 *
 *   OllamaChatModel ──┬──► NewsExtractionAgent    (one call per chunk)
 *                     ├──► NewsConsolidationAgent (one call per run)
 *                     └──► ToolAssistedExtractionService
 * </pre>
 */
@Configuration
public class FragmentPipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(FragmentPipelineConfig.class);

    // =========================================================================
    //  Settings
    // =========================================================================

    @Bean
    public PipelineSettings pipelineSettings(
            @Value("${extraction.chunk.size:2000}") int chunkSize,
            @Value("${extraction.chunk.overlap:100}") int overlap,
            @Value("${extraction.chunk.strategy:FIXED_WINDOW}") ChunkingStrategy strategy,
            @Value("${extraction.concurrency-limit:4}") int concurrencyLimit,
            @Value("${extraction.consolidation.enabled:true}") boolean consolidationEnabled) {

        PipelineSettings settings = new PipelineSettings(
                chunkSize, overlap, strategy, concurrencyLimit, consolidationEnabled);
        log.info("Pipeline settings: {}", settings);
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean
    public ExtractionProgressListener extractionProgressListener() {
        return ExtractionProgressListener.logging();
    }

    // =========================================================================
    //  Model + agents
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean(ChatModel.class)
    public ChatModel chatModel(
            @Value("${extraction.model.base-url:http://localhost:11434}") String baseUrl,
            @Value("${extraction.model.name:gpt-oss:latest}") String modelName,
            @Value("${extraction.model.timeout:PT2M}") Duration timeout,
            @Value("${extraction.model.log-requests:false}") boolean logRequests) {

        log.info("Using Ollama model '{}' at {}", modelName, baseUrl);
        return OllamaChatModel.builder()
                .baseUrl(baseUrl)
                .modelName(modelName)
                .temperature(0.0)
                .timeout(timeout)
                .responseFormat(ResponseFormat.JSON)
                .maxRetries(0)
                .logRequests(logRequests)
                .logResponses(logRequests)
                .build();
    }

    @Bean
    public NewsExtractionAgent newsExtractionAgent(ChatModel chatModel) {
        return AiServices.builder(NewsExtractionAgent.class)
                .chatModel(chatModel)
                .build();
    }

    @Bean
    public NewsConsolidationAgent newsConsolidationAgent(ChatModel chatModel) {
        return AiServices.builder(NewsConsolidationAgent.class)
                .chatModel(chatModel)
                .build();
    }
}
