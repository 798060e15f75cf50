package com.eainde.extraction.config;

import com.eainde.extraction.chunk.ChunkingStrategy;
import com.eainde.extraction.cli.ExtractionCommandLineRunner;
import com.eainde.extraction.pipeline.FragmentExtractionPipeline;
import com.eainde.extraction.tool.ToolRegistry;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "extraction.cli.enabled=false",
        "extraction.chunk.size=1500",
        "extraction.chunk.strategy=BOUNDARY_AWARE",
        "extraction.concurrency-limit=2"
})
class FragmentPipelineConfigTest {

    @Autowired private ApplicationContext context;
    @Autowired private PipelineSettings settings;

    @Test
    @DisplayName("binds settings from properties, with defaults for the rest")
    void settings() {
        assertThat(settings.chunkSize()).isEqualTo(1500);
        assertThat(settings.overlap()).isEqualTo(100);
        assertThat(settings.chunkingStrategy()).isEqualTo(ChunkingStrategy.BOUNDARY_AWARE);
        assertThat(settings.concurrencyLimit()).isEqualTo(2);
        assertThat(settings.consolidationEnabled()).isTrue();
    }

    @Test
    @DisplayName("wires the pipeline, model and tools without starting the CLI")
    void wiring() {
        assertThat(context.getBean(FragmentExtractionPipeline.class)).isNotNull();
        assertThat(context.getBean(ChatModel.class)).isNotNull();
        assertThat(context.getBean(ToolRegistry.class).find("fetch_content")).isPresent();
        assertThat(context.getBeansOfType(ExtractionCommandLineRunner.class)).isEmpty();
    }
}
