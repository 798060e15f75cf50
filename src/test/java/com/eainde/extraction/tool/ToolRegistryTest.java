package com.eainde.extraction.tool;

import com.eainde.extraction.exception.PipelineConfigurationException;
import com.eainde.extraction.load.ContentLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTest {

    private final ContentLoader loader = source -> "content of " + source;

    @Test
    @DisplayName("finds executors by name and exposes their specifications")
    void lookup() {
        ToolRegistry registry = new ToolRegistry(List.of(new FetchContentToolExecutor(loader)));

        assertThat(registry.find("fetch_content")).isPresent();
        assertThat(registry.find("delete_everything")).isEmpty();
        assertThat(registry.specifications()).singleElement()
                .satisfies(spec -> assertThat(spec.name()).isEqualTo("fetch_content"));
        assertThat(registry.withCapability(ToolCapability.FETCH_CONTENT)).hasSize(1);
    }

    @Test
    @DisplayName("rejects two executors with the same name")
    void duplicateNames() {
        assertThatThrownBy(() -> new ToolRegistry(List.of(
                new FetchContentToolExecutor(loader), new FetchContentToolExecutor(loader))))
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessageContaining("fetch_content");
    }
}
