package com.eainde.extraction.tool;

import com.eainde.extraction.exception.PipelineConfigurationException;
import dev.langchain4j.agent.tool.ToolSpecification;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name → executor lookup for the tools offered to the model.
 */
@Component
public class ToolRegistry {

    private final Map<String, ToolExecutor> executors;

    public ToolRegistry(List<ToolExecutor> executors) {
        Map<String, ToolExecutor> byName = new LinkedHashMap<>();
        for (ToolExecutor executor : executors) {
            if (byName.putIfAbsent(executor.name(), executor) != null) {
                throw new PipelineConfigurationException("Duplicate tool name: " + executor.name());
            }
        }
        this.executors = Collections.unmodifiableMap(byName);
    }

    public Optional<ToolExecutor> find(String name) {
        return Optional.ofNullable(executors.get(name));
    }

    public List<ToolSpecification> specifications() {
        return executors.values().stream().map(ToolExecutor::specification).toList();
    }

    public List<ToolExecutor> withCapability(ToolCapability capability) {
        return executors.values().stream()
                .filter(executor -> executor.capability() == capability)
                .toList();
    }
}
