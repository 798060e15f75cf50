package com.eainde.extraction.tool;

import dev.langchain4j.agent.tool.ToolSpecification;

import java.util.Map;

/**
 * A tool the model may call during tool-assisted extraction.
 */
public interface ToolExecutor {

    /** Name the model uses to call this tool; matches {@code specification().name()}. */
    String name();

    ToolCapability capability();

    ToolSpecification specification();

    /**
     * @param arguments arguments parsed from the model's tool call
     * @return text handed back to the model as the tool result
     */
    String execute(Map<String, Object> arguments);
}
