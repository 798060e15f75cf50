package com.eainde.extraction.tool;

/**
 * What a tool is allowed to do. Executors declare exactly one.
 */
public enum ToolCapability {
    FETCH_CONTENT
}
