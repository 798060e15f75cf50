package com.eainde.extraction.pipeline;

/**
 * States of one pipeline run.
 *
 * <pre>
 * IDLE → LOADING → CHUNKING → EXTRACTING → CONSOLIDATING → DONE
 *           │          │
 *           └──────────┴──→ FAILED
 * </pre>
 */
public enum PipelineState {
    IDLE,
    LOADING,
    CHUNKING,
    EXTRACTING,
    CONSOLIDATING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
