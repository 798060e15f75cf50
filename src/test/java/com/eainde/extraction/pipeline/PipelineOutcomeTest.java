package com.eainde.extraction.pipeline;

import com.eainde.extraction.exception.ContentLoadException;
import com.eainde.extraction.merge.ConsolidatedResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineOutcomeTest {

    @Test
    @DisplayName("only terminal states can form an outcome")
    void terminalOnly() {
        ConsolidatedResult empty = ConsolidatedResult.withoutSummary(List.of(), List.of(), List.of());

        assertThatThrownBy(() -> new PipelineOutcome(PipelineState.EXTRACTING, empty, null, null,
                List.of(PipelineState.IDLE), 1, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("EXTRACTING");
        assertThatThrownBy(() -> new PipelineOutcome(null, empty, null, null, List.of(), 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("factories build DONE and FAILED outcomes with a frozen state history")
    void factories() {
        List<PipelineState> visited = new ArrayList<>(List.of(PipelineState.IDLE, PipelineState.LOADING));
        PipelineOutcome failed = PipelineOutcome.failed(
                new ContentLoadException("missing"), PipelineState.LOADING, visited, 0);
        visited.add(PipelineState.FAILED);

        assertThat(failed.isDone()).isFalse();
        assertThat(failed.visitedStates()).containsExactly(PipelineState.IDLE, PipelineState.LOADING);

        PipelineOutcome done = PipelineOutcome.done(
                ConsolidatedResult.withoutSummary(List.of("Ecopetrol"), List.of(), List.of()),
                List.of(PipelineState.IDLE, PipelineState.DONE), 2, 1);
        assertThat(done.isDone()).isTrue();
        assertThat(done.failedChunkCount()).isEqualTo(1);
    }
}
