package com.eainde.extraction.pipeline;

import com.eainde.extraction.exception.FragmentPipelineException;
import com.eainde.extraction.merge.ConsolidatedResult;

import java.util.List;

/**
 * Terminal artifact of a pipeline run: either {@link PipelineState#DONE} with a
 * result, or {@link PipelineState#FAILED} with the error and the state it failed in.
 *
 * @param state            DONE or FAILED
 * @param result           the merged entities; null when FAILED
 * @param error            the fatal error; null when DONE
 * @param failedAt         the state that raised {@code error}; null when DONE
 * @param visitedStates    every state entered, in order, starting with IDLE
 * @param chunkCount       chunks produced (0 if the run failed before chunking)
 * @param failedChunkCount chunks whose extraction failed
 */
public record PipelineOutcome(
        PipelineState state,
        ConsolidatedResult result,
        FragmentPipelineException error,
        PipelineState failedAt,
        List<PipelineState> visitedStates,
        int chunkCount,
        int failedChunkCount
) {

    public PipelineOutcome {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("outcome state must be DONE or FAILED, got " + state);
        }
        visitedStates = List.copyOf(visitedStates);
    }

    static PipelineOutcome done(ConsolidatedResult result, List<PipelineState> visitedStates,
                                int chunkCount, int failedChunkCount) {
        return new PipelineOutcome(PipelineState.DONE, result, null, null,
                visitedStates, chunkCount, failedChunkCount);
    }

    static PipelineOutcome failed(FragmentPipelineException error, PipelineState failedAt,
                                  List<PipelineState> visitedStates, int chunkCount) {
        return new PipelineOutcome(PipelineState.FAILED, null, error, failedAt,
                visitedStates, chunkCount, 0);
    }

    public boolean isDone() {
        return state == PipelineState.DONE;
    }
}
