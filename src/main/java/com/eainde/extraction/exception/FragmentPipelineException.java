package com.eainde.extraction.exception;

/**
 * Root of the unchecked exceptions raised by the fragment extraction pipeline.
 *
 * <p>Load and configuration failures are fatal to a run. Extraction and
 * consolidation failures are recovered where they occur and never reach
 * the caller of the pipeline.</p>
 */
public abstract class FragmentPipelineException extends RuntimeException {

    protected FragmentPipelineException(String message) {
        super(message);
    }

    protected FragmentPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
