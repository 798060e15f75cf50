package com.eainde.extraction.exception;

/**
 * The consolidation pass failed or returned malformed output.
 */
public class ConsolidationException extends FragmentPipelineException {

    public ConsolidationException(String message) {
        super(message);
    }

    public ConsolidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
