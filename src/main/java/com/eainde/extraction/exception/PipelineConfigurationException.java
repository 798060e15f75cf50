package com.eainde.extraction.exception;

/**
 * Invalid chunk size, overlap or concurrency settings. Raised before any
 * extraction is attempted.
 */
public class PipelineConfigurationException extends FragmentPipelineException {

    public PipelineConfigurationException(String message) {
        super(message);
    }
}
