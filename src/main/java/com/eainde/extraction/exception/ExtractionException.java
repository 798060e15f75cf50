package com.eainde.extraction.exception;

/**
 * A single fragment could not be turned into entities: the model call failed,
 * timed out, or returned output that does not parse.
 */
public class ExtractionException extends FragmentPipelineException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
