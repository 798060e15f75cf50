package com.eainde.extraction.exception;

/**
 * No usable text could be obtained for the requested source.
 */
public class ContentLoadException extends FragmentPipelineException {

    public ContentLoadException(String message) {
        super(message);
    }

    public ContentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
