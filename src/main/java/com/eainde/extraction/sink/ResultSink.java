package com.eainde.extraction.sink;

import com.eainde.extraction.merge.ConsolidatedResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists the final result of a run.
 */
public interface ResultSink {

    void write(ConsolidatedResult result, Path target) throws IOException;
}
