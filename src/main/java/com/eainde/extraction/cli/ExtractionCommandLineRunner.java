package com.eainde.extraction.cli;

import com.eainde.extraction.extract.EntityExtraction;
import com.eainde.extraction.merge.ConsolidatedResult;
import com.eainde.extraction.merge.ResultMerger;
import com.eainde.extraction.pipeline.FragmentExtractionPipeline;
import com.eainde.extraction.pipeline.PipelineOutcome;
import com.eainde.extraction.sink.ResultSink;
import com.eainde.extraction.tool.ToolAssistedExtractionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Command-line entry point.
 *
 * <pre>
 * java -jar fragment-entity-extraction.jar [source]
 *      [--extraction.output=data.json]
 *      [--extraction.mode=chunked|tool-assisted]
 * </pre>
 *
 * Exit code 0 when the run reaches DONE and the result is written, 1 otherwise.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "extraction.cli.enabled", havingValue = "true", matchIfMissing = true)
public class ExtractionCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    static final String MODE_CHUNKED = "chunked";
    static final String MODE_TOOL_ASSISTED = "tool-assisted";

    private final FragmentExtractionPipeline pipeline;
    private final ToolAssistedExtractionService toolAssistedService;
    private final ResultSink sink;
    private final String defaultSource;
    private final Path output;
    private final String mode;

    private int exitCode = 1;

    public ExtractionCommandLineRunner(FragmentExtractionPipeline pipeline,
                                       ToolAssistedExtractionService toolAssistedService,
                                       ResultSink sink,
                                       @Value("${extraction.source:}") String defaultSource,
                                       @Value("${extraction.output:data.json}") Path output,
                                       @Value("${extraction.mode:chunked}") String mode) {
        this.pipeline = pipeline;
        this.toolAssistedService = toolAssistedService;
        this.sink = sink;
        this.defaultSource = defaultSource;
        this.output = output;
        this.mode = mode;
    }

    @Override
    public void run(String... args) {
        String source = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .findFirst()
                .orElse(defaultSource);

        if (source == null || source.isBlank()) {
            log.error("No source given. Usage: [source] [--extraction.output=path] "
                    + "[--extraction.mode=chunked|tool-assisted]");
            exitCode = 1;
            return;
        }

        ConsolidatedResult result = switch (mode) {
            case MODE_CHUNKED -> runChunked(source);
            case MODE_TOOL_ASSISTED -> runToolAssisted(source);
            default -> {
                log.error("Unknown extraction mode '{}'; expected {} or {}",
                        mode, MODE_CHUNKED, MODE_TOOL_ASSISTED);
                yield null;
            }
        };
        if (result == null) {
            exitCode = 1;
            return;
        }

        if (result.isEmpty()) {
            log.warn("No entities were extracted from {}", source);
        }

        try {
            sink.write(result, output);
        } catch (IOException e) {
            log.error("Failed to write results to {}", output, e);
            exitCode = 1;
            return;
        }
        exitCode = 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private ConsolidatedResult runChunked(String source) {
        PipelineOutcome outcome = pipeline.run(source);
        if (!outcome.isDone()) {
            log.error("Extraction failed during {}: {}", outcome.failedAt(), outcome.error().getMessage());
            return null;
        }
        return outcome.result();
    }

    private ConsolidatedResult runToolAssisted(String source) {
        try {
            EntityExtraction extraction = toolAssistedService.extract(source);
            return ConsolidatedResult.withoutSummary(
                    ResultMerger.deduplicate(extraction.companies()),
                    ResultMerger.deduplicate(extraction.persons()),
                    ResultMerger.deduplicate(extraction.events()));
        } catch (RuntimeException e) {
            log.error("Tool-assisted extraction failed: {}", e.getMessage(), e);
            return null;
        }
    }
}
