package com.eainde.extraction.pipeline;

import com.eainde.extraction.chunk.TextChunk;
import com.eainde.extraction.config.PipelineSettings;
import com.eainde.extraction.exception.ContentLoadException;
import com.eainde.extraction.exception.FragmentPipelineException;
import com.eainde.extraction.exception.PipelineConfigurationException;
import com.eainde.extraction.extract.EntityExtractor;
import com.eainde.extraction.load.ContentLoader;
import com.eainde.extraction.merge.ConsolidatedResult;
import com.eainde.extraction.merge.EntityConsolidator;
import com.eainde.extraction.merge.ResultMerger;
import com.eainde.extraction.pool.ExtractionWorkerPool;
import com.eainde.extraction.pool.PartialResult;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one document through the fragment pipeline.
 *
 * <h3>States</h3>
 * <pre>
 * IDLE → LOADING → CHUNKING → EXTRACTING → CONSOLIDATING → DONE
 *           │          │
 *           └──────────┴──→ FAILED
 * </pre>
 *
 * <ul>
 *   <li><b>LOADING</b>: load errors and blank content are fatal.</li>
 *   <li><b>CHUNKING</b>: settings are validated here; invalid settings are fatal
 *       and no extraction call is made.</li>
 *   <li><b>EXTRACTING</b>: per-chunk failures are absorbed by the worker pool.</li>
 *   <li><b>CONSOLIDATING</b>: consolidation failures fall back to the union merge.</li>
 * </ul>
 *
 * <p>A {@link java.util.concurrent.CancellationException} from the worker pool is
 * not a pipeline failure and propagates to the caller.</p>
 */
@Slf4j
@Service
public class FragmentExtractionPipeline {

    private static final String MDC_RUN_ID = "runId";

    private final ContentLoader contentLoader;
    private final ExtractionWorkerPool workerPool;
    private final EntityExtractor extractor;
    private final ResultMerger merger;
    private final Optional<EntityConsolidator> consolidator;
    private final PipelineSettings settings;

    public FragmentExtractionPipeline(ContentLoader contentLoader,
                                      ExtractionWorkerPool workerPool,
                                      EntityExtractor extractor,
                                      ResultMerger merger,
                                      Optional<EntityConsolidator> consolidator,
                                      PipelineSettings settings) {
        this.contentLoader = contentLoader;
        this.workerPool = workerPool;
        this.extractor = extractor;
        this.merger = merger;
        this.consolidator = consolidator;
        this.settings = settings;
    }

    public PipelineOutcome run(String source) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_RUN_ID, runId);
        try {
            return execute(source);
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    private PipelineOutcome execute(String source) {
        List<PipelineState> visited = new ArrayList<>();
        visited.add(PipelineState.IDLE);
        long start = System.currentTimeMillis();

        // ── LOADING ──
        visited.add(PipelineState.LOADING);
        String text;
        try {
            text = contentLoader.load(source);
        } catch (ContentLoadException e) {
            return fail(e, PipelineState.LOADING, visited, 0);
        } catch (Exception e) {
            return fail(new ContentLoadException("Failed to load " + source + ": " + e.getMessage(), e),
                    PipelineState.LOADING, visited, 0);
        }
        if (text == null || text.isBlank()) {
            return fail(new ContentLoadException("No content loaded from " + source),
                    PipelineState.LOADING, visited, 0);
        }

        // ── CHUNKING ──
        visited.add(PipelineState.CHUNKING);
        List<TextChunk> chunks;
        try {
            settings.validate();
            chunks = settings.newChunker().split(text);
        } catch (PipelineConfigurationException e) {
            return fail(e, PipelineState.CHUNKING, visited, 0);
        }

        // ── EXTRACTING ──
        visited.add(PipelineState.EXTRACTING);
        List<PartialResult> partials = workerPool.run(chunks, extractor, settings.concurrencyLimit());
        int failedChunks = (int) partials.stream().filter(PartialResult::failed).count();

        // ── CONSOLIDATING ──
        visited.add(PipelineState.CONSOLIDATING);
        ConsolidatedResult result;
        if (settings.consolidationEnabled() && consolidator.isPresent()) {
            result = merger.mergeConsolidate(partials, consolidator.get());
        } else {
            log.info("Consolidation disabled; using union merge");
            result = merger.mergeUnion(partials);
        }

        visited.add(PipelineState.DONE);
        log.info("Pipeline DONE in {} ms: {} chunks ({} failed), {} companies, {} persons, {} events",
                System.currentTimeMillis() - start, chunks.size(), failedChunks,
                result.companies().size(), result.persons().size(), result.events().size());
        return PipelineOutcome.done(result, visited, chunks.size(), failedChunks);
    }

    private static PipelineOutcome fail(FragmentPipelineException error, PipelineState failedAt,
                                        List<PipelineState> visited, int chunkCount) {
        visited.add(PipelineState.FAILED);
        log.error("Pipeline FAILED during {}: {}", failedAt, error.getMessage(), error);
        return PipelineOutcome.failed(error, failedAt, visited, chunkCount);
    }
}
