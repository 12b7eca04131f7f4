package com.example.videocompare_backend.service.pipeline;

import com.example.videocompare_backend.config.PipelineExecutorProperties;
import com.example.videocompare_backend.engine.Interfaces.TranscriptionEngine;
import com.example.videocompare_backend.exception.StorageException;
import com.example.videocompare_backend.model.AcquiredMedia;
import com.example.videocompare_backend.model.StageResult;
import com.example.videocompare_backend.model.Transcript;
import com.example.videocompare_backend.model.WorkItem;
import com.example.videocompare_backend.model.WorkItemState;
import com.example.videocompare_backend.service.Interfaces.StorageService;
import com.example.videocompare_backend.service.summary.ChunkedSummarizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Runs transcribe then summarize for every acquired item concurrently. Each item has its own
 * failure boundary; the fan-in waits for all items and partitions them by outcome.
 */
@Service
public class PipelineOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String TRANSCRIPTION_ERROR = "TranscriptionError";
    static final String SUMMARIZATION_ERROR = "SummarizationError";
    static final String TIMEOUT_ERROR = "TimeoutError";
    static final String PIPELINE_ERROR = "PipelineError";

    private final Executor executor;
    private final TranscriptionEngine transcriptionEngine;
    private final ChunkedSummarizer summarizer;
    private final StorageService storage;
    private final Duration itemTimeout;

    @Autowired
    public PipelineOrchestrator(@Qualifier("pipelineTaskExecutor") Executor executor,
                                TranscriptionEngine transcriptionEngine,
                                ChunkedSummarizer summarizer,
                                StorageService storage,
                                PipelineExecutorProperties props) {
        this(executor, transcriptionEngine, summarizer, storage, Duration.ofMinutes(props.getItemTimeoutMinutes()));
    }

    PipelineOrchestrator(Executor executor,
                         TranscriptionEngine transcriptionEngine,
                         ChunkedSummarizer summarizer,
                         StorageService storage,
                         Duration itemTimeout) {
        this.executor = executor;
        this.transcriptionEngine = transcriptionEngine;
        this.summarizer = summarizer;
        this.storage = storage;
        this.itemTimeout = itemTimeout;
    }

    /**
     * Both lists of the outcome keep input order.
     */
    public record PipelineOutcome(List<WorkItem> succeeded, List<WorkItem> skipped) {
        public PipelineOutcome {
            succeeded = List.copyOf(succeeded);
            skipped = List.copyOf(skipped);
        }
    }

    public PipelineOutcome run(List<AcquiredMedia> media) {
        List<WorkItem> items = new ArrayList<>(media.size());
        List<CompletableFuture<StageResult<String>>> futures = new ArrayList<>(media.size());
        for (AcquiredMedia m : media) {
            WorkItem item = new WorkItem(m);
            items.add(item);
            CompletableFuture<StageResult<String>> future = CompletableFuture
                    .supplyAsync(() -> process(item), executor)
                    .exceptionally(ex -> StageResult.failure(PIPELINE_ERROR, rootMessage(ex)));
            if (!itemTimeout.isZero() && !itemTimeout.isNegative()) {
                future = future.completeOnTimeout(
                        StageResult.failure(TIMEOUT_ERROR, "Processing exceeded " + describe(itemTimeout)),
                        itemTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            futures.add(future);
        }

        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        List<WorkItem> succeeded = new ArrayList<>();
        List<WorkItem> skipped = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            WorkItem item = items.get(i);
            StageResult<String> result = futures.get(i).join();
            if (result instanceof StageResult.Success<String> success && item.markSummarized(success.value())) {
                succeeded.add(item);
            } else {
                if (result instanceof StageResult.Failure<String> failure) {
                    item.markFailed(failure.tag(), failure.message());
                } else {
                    item.markFailed(PIPELINE_ERROR, "Item finished in unexpected state " + item.state());
                }
                LOGGER.warn("ITEM FAILED item={} name={} reason={}", item.index(), item.displayName(), item.failureDescription());
                cleanup(item);
                skipped.add(item);
            }
        }
        LOGGER.info("PIPELINE done items={} succeeded={} skipped={}", items.size(), succeeded.size(), skipped.size());
        return new PipelineOutcome(succeeded, skipped);
    }

    StageResult<String> process(WorkItem item) {
        long t0 = System.nanoTime();
        try {
            StageResult<Transcript> transcribed = transcribe(item);
            if (transcribed instanceof StageResult.Failure<Transcript> failure) {
                return failure.retype();
            }
            Transcript transcript = ((StageResult.Success<Transcript>) transcribed).value();
            if (!item.markTranscribed(transcript) || !item.advance(WorkItemState.SUMMARIZING)) {
                return StageResult.failure(TIMEOUT_ERROR, "Item was abandoned before summarization");
            }
            StageResult<String> summarized = summarize(item, transcript);
            LOGGER.info("ITEM processed item={} ok={} tokens={} took={}ms",
                    item.index(), summarized.isSuccess(), transcript.tokenCount(), (System.nanoTime() - t0) / 1_000_000);
            return summarized;
        } finally {
            cleanup(item);
        }
    }

    private StageResult<Transcript> transcribe(WorkItem item) {
        if (!item.advance(WorkItemState.TRANSCRIBING)) {
            return StageResult.failure(TIMEOUT_ERROR, "Item was abandoned before transcription");
        }
        Path audio = storage.newScratchFile("wav");
        item.trackTempFile(audio);
        try {
            TranscriptionEngine.Result result = transcriptionEngine.transcribe(
                    new TranscriptionEngine.Request(String.valueOf(item.index()), item.localPath(), audio));
            Transcript transcript = Transcript.of(result.text());
            LOGGER.info("TRANSCRIBE OK item={} name={} lang={} tokens={}", item.index(), item.displayName(), result.lang(), transcript.tokenCount());
            return StageResult.success(transcript);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StageResult.failure(TRANSCRIPTION_ERROR, "Interrupted");
        } catch (Exception e) {
            LOGGER.warn("TRANSCRIBE failed item={} name={} reason={}", item.index(), item.displayName(), e.getMessage());
            return StageResult.failure(TRANSCRIPTION_ERROR, messageOf(e));
        }
    }

    private StageResult<String> summarize(WorkItem item, Transcript transcript) {
        try {
            return StageResult.success(summarizer.summarize(transcript));
        } catch (RuntimeException e) {
            LOGGER.warn("SUMMARIZE failed item={} name={} reason={}", item.index(), item.displayName(), e.getMessage());
            return StageResult.failure(SUMMARIZATION_ERROR, messageOf(e));
        }
    }

    private void cleanup(WorkItem item) {
        for (Path file : item.tempFiles()) {
            try {
                storage.delete(file);
            } catch (StorageException e) {
                LOGGER.warn("CLEANUP failed item={} file={} reason={}", item.index(), file, e.getMessage());
            }
        }
    }

    private static String describe(Duration timeout) {
        long minutes = timeout.toMinutes();
        return minutes > 0 && timeout.equals(Duration.ofMinutes(minutes)) ? minutes + " min" : timeout.toMillis() + " ms";
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() == null || e.getMessage().isBlank() ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static String rootMessage(Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return messageOf(t);
    }
}
