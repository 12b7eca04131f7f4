package com.example.videocompare_backend.service.pipeline;

import com.example.videocompare_backend.config.SummarizerProperties;
import com.example.videocompare_backend.engine.Interfaces.TranscriptionEngine;
import com.example.videocompare_backend.exception.SummarizationException;
import com.example.videocompare_backend.exception.TranscriptionException;
import com.example.videocompare_backend.model.AcquiredMedia;
import com.example.videocompare_backend.model.MediaSource;
import com.example.videocompare_backend.model.WorkItem;
import com.example.videocompare_backend.model.WorkItemState;
import com.example.videocompare_backend.service.LocalStorageService;
import com.example.videocompare_backend.service.pipeline.PipelineOrchestrator.PipelineOutcome;
import com.example.videocompare_backend.service.summary.ChunkedSummarizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineOrchestratorTest {

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private LocalStorageService storage;
    private ChunkedSummarizer summarizer;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        storage = new LocalStorageService(tempDir, "scratch", "downloads");
        summarizer = new ChunkedSummarizer((text, max, min) -> {
            if (text.contains("garbled")) {
                throw new SummarizationException("model rejected input");
            }
            return "summary of " + text;
        }, new SummarizerProperties());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void silentVideoIsSkippedWhileSiblingsSucceed() throws Exception {
        TranscriptionEngine engine = req -> {
            Files.writeString(req.audioFile(), "pcm");
            if (req.itemId().equals("1")) {
                throw new TranscriptionException("No audio track found in b.mp4");
            }
            return result("spoken words " + req.itemId());
        };
        PipelineOrchestrator orchestrator = orchestrator(engine, Duration.ZERO);

        PipelineOutcome outcome = orchestrator.run(media("a.mp4", "b.mp4", "c.mp4"));

        assertThat(outcome.succeeded()).extracting(WorkItem::index).containsExactly(0, 2);
        assertThat(outcome.succeeded()).extracting(WorkItem::summary)
                .containsExactly("summary of spoken words 0", "summary of spoken words 2");
        assertThat(outcome.succeeded()).allMatch(i -> i.state() == WorkItemState.SUMMARIZED);
        assertThat(outcome.skipped()).hasSize(1);
        WorkItem failed = outcome.skipped().get(0);
        assertThat(failed.displayName()).isEqualTo("b.mp4");
        assertThat(failed.state()).isEqualTo(WorkItemState.FAILED);
        assertThat(failed.failureTag()).isEqualTo(PipelineOrchestrator.TRANSCRIPTION_ERROR);
        assertThat(failed.failureDescription()).contains("No audio track found in b.mp4");
    }

    @Test
    void everyTempFileIsRemovedOnSuccessAndFailure() throws Exception {
        TranscriptionEngine engine = req -> {
            Files.writeString(req.audioFile(), "pcm");
            if (req.itemId().equals("0")) {
                throw new TranscriptionException("decoder crashed");
            }
            return result(req.itemId().equals("1") ? "garbled" : "fine text");
        };

        PipelineOutcome outcome = orchestrator(engine, Duration.ZERO).run(media("a.mp4", "b.mp4", "c.mp4"));

        assertThat(outcome.succeeded()).hasSize(1);
        assertThat(outcome.skipped()).extracting(WorkItem::failureTag)
                .containsExactly(PipelineOrchestrator.TRANSCRIPTION_ERROR, PipelineOrchestrator.SUMMARIZATION_ERROR);
        assertThat(scratchFiles()).isEmpty();
    }

    @Test
    void resultsKeepSubmissionOrderRegardlessOfCompletionOrder() throws Exception {
        TranscriptionEngine engine = req -> {
            if (req.itemId().equals("0")) {
                Thread.sleep(300);
            }
            return result("text " + req.itemId());
        };

        PipelineOutcome outcome = orchestrator(engine, Duration.ZERO).run(media("slow.mp4", "fast.mp4", "faster.mp4"));

        assertThat(outcome.succeeded()).extracting(WorkItem::displayName)
                .containsExactly("slow.mp4", "fast.mp4", "faster.mp4");
        assertThat(outcome.skipped()).isEmpty();
    }

    @Test
    void emptyTranscriptStillProducesASummary() throws Exception {
        PipelineOutcome outcome = orchestrator(req -> result("  "), Duration.ZERO).run(media("quiet.mp4"));

        assertThat(outcome.succeeded()).extracting(WorkItem::summary).containsExactly(ChunkedSummarizer.EMPTY_SUMMARY);
    }

    @Test
    void hungItemIsFailedAfterDeadlineWithoutBlockingSiblings() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        TranscriptionEngine engine = req -> {
            if (req.itemId().equals("0")) {
                release.await(10, TimeUnit.SECONDS);
            }
            return result("text " + req.itemId());
        };

        try {
            PipelineOutcome outcome = orchestrator(engine, Duration.ofMillis(300)).run(media("stuck.mp4", "ok.mp4"));

            assertThat(outcome.succeeded()).extracting(WorkItem::displayName).containsExactly("ok.mp4");
            assertThat(outcome.skipped()).extracting(WorkItem::failureTag).containsExactly(PipelineOrchestrator.TIMEOUT_ERROR);
            assertThat(outcome.skipped().get(0).failureDescription()).contains("300 ms");
        } finally {
            release.countDown();
        }
    }

    @Test
    void lateCompletionDoesNotOverrideTimeoutFailure() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        TranscriptionEngine engine = req -> {
            try {
                release.await(10, TimeUnit.SECONDS);
                return result("late text");
            } finally {
                finished.countDown();
            }
        };

        PipelineOutcome outcome = orchestrator(engine, Duration.ofMillis(200)).run(media("late.mp4"));
        release.countDown();
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);

        WorkItem item = outcome.skipped().get(0);
        assertThat(item.state()).isEqualTo(WorkItemState.FAILED);
        assertThat(item.summary()).isNull();
    }

    private PipelineOrchestrator orchestrator(TranscriptionEngine engine, Duration timeout) {
        return new PipelineOrchestrator(executor, engine, summarizer, storage, timeout);
    }

    private List<AcquiredMedia> media(String... names) throws IOException {
        List<AcquiredMedia> out = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            Path file = storage.newScratchFile("mp4");
            Files.writeString(file, "video " + i);
            out.add(new AcquiredMedia(MediaSource.ofUpload(i, names[i], null), file, names[i]));
        }
        return out;
    }

    private List<Path> scratchFiles() throws IOException {
        try (Stream<Path> files = Files.list(storage.scratchDir())) {
            return files.toList();
        }
    }

    private static TranscriptionEngine.Result result(String text) {
        return new TranscriptionEngine.Result(text, "en");
    }
}
