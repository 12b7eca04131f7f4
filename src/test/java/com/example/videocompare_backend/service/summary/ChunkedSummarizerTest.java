package com.example.videocompare_backend.service.summary;

import com.example.videocompare_backend.config.SummarizerProperties;
import com.example.videocompare_backend.engine.Interfaces.SummarizationEngine;
import com.example.videocompare_backend.exception.SummarizationException;
import com.example.videocompare_backend.model.LengthBounds;
import com.example.videocompare_backend.model.Transcript;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkedSummarizerTest {

    @Test
    void blankTranscriptSkipsTheEngine() {
        RecordingEngine engine = new RecordingEngine();
        ChunkedSummarizer summarizer = new ChunkedSummarizer(engine, new SummarizerProperties());

        assertThat(summarizer.summarize(Transcript.of("   "))).isEqualTo(ChunkedSummarizer.EMPTY_SUMMARY);
        assertThat(engine.calls).isEmpty();
    }

    @Test
    void veryShortInputShrinksBounds() {
        RecordingEngine engine = new RecordingEngine();
        ChunkedSummarizer summarizer = new ChunkedSummarizer(engine, new SummarizerProperties());

        String result = summarizer.summarize(Transcript.of("a b c d e"));

        assertThat(result).isEqualTo("summary-1");
        assertThat(engine.calls).containsExactly(new Call("a b c d e", 60, 10));
    }

    @Test
    void inputShorterThanRequestedMaxIsCappedToItsLength() {
        RecordingEngine engine = new RecordingEngine();
        ChunkedSummarizer summarizer = new ChunkedSummarizer(engine, new SummarizerProperties());

        summarizer.summarize(Transcript.of(words("w", 100)));

        assertThat(engine.calls).hasSize(1);
        assertThat(engine.calls.get(0).maxLength()).isEqualTo(100);
        assertThat(engine.calls.get(0).minLength()).isEqualTo(25);
    }

    @Test
    void inputWithinBudgetIsSummarizedDirectlyWithRequestedBounds() {
        RecordingEngine engine = new RecordingEngine();
        ChunkedSummarizer summarizer = new ChunkedSummarizer(engine, new SummarizerProperties());
        String text = words("w", 400);

        summarizer.summarize(Transcript.of(text), new LengthBounds(180, 60));

        assertThat(engine.calls).containsExactly(new Call(text, 180, 60));
    }

    @Test
    void overBudgetInputIsMappedPerWindowThenReducedOverTruncatedPartials() {
        RecordingEngine engine = new RecordingEngine();
        engine.partialWords = 6;
        SummarizerProperties props = new SummarizerProperties();
        props.setInputTokenBudget(10);
        props.setChunkTokens(10);
        props.setMapMaxLength(8);
        props.setMapMinLength(2);
        props.setMaxLength(6);
        props.setMinLength(3);
        ChunkedSummarizer summarizer = new ChunkedSummarizer(engine, props);

        String transcript = IntStream.range(0, 25).mapToObj(i -> "t" + i).collect(Collectors.joining(" "));
        String result = summarizer.summarize(Transcript.of(transcript));

        assertThat(engine.calls).hasSize(4);
        assertThat(engine.calls.get(0)).isEqualTo(new Call("t0 t1 t2 t3 t4 t5 t6 t7 t8 t9", 8, 2));
        assertThat(engine.calls.get(1)).isEqualTo(new Call("t10 t11 t12 t13 t14 t15 t16 t17 t18 t19", 8, 2));
        assertThat(engine.calls.get(2)).isEqualTo(new Call("t20 t21 t22 t23 t24", 8, 2));
        // three partials of six words each, cut at the ten token budget
        assertThat(engine.calls.get(3)).isEqualTo(new Call("p1 w w w w w p2 w w w", 6, 3));
        assertThat(result).isEqualTo("p4 w w w w w");
    }

    @Test
    void failedCallIsRetriedOnceWithHalvedBounds() {
        RecordingEngine engine = new RecordingEngine();
        engine.failures = 1;
        ChunkedSummarizer summarizer = new ChunkedSummarizer(engine, new SummarizerProperties());

        String result = summarizer.summarize(Transcript.of(words("w", 400)), new LengthBounds(180, 60));

        assertThat(result).isEqualTo("summary-2");
        assertThat(engine.calls).extracting(Call::maxLength).containsExactly(180, 90);
        assertThat(engine.calls).extracting(Call::minLength).containsExactly(60, 30);
    }

    @Test
    void secondFailurePropagates() {
        RecordingEngine engine = new RecordingEngine();
        engine.failures = 2;
        ChunkedSummarizer summarizer = new ChunkedSummarizer(engine, new SummarizerProperties());

        assertThatThrownBy(() -> summarizer.summarize(Transcript.of("a b c")))
                .isInstanceOf(SummarizationException.class)
                .hasMessageContaining("model overloaded");
        assertThat(engine.calls).hasSize(2);
    }

    @Test
    void boundsForInputNeverRaisesRequestedBounds() {
        LengthBounds requested = new LengthBounds(40, 8);

        assertThat(ChunkedSummarizer.boundsForInput(5, requested)).isEqualTo(new LengthBounds(40, 8));
        assertThat(ChunkedSummarizer.boundsForInput(35, requested)).isEqualTo(new LengthBounds(40, 8));
        assertThat(ChunkedSummarizer.boundsForInput(500, requested)).isEqualTo(requested);
    }

    private static String words(String word, int count) {
        return String.join(" ", Collections.nCopies(count, word));
    }

    record Call(String text, int maxLength, int minLength) {
    }

    private static final class RecordingEngine implements SummarizationEngine {
        private final List<Call> calls = new ArrayList<>();
        private int failures;
        private int partialWords;

        @Override
        public String summarize(String text, int maxLength, int minLength) {
            calls.add(new Call(text, maxLength, minLength));
            if (failures > 0) {
                failures--;
                throw new SummarizationException("model overloaded");
            }
            if (partialWords > 0) {
                return "p" + calls.size() + " " + words("w", partialWords - 1);
            }
            return "summary-" + calls.size();
        }
    }
}
