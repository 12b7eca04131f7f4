package com.example.videocompare_backend.service.compare;

import com.example.videocompare_backend.engine.Interfaces.EmbeddingEngine;
import com.example.videocompare_backend.exception.EmbeddingException;
import com.example.videocompare_backend.model.ComparisonScores;
import com.example.videocompare_backend.model.ScoreDetails;
import com.example.videocompare_backend.util.TokenUtil;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SummaryComparatorTest {

    private static final String TOPIC = "electric car range comparison";

    @Test
    void weightsSumToOne() {
        double sum = SummaryComparator.SEMANTIC_WEIGHT + SummaryComparator.COVERAGE_WEIGHT + SummaryComparator.CONCISENESS_WEIGHT;
        assertThat(sum).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void coverageCountsDistinctTopicTokensCaseInsensitively() {
        double coverage = SummaryComparator.coverage(
                TokenUtil.distinctLowercase(TOPIC),
                TokenUtil.distinctLowercase("The ELECTRIC Car car is fast"));

        assertThat(coverage).isEqualTo(0.5);
    }

    @Test
    void emptyTopicYieldsZeroCoverage() {
        assertThat(SummaryComparator.coverage(TokenUtil.distinctLowercase("  "), TokenUtil.distinctLowercase("anything at all")))
                .isZero();
    }

    @Test
    void concisenessPenalizesLongSummariesOnly() {
        assertThat(SummaryComparator.conciseness(0)).isEqualTo(1.0);
        assertThat(SummaryComparator.conciseness(140)).isEqualTo(1.0);
        assertThat(SummaryComparator.conciseness(280)).isEqualTo(0.5);
        assertThat(SummaryComparator.conciseness(100_000)).isGreaterThan(0.0).isLessThan(0.01);
    }

    @Test
    void cosineOfZeroVectorIsZero() {
        assertThat(SummaryComparator.cosine(new float[]{0, 0}, new float[]{1, 1})).isZero();
        assertThat(SummaryComparator.cosine(new float[]{2, 0}, new float[]{5, 0})).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void focusedShortSummaryBeatsLooseLongOne() {
        String a = "electric car range " + words("detail", 117);
        String b = words("filler", 300);
        FakeEmbeddings embeddings = new FakeEmbeddings()
                .with(TOPIC, 1f, 0f)
                .with(a, 0.9f, 0.1f)
                .with(b, 0.5f, 0.5f);

        ComparisonScores scores = new SummaryComparator(embeddings).score(List.of(a, b), TOPIC);

        ScoreDetails da = scores.details().get(0);
        ScoreDetails db = scores.details().get(1);
        assertThat(da.wordCount()).isEqualTo(120);
        assertThat(db.wordCount()).isEqualTo(300);
        assertThat(da.semantic()).isGreaterThan(db.semantic());
        assertThat(da.conciseness()).isGreaterThan(db.conciseness());
        assertThat(scores.scores().get(0)).isGreaterThan(scores.scores().get(1));
        assertThat(scores.bestIndex()).isZero();
        assertThat(da.finalScore()).isEqualTo(SummaryComparator.composite(da.semantic(), da.coverage(), da.conciseness()));
    }

    @Test
    void embedsTopicAndSummariesInOneBatch() {
        FakeEmbeddings embeddings = new FakeEmbeddings()
                .with(TOPIC, 1f, 0f)
                .with("one", 1f, 0f)
                .with("two", 0f, 1f);

        new SummaryComparator(embeddings).score(List.of("one", "two"), TOPIC);

        assertThat(embeddings.batches).containsExactly(List.of(TOPIC, "one", "two"));
    }

    @Test
    void blankTopicScoresWithoutCallingTheEmbeddingService() {
        FakeEmbeddings embeddings = new FakeEmbeddings();
        String longer = words("filler", 280);

        ComparisonScores scores = new SummaryComparator(embeddings).score(List.of(longer, "short clip"), "  ");

        assertThat(embeddings.batches).isEmpty();
        assertThat(scores.details()).allSatisfy(d -> {
            assertThat(d.semantic()).isZero();
            assertThat(d.coverage()).isZero();
        });
        assertThat(scores.details().get(0).conciseness()).isEqualTo(0.5);
        assertThat(scores.bestIndex()).isEqualTo(1);
    }

    @Test
    void blankSummariesAreNotSentForEmbedding() {
        FakeEmbeddings embeddings = new FakeEmbeddings()
                .with(TOPIC, 1f, 0f)
                .with("electric car", 1f, 0f);

        ComparisonScores scores = new SummaryComparator(embeddings).score(List.of("", "electric car"), TOPIC);

        assertThat(embeddings.batches).containsExactly(List.of(TOPIC, "electric car"));
        assertThat(scores.details().get(0).semantic()).isZero();
        assertThat(scores.details().get(1).semantic()).isCloseTo(1.0, within(1e-9));
        assertThat(scores.bestIndex()).isEqualTo(1);
    }

    @Test
    void tiesGoToTheFirstOccurrence() {
        FakeEmbeddings embeddings = new FakeEmbeddings()
                .with(TOPIC, 1f, 0f)
                .with("weak", 0f, 1f)
                .with("strong", 1f, 0f);

        ComparisonScores scores = new SummaryComparator(embeddings).score(List.of("weak", "strong", "strong"), TOPIC);

        assertThat(scores.scores().get(1)).isEqualTo(scores.scores().get(2));
        assertThat(scores.bestIndex()).isEqualTo(1);
    }

    @Test
    void reorderingInputsReordersScores() {
        FakeEmbeddings embeddings = new FakeEmbeddings()
                .with(TOPIC, 1f, 0f)
                .with("electric range test", 0.8f, 0.2f)
                .with("car review", 0.3f, 0.7f)
                .with(words("long", 200), 0.6f, 0.6f);
        SummaryComparator comparator = new SummaryComparator(embeddings);
        List<String> original = List.of("electric range test", "car review", words("long", 200));
        List<String> permuted = List.of(words("long", 200), "electric range test", "car review");

        ComparisonScores first = comparator.score(original, TOPIC);
        ComparisonScores second = comparator.score(permuted, TOPIC);

        assertThat(second.scores()).containsExactly(first.scores().get(2), first.scores().get(0), first.scores().get(1));
        assertThat(original.get(first.bestIndex())).isEqualTo(permuted.get(second.bestIndex()));
    }

    @Test
    void scoresStayWithinSignalBounds() {
        FakeEmbeddings embeddings = new FakeEmbeddings()
                .with(TOPIC, 1f, 0f)
                .with("comparison comparison comparison", -1f, 0f);

        ScoreDetails d = new SummaryComparator(embeddings).score(List.of("comparison comparison comparison"), TOPIC)
                .details().get(0);

        assertThat(d.coverage()).isBetween(0.0, 1.0);
        assertThat(d.conciseness()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        assertThat(d.semantic()).isCloseTo(-1.0, within(1e-9));
    }

    @Test
    void wrongNumberOfVectorsIsAnEmbeddingError() {
        EmbeddingEngine broken = texts -> List.of(new float[]{1f});

        assertThatThrownBy(() -> new SummaryComparator(broken).score(List.of("a", "b"), TOPIC))
                .isInstanceOf(EmbeddingException.class);
    }

    private static String words(String word, int count) {
        return String.join(" ", Collections.nCopies(count, word));
    }

    private static final class FakeEmbeddings implements EmbeddingEngine {
        private final Map<String, float[]> vectors = new HashMap<>();
        private final List<List<String>> batches = new ArrayList<>();

        FakeEmbeddings with(String text, float x, float y) {
            vectors.put(text, new float[]{x, y});
            return this;
        }

        @Override
        public List<float[]> embed(List<String> texts) {
            batches.add(List.copyOf(texts));
            return texts.stream().map(t -> {
                float[] v = vectors.get(t);
                if (v == null) {
                    throw new IllegalArgumentException("no vector for " + t);
                }
                return v;
            }).toList();
        }
    }
}
