package com.example.videocompare_backend.service.compare;

import com.example.videocompare_backend.engine.Interfaces.EmbeddingEngine;
import com.example.videocompare_backend.exception.EmbeddingException;
import com.example.videocompare_backend.model.ComparisonScores;
import com.example.videocompare_backend.model.ScoreDetails;
import com.example.videocompare_backend.util.TokenUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Scores summaries against a topic with a weighted blend of embedding similarity,
 * topic keyword coverage and conciseness, and picks the best one.
 */
@Service
public class SummaryComparator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SummaryComparator.class);

    public static final double SEMANTIC_WEIGHT = 0.65;
    public static final double COVERAGE_WEIGHT = 0.20;
    public static final double CONCISENESS_WEIGHT = 0.15;

    public static final int TARGET_WORDS = 140;
    public static final int WORD_LOWER_BOUND = 60;

    private final EmbeddingEngine embeddingEngine;

    public SummaryComparator(EmbeddingEngine embeddingEngine) {
        this.embeddingEngine = embeddingEngine;
    }

    /**
     * @param summaries ordered, non-empty
     * @return scores and details index-aligned with {@code summaries}; ties go to the lowest index
     */
    public ComparisonScores score(List<String> summaries, String topic) {
        if (summaries.isEmpty()) {
            throw new IllegalArgumentException("Nothing to compare");
        }
        double[] semantics = semanticScores(summaries, topic);
        Set<String> topicTokens = TokenUtil.distinctLowercase(topic);
        List<Double> scores = new ArrayList<>(summaries.size());
        List<ScoreDetails> details = new ArrayList<>(summaries.size());
        int best = 0;
        for (int i = 0; i < summaries.size(); i++) {
            String summary = summaries.get(i);
            int words = TokenUtil.count(summary);
            double semantic = semantics[i];
            double coverage = coverage(topicTokens, TokenUtil.distinctLowercase(summary));
            double conciseness = conciseness(words);
            double composite = composite(semantic, coverage, conciseness);
            scores.add(composite);
            details.add(new ScoreDetails(semantic, coverage, conciseness, composite, words));
            if (composite > scores.get(best)) {
                best = i;
            }
        }
        LOGGER.info("COMPARE scored={} best={} bestScore={}", summaries.size(), best, scores.get(best));
        return new ComparisonScores(best, scores, details);
    }

    /**
     * Embeds the topic and every non-blank summary in one batch. Blank texts are never sent and
     * score 0; a blank topic needs no call at all.
     */
    private double[] semanticScores(List<String> summaries, String topic) {
        double[] semantics = new double[summaries.size()];
        if (topic == null || topic.isBlank()) {
            LOGGER.info("COMPARE blank topic, semantic similarity is 0 for all {} summaries", summaries.size());
            return semantics;
        }
        List<String> batch = new ArrayList<>(summaries.size() + 1);
        List<Integer> positions = new ArrayList<>(summaries.size());
        batch.add(topic);
        for (int i = 0; i < summaries.size(); i++) {
            if (summaries.get(i) != null && !summaries.get(i).isBlank()) {
                batch.add(summaries.get(i));
                positions.add(i);
            }
        }
        if (positions.isEmpty()) {
            return semantics;
        }
        List<float[]> vectors = embeddingEngine.embed(batch);
        if (vectors.size() != batch.size()) {
            throw new EmbeddingException("Expected " + batch.size() + " embeddings, got " + vectors.size());
        }
        float[] topicVector = vectors.get(0);
        for (int k = 0; k < positions.size(); k++) {
            semantics[positions.get(k)] = cosine(topicVector, vectors.get(k + 1));
        }
        return semantics;
    }

    static double coverage(Set<String> topicTokens, Set<String> summaryTokens) {
        long hits = topicTokens.stream().filter(summaryTokens::contains).count();
        return (double) hits / Math.max(1, topicTokens.size());
    }

    static double conciseness(int wordCount) {
        return Math.min(1.0, (double) TARGET_WORDS / Math.max(WORD_LOWER_BOUND, wordCount));
    }

    static double composite(double semantic, double coverage, double conciseness) {
        return SEMANTIC_WEIGHT * semantic + COVERAGE_WEIGHT * coverage + CONCISENESS_WEIGHT * conciseness;
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new EmbeddingException("Embedding dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
