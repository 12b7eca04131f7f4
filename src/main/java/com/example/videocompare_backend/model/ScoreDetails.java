package com.example.videocompare_backend.model;

/**
 * Diagnostic breakdown of one summary's composite relevance score.
 */
public record ScoreDetails(double semantic,
                           double coverage,
                           double conciseness,
                           double finalScore,
                           int wordCount) {
}
