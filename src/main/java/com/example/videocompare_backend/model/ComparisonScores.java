package com.example.videocompare_backend.model;

import java.util.List;

public record ComparisonScores(int bestIndex, List<Double> scores, List<ScoreDetails> details) {
}
