package com.example.videocompare_backend.model;

public record SummaryResult(String summary, ScoreDetails details) {

    public double score() {
        return details.finalScore();
    }
}
