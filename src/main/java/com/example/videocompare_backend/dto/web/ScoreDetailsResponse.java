package com.example.videocompare_backend.dto.web;

import com.example.videocompare_backend.model.ScoreDetails;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ScoreDetailsResponse(
        double semantic,
        double coverage,
        double conciseness,
        @JsonProperty("final") double finalScore,
        @JsonProperty("word_count") int wordCount
) {
    public static ScoreDetailsResponse from(ScoreDetails d) {
        return new ScoreDetailsResponse(d.semantic(), d.coverage(), d.conciseness(), d.finalScore(), d.wordCount());
    }
}
