package com.example.videocompare_backend.dto.web;

import com.example.videocompare_backend.model.ComparisonReport;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ComparisonResponse(
        String topic,
        List<VideoEntry> videos,
        List<SkippedEntry> skipped,
        @JsonProperty("best_video") String bestVideo
) {
    public static ComparisonResponse from(ComparisonReport report) {
        return new ComparisonResponse(
                report.topic(),
                report.videos().stream().map(VideoEntry::from).toList(),
                report.skipped().stream().map(SkippedEntry::from).toList(),
                report.bestVideo());
    }
}
