package com.example.videocompare_backend.model;

import java.util.List;

/**
 * Result of one comparison request. Every requested source appears in exactly one of
 * {@code videos} or {@code skipped}; both lists follow submission order.
 */
public record ComparisonReport(String topic,
                               List<RankedVideo> videos,
                               List<SkipEntry> skipped,
                               String bestVideo) {

    public ComparisonReport {
        videos = List.copyOf(videos);
        skipped = List.copyOf(skipped);
    }
}
