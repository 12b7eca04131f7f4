package com.example.videocompare_backend.dto.web;

import com.example.videocompare_backend.model.RankedVideo;

public record VideoEntry(String name, String summary, double score, ScoreDetailsResponse details) {

    public static VideoEntry from(RankedVideo video) {
        return new VideoEntry(video.name(), video.result().summary(), video.result().score(),
                ScoreDetailsResponse.from(video.result().details()));
    }
}
