package com.example.videocompare_backend.model;

public record RankedVideo(int index, String name, SummaryResult result) {
}
