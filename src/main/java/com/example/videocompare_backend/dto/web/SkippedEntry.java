package com.example.videocompare_backend.dto.web;

import com.example.videocompare_backend.model.SkipEntry;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Processing failures carry {@code name}, download failures carry {@code url}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SkippedEntry(String name, String url, String error) {

    public static SkippedEntry from(SkipEntry entry) {
        return new SkippedEntry(entry.name(), entry.url(), entry.error());
    }
}
